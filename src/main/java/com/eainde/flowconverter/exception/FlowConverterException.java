package com.eainde.flowconverter.exception;

/**
 * Base type for every failure raised while turning a flow document into a program.
 *
 * <p>Subclasses map one-to-one onto {@link ConversionException.ErrorKind}, which is
 * how {@code FlowConverter} tags the failure when it reaches the caller.</p>
 */
public abstract class FlowConverterException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected FlowConverterException(String message) {
        super(message);
    }

    protected FlowConverterException(String message, Throwable cause) {
        super(message, cause);
    }

    /** The top-level error kind this failure is reported under. */
    public abstract ConversionException.ErrorKind kind();
}
