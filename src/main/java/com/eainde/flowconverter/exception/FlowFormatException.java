package com.eainde.flowconverter.exception;

/**
 * The flow document is not well-formed JSON, its root is not an object,
 * or the file could not be read at all.
 */
public class FlowFormatException extends FlowConverterException {

    private static final long serialVersionUID = 1L;

    public FlowFormatException(String message) {
        super(message);
    }

    public FlowFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ConversionException.ErrorKind kind() {
        return ConversionException.ErrorKind.LOAD;
    }
}
