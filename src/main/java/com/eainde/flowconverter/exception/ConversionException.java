package com.eainde.flowconverter.exception;

import lombok.Getter;

/**
 * The single error type a caller of {@code FlowConverter} ever sees.
 *
 * <p>Wraps the first root cause of a failed conversion and tags it with an
 * {@link ErrorKind}. The message is the root cause's message, unchanged, so
 * callers can log it without unwrapping.</p>
 */
@Getter
public class ConversionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum ErrorKind {
        /** Malformed document or missing required top-level field. */
        LOAD,
        /** Edge endpoint not found among the nodes. */
        REFERENCE,
        /** Failure while assembling output sections or writing the output. */
        GENERATION,
        /** Program invalid after the permitted repair attempt. */
        VALIDATION
    }

    private final ErrorKind kind;

    public ConversionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ConversionException wrap(FlowConverterException cause) {
        return new ConversionException(cause.kind(), cause.getMessage(), cause);
    }

    @Override
    public String toString() {
        return "ConversionException{" +
                "kind=" + kind +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
