package com.eainde.flowconverter.exception;

/**
 * Unexpected failure while assembling one of the program sections.
 */
public class CodeGenerationException extends FlowConverterException {

    private static final long serialVersionUID = 1L;

    public CodeGenerationException(String message) {
        super(message);
    }

    public CodeGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ConversionException.ErrorKind kind() {
        return ConversionException.ErrorKind.GENERATION;
    }
}
