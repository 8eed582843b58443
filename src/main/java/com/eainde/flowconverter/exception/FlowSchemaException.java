package com.eainde.flowconverter.exception;

/**
 * The flow document parsed but misses a required field (for example the
 * top-level {@code nodes} array) or violates node id uniqueness.
 */
public class FlowSchemaException extends FlowConverterException {

    private static final long serialVersionUID = 1L;

    public FlowSchemaException(String message) {
        super(message);
    }

    @Override
    public ConversionException.ErrorKind kind() {
        return ConversionException.ErrorKind.LOAD;
    }
}
