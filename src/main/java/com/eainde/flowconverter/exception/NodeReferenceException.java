package com.eainde.flowconverter.exception;

import lombok.Getter;

/**
 * An edge names a source or target id that no node in the document carries.
 */
@Getter
public class NodeReferenceException extends FlowConverterException {

    private static final long serialVersionUID = 1L;

    /** The id that could not be resolved. */
    private final String missingId;

    /** {@code "source"} or {@code "target"}. */
    private final String endpoint;

    public NodeReferenceException(String missingId, String endpoint) {
        super("Invalid edge: " + endpoint + " node '" + missingId + "' not found");
        this.missingId = missingId;
        this.endpoint = endpoint;
    }

    @Override
    public ConversionException.ErrorKind kind() {
        return ConversionException.ErrorKind.REFERENCE;
    }
}
