package com.eainde.flowconverter.exception;

import lombok.Getter;

import java.util.List;

/**
 * The emitted program still fails structural or syntax checks after the
 * single automatic repair pass.
 */
@Getter
public class ProgramValidationException extends FlowConverterException {

    private static final long serialVersionUID = 1L;

    private final List<String> issues;

    public ProgramValidationException(List<String> issues) {
        super(buildMessage(issues));
        this.issues = List.copyOf(issues);
    }

    private static String buildMessage(List<String> issues) {
        StringBuilder message = new StringBuilder("Generated program failed validation after repair:");
        for (String issue : issues) {
            message.append("\n- ").append(issue);
        }
        return message.toString();
    }

    @Override
    public ConversionException.ErrorKind kind() {
        return ConversionException.ErrorKind.VALIDATION;
    }
}
