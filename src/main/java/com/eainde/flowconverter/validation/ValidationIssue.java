package com.eainde.flowconverter.validation;

import java.util.Objects;

/**
 * One problem found in an emitted program.
 *
 * @param check   the check that reported it
 * @param line    1-based line number, or 0 when the issue is not tied to a line
 * @param message human readable description
 */
public record ValidationIssue(Check check, int line, String message) {

    public enum Check {
        /** A graph call names a node that was never registered. */
        REFERENCE,
        /** Missing or repeated entry / finish point. */
        ENTRY_EXIT,
        /** The module is not well-formed Python. */
        SYNTAX
    }

    public ValidationIssue {
        Objects.requireNonNull(check, "check");
        Objects.requireNonNull(message, "message");
    }

    static ValidationIssue syntax(int line, String message) {
        return new ValidationIssue(Check.SYNTAX, line, message);
    }

    @Override
    public String toString() {
        return line > 0
                ? check + " line " + line + ": " + message
                : check + ": " + message;
    }
}
