package com.eainde.flowconverter.edges;

/**
 * Raised by {@link GuardTokenizer} and {@link GuardParser} for guard text outside
 * the supported expression language. Callers treat it as "unparseable" and
 * degrade; it never reaches the conversion facade.
 */
public class GuardSyntaxException extends RuntimeException {

    private final int position;

    public GuardSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
