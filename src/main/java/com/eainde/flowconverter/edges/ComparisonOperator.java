package com.eainde.flowconverter.edges;

import java.util.Arrays;
import java.util.Optional;

/**
 * Binary comparison operators understood in guard expressions.
 */
public enum ComparisonOperator {

    EQ("=="),
    NE("!="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    IN("in"),
    NOT_IN("not in");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** {@code != < > <= >=}: comparisons that do not pin a field to a single value. */
    public boolean isOrdering() {
        return this == NE || this == LT || this == GT || this == LE || this == GE;
    }

    public boolean isMembership() {
        return this == IN || this == NOT_IN;
    }

    static Optional<ComparisonOperator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }
}
