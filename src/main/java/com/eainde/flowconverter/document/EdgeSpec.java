package com.eainde.flowconverter.document;

import java.util.Objects;

/**
 * One edge of a flow document.
 *
 * @param source          id of the node the edge leaves
 * @param target          id of the node the edge enters
 * @param guardExpression the {@code data.condition} text, {@code null} for an unconditional edge
 */
public record EdgeSpec(
        String source,
        String target,
        String guardExpression
) {
    public EdgeSpec {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (guardExpression != null && guardExpression.isBlank()) {
            guardExpression = null;
        }
    }

    public static EdgeSpec unconditional(String source, String target) {
        return new EdgeSpec(source, target, null);
    }

    public static EdgeSpec guarded(String source, String target, String guardExpression) {
        return new EdgeSpec(source, target, guardExpression);
    }

    public boolean hasGuard() {
        return guardExpression != null;
    }
}
