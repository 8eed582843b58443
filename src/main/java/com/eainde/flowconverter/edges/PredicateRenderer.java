package com.eainde.flowconverter.edges;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a {@link GuardExpression} as a Python boolean expression over {@code state}.
 *
 * <p>Field references become {@code state.get('f')}; where a missing field would
 * raise (membership container, {@code len()} argument, method receiver) they
 * become {@code state.get('f', '')}. String literals use single quotes.</p>
 */
public final class PredicateRenderer {

    private PredicateRenderer() {}

    public static String render(GuardExpression expression) {
        if (expression instanceof GuardExpression.Or or) {
            return join(or.operands(), " or ", false);
        }
        if (expression instanceof GuardExpression.And and) {
            return join(and.operands(), " and ", true);
        }
        if (expression instanceof GuardExpression.Not not) {
            GuardExpression inner = not.operand();
            return inner instanceof GuardExpression.Group ? "not " + render(inner) : "not (" + render(inner) + ")";
        }
        if (expression instanceof GuardExpression.Group group) {
            return "(" + render(group.inner()) + ")";
        }
        if (expression instanceof GuardExpression.Truthy truthy) {
            return render(truthy.operand(), false);
        }
        GuardExpression.Comparison comparison = (GuardExpression.Comparison) expression;
        boolean container = comparison.operator().isMembership();
        return render(comparison.left(), false) + " " + comparison.operator().symbol() + " "
                + render(comparison.right(), container);
    }

    private static String join(List<GuardExpression> operands, String connective, boolean parenthesizeOr) {
        return operands.stream()
                .map(operand -> parenthesizeOr && operand instanceof GuardExpression.Or
                        ? "(" + render(operand) + ")"
                        : render(operand))
                .collect(Collectors.joining(connective));
    }

    static String render(Operand operand, boolean needsDefault) {
        if (operand instanceof Operand.FieldRef field) {
            return needsDefault
                    ? "state.get(" + quote(field.name()) + ", '')"
                    : "state.get(" + quote(field.name()) + ")";
        }
        if (operand instanceof Operand.Literal literal) {
            return literalText(literal);
        }
        if (operand instanceof Operand.ListLiteral list) {
            return "[" + renderAll(list.elements()) + "]";
        }
        if (operand instanceof Operand.FunctionCall call) {
            boolean lenCall = "len".equals(call.name());
            return call.name() + "(" + call.arguments().stream()
                    .map(argument -> render(argument, lenCall))
                    .collect(Collectors.joining(", ")) + ")";
        }
        Operand.MethodCall call = (Operand.MethodCall) operand;
        return render(call.target(), true) + "." + call.method() + "(" + renderAll(call.arguments()) + ")";
    }

    private static String renderAll(List<Operand> operands) {
        return operands.stream().map(operand -> render(operand, false)).collect(Collectors.joining(", "));
    }

    /** Python source text of a literal. */
    public static String literalText(Operand.Literal literal) {
        return literal.kind() == Operand.LiteralKind.STRING ? quote(literal.value()) : literal.value();
    }

    /** Single-quoted Python string literal. */
    public static String quote(String value) {
        StringBuilder out = new StringBuilder("'");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\'' -> out.append("\\'");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        return out.append('\'').toString();
    }
}
