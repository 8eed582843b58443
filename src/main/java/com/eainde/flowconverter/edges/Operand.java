package com.eainde.flowconverter.edges;

import java.util.List;
import java.util.Objects;

/**
 * A value position inside a guard comparison.
 */
public sealed interface Operand
        permits Operand.FieldRef, Operand.Literal, Operand.ListLiteral, Operand.FunctionCall, Operand.MethodCall {

    /**
     * A state field. Bare names, {@code state["f"]} and {@code state.get("f")}
     * all resolve to the field {@code f}.
     */
    record FieldRef(String name) implements Operand {
        public FieldRef {
            Objects.requireNonNull(name, "name");
        }
    }

    enum LiteralKind { STRING, INTEGER, FLOAT, BOOLEAN, NONE }

    /**
     * A constant. {@code value} is the unquoted text for strings and the source
     * text otherwise ({@code 42}, {@code 0.5}, {@code True}, {@code None}).
     */
    record Literal(LiteralKind kind, String value) implements Operand {
        public Literal {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(value, "value");
        }

        public static Literal string(String value) {
            return new Literal(LiteralKind.STRING, value);
        }

        public static Literal number(String text) {
            return new Literal(text.contains(".") ? LiteralKind.FLOAT : LiteralKind.INTEGER, text);
        }
    }

    record ListLiteral(List<Operand> elements) implements Operand {
        public ListLiteral {
            elements = List.copyOf(elements);
        }
    }

    /** {@code name(args...)}, e.g. {@code len(documents)}. */
    record FunctionCall(String name, List<Operand> arguments) implements Operand {
        public FunctionCall {
            Objects.requireNonNull(name, "name");
            arguments = List.copyOf(arguments);
        }
    }

    /** {@code target.method(args...)}, e.g. {@code query.startswith("sql")}. */
    record MethodCall(Operand target, String method, List<Operand> arguments) implements Operand {
        public MethodCall {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(method, "method");
            arguments = List.copyOf(arguments);
        }
    }
}
