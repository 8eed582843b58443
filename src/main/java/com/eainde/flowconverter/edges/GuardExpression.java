package com.eainde.flowconverter.edges;

import java.util.List;
import java.util.Objects;

/**
 * Typed predicate tree produced by {@link GuardParser}.
 */
public sealed interface GuardExpression
        permits GuardExpression.Or, GuardExpression.And, GuardExpression.Not,
                GuardExpression.Comparison, GuardExpression.Truthy, GuardExpression.Group {

    record Or(List<GuardExpression> operands) implements GuardExpression {
        public Or {
            operands = List.copyOf(operands);
        }
    }

    record And(List<GuardExpression> operands) implements GuardExpression {
        public And {
            operands = List.copyOf(operands);
        }
    }

    record Not(GuardExpression operand) implements GuardExpression {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }
    }

    record Comparison(Operand left, ComparisonOperator operator, Operand right) implements GuardExpression {
        public Comparison {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }
    }

    /** An operand used as a condition on its own, e.g. {@code state.get("done")}. */
    record Truthy(Operand operand) implements GuardExpression {
        public Truthy {
            Objects.requireNonNull(operand, "operand");
        }
    }

    /** Explicit parentheses from the source text. */
    record Group(GuardExpression inner) implements GuardExpression {
        public Group {
            Objects.requireNonNull(inner, "inner");
        }
    }

    /** Strips any number of enclosing {@link Group}s. */
    static GuardExpression unwrap(GuardExpression expression) {
        GuardExpression current = expression;
        while (current instanceof Group group) {
            current = group.inner();
        }
        return current;
    }
}
