package com.eainde.flowconverter.edges;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Structural summary of one guard, used to pick a routing strategy.
 *
 * @param equalityFields fields pinned to a value ({@code f == literal}, {@code f in [...]})
 * @param orderingFields fields compared with {@code != < > <= >=}
 * @param functionFields fields used through {@code len(f)}, {@code f.method(...)} or {@code "v" in f}
 * @param connective     whether {@code and}, {@code or} or {@code not} occurs
 * @param fieldReference whether any state field is referenced at all
 */
public record GuardFeatures(
        Set<String> equalityFields,
        Set<String> orderingFields,
        Set<String> functionFields,
        boolean connective,
        boolean fieldReference
) {
    public GuardFeatures {
        equalityFields = Collections.unmodifiableSet(new LinkedHashSet<>(equalityFields));
        orderingFields = Collections.unmodifiableSet(new LinkedHashSet<>(orderingFields));
        functionFields = Collections.unmodifiableSet(new LinkedHashSet<>(functionFields));
    }

    public boolean hasAnyFeature() {
        return fieldReference || !equalityFields.isEmpty() || !orderingFields.isEmpty() || !functionFields.isEmpty();
    }

    public static GuardFeatures of(GuardExpression expression) {
        Collector collector = new Collector();
        collector.visit(expression);
        return new GuardFeatures(collector.equality, collector.ordering, collector.function,
                collector.connective, collector.fieldReference);
    }

    private static final class Collector {
        private final Set<String> equality = new LinkedHashSet<>();
        private final Set<String> ordering = new LinkedHashSet<>();
        private final Set<String> function = new LinkedHashSet<>();
        private boolean connective;
        private boolean fieldReference;

        void visit(GuardExpression expression) {
            if (expression instanceof GuardExpression.Or or) {
                connective = true;
                or.operands().forEach(this::visit);
            } else if (expression instanceof GuardExpression.And and) {
                connective = true;
                and.operands().forEach(this::visit);
            } else if (expression instanceof GuardExpression.Not not) {
                connective = true;
                visit(not.operand());
            } else if (expression instanceof GuardExpression.Group group) {
                visit(group.inner());
            } else if (expression instanceof GuardExpression.Truthy truthy) {
                visit(truthy.operand());
            } else if (expression instanceof GuardExpression.Comparison comparison) {
                visitComparison(comparison);
            }
        }

        private void visitComparison(GuardExpression.Comparison comparison) {
            Operand left = comparison.left();
            Operand right = comparison.right();
            ComparisonOperator operator = comparison.operator();

            if (operator == ComparisonOperator.EQ) {
                if (left instanceof Operand.FieldRef field && right instanceof Operand.Literal) {
                    equality.add(field.name());
                } else if (right instanceof Operand.FieldRef field && left instanceof Operand.Literal) {
                    equality.add(field.name());
                }
            } else if (operator.isOrdering()) {
                if (left instanceof Operand.FieldRef field) {
                    ordering.add(field.name());
                }
                if (right instanceof Operand.FieldRef field) {
                    ordering.add(field.name());
                }
            } else if (operator.isMembership()) {
                if (left instanceof Operand.FieldRef field && right instanceof Operand.ListLiteral) {
                    equality.add(field.name());
                }
                if (right instanceof Operand.FieldRef field) {
                    function.add(field.name());
                }
            }
            visit(left);
            visit(right);
        }

        private void visit(Operand operand) {
            if (operand instanceof Operand.FieldRef) {
                fieldReference = true;
            } else if (operand instanceof Operand.FunctionCall call) {
                if ("len".equals(call.name()) && call.arguments().size() == 1
                        && call.arguments().get(0) instanceof Operand.FieldRef field) {
                    function.add(field.name());
                }
                call.arguments().forEach(this::visit);
            } else if (operand instanceof Operand.MethodCall call) {
                if (call.target() instanceof Operand.FieldRef field) {
                    function.add(field.name());
                }
                visit(call.target());
                call.arguments().forEach(this::visit);
            } else if (operand instanceof Operand.ListLiteral list) {
                list.elements().forEach(this::visit);
            }
        }
    }
}
