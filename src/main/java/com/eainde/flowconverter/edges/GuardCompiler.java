package com.eainde.flowconverter.edges;

import com.eainde.flowconverter.document.EdgeSpec;
import com.eainde.flowconverter.model.GraphModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the guarded edges leaving one node into a {@link RoutingPlan}.
 *
 * <p>Decision, per source:</p>
 * <ol>
 *   <li>not every edge carries a guard → {@link RoutingPlan.PassThrough};</li>
 *   <li>every guard is {@code f == "literal"} on one shared field → {@link RoutingPlan.DirectTable};</li>
 *   <li>every guard parses and at least one references state → {@link RoutingPlan.SyntheticRouter};</li>
 *   <li>otherwise {@link RoutingPlan.PassThrough}, keeping the guard text as comments.</li>
 * </ol>
 *
 * <p>Unparseable guards are never an error here.</p>
 */
@Slf4j
@Component
public class GuardCompiler {

    /** Compiles every source of {@code model}, keyed by source id in first-appearance order. */
    public Map<String, RoutingPlan> compileAll(GraphModel model) {
        Map<String, RoutingPlan> plans = new LinkedHashMap<>();
        model.edgesBySource().forEach((source, edges) -> plans.put(source, compile(edges)));
        return plans;
    }

    /**
     * @param edges outgoing edges of a single source, in declaration order; must not be empty
     */
    public RoutingPlan compile(List<EdgeSpec> edges) {
        if (edges == null || edges.isEmpty()) {
            throw new IllegalArgumentException("At least one edge is required");
        }
        String source = edges.get(0).source();
        for (EdgeSpec edge : edges) {
            if (!edge.source().equals(source)) {
                throw new IllegalArgumentException(
                        "Edges from several sources: '" + source + "' and '" + edge.source() + "'");
            }
        }

        if (!edges.stream().allMatch(EdgeSpec::hasGuard)) {
            if (edges.stream().anyMatch(EdgeSpec::hasGuard)) {
                log.warn("Node '{}' mixes guarded and unguarded edges, guards kept as comments", source);
            }
            return new RoutingPlan.PassThrough(source, edges);
        }

        List<GuardExpression> guards = new ArrayList<>();
        for (EdgeSpec edge : edges) {
            Optional<GuardExpression> parsed = GuardParser.tryParse(edge.guardExpression());
            if (parsed.isEmpty()) {
                log.warn("Guard '{}' on edge {} -> {} could not be parsed, routing falls back to plain edges",
                        edge.guardExpression(), edge.source(), edge.target());
                return new RoutingPlan.PassThrough(source, edges);
            }
            guards.add(parsed.get());
        }

        Optional<RoutingPlan.DirectTable> table = directTable(source, edges, guards);
        if (table.isPresent()) {
            log.debug("Node '{}' routes on field '{}' through a value table", source, table.get().field());
            return table.get();
        }

        boolean anyFeature = guards.stream().map(GuardFeatures::of).anyMatch(GuardFeatures::hasAnyFeature);
        if (!anyFeature) {
            log.warn("Guards leaving '{}' reference no state fields, routing falls back to plain edges", source);
            return new RoutingPlan.PassThrough(source, edges);
        }

        List<RoutingPlan.Branch> branches = new ArrayList<>();
        for (int i = 0; i < edges.size(); i++) {
            branches.add(new RoutingPlan.Branch(PredicateRenderer.render(guards.get(i)), edges.get(i).target()));
        }
        String defaultTarget = edges.get(edges.size() - 1).target();
        log.debug("Node '{}' routes through a decision function with {} branches", source, branches.size());
        return new RoutingPlan.SyntheticRouter(source, branches, defaultTarget);
    }

    /**
     * Matches the shape {@code field == "literal"} (either operand order, any
     * enclosing parentheses) on every guard, all on the same field. Later
     * duplicate values overwrite earlier ones.
     */
    private Optional<RoutingPlan.DirectTable> directTable(String source, List<EdgeSpec> edges,
                                                          List<GuardExpression> guards) {
        String field = null;
        Map<String, String> valueToTarget = new LinkedHashMap<>();
        for (int i = 0; i < guards.size(); i++) {
            if (!(GuardExpression.unwrap(guards.get(i)) instanceof GuardExpression.Comparison comparison)
                    || comparison.operator() != ComparisonOperator.EQ) {
                return Optional.empty();
            }
            Optional<String[]> pair = fieldAndValue(comparison);
            if (pair.isEmpty() || (field != null && !field.equals(pair.get()[0]))) {
                return Optional.empty();
            }
            field = pair.get()[0];
            valueToTarget.put(pair.get()[1], edges.get(i).target());
        }
        return Optional.of(new RoutingPlan.DirectTable(source, field, valueToTarget));
    }

    private static Optional<String[]> fieldAndValue(GuardExpression.Comparison comparison) {
        if (comparison.left() instanceof Operand.FieldRef field && isString(comparison.right())) {
            return Optional.of(new String[]{field.name(), ((Operand.Literal) comparison.right()).value()});
        }
        if (comparison.right() instanceof Operand.FieldRef field && isString(comparison.left())) {
            return Optional.of(new String[]{field.name(), ((Operand.Literal) comparison.left()).value()});
        }
        return Optional.empty();
    }

    private static boolean isString(Operand operand) {
        return operand instanceof Operand.Literal literal && literal.kind() == Operand.LiteralKind.STRING;
    }
}
