package com.eainde.flowconverter.edges;

import com.eainde.flowconverter.document.EdgeSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * How the outgoing edges of one source node are wired in the generated graph.
 */
public sealed interface RoutingPlan
        permits RoutingPlan.DirectTable, RoutingPlan.SyntheticRouter, RoutingPlan.PassThrough {

    String sourceId();

    /**
     * Every guard is {@code field == "literal"} on the same field: route on the
     * field's value through a literal-keyed mapping.
     *
     * @param valueToTarget string value → target node id, in edge order
     */
    record DirectTable(String sourceId, String field, Map<String, String> valueToTarget) implements RoutingPlan {
        public DirectTable {
            Objects.requireNonNull(sourceId, "sourceId");
            Objects.requireNonNull(field, "field");
            valueToTarget = Collections.unmodifiableMap(new LinkedHashMap<>(valueToTarget));
        }
    }

    /**
     * Guards are evaluated in declaration order by a generated decision function;
     * when none holds the router returns {@code defaultTarget}.
     */
    record SyntheticRouter(String sourceId, List<Branch> branches, String defaultTarget) implements RoutingPlan {
        public SyntheticRouter {
            Objects.requireNonNull(sourceId, "sourceId");
            Objects.requireNonNull(defaultTarget, "defaultTarget");
            branches = List.copyOf(branches);
        }

        /** Name of the decision function for a source registered as {@code sourceName}. */
        public static String routerName(String sourceName) {
            return sourceName + "_router";
        }
    }

    /**
     * @param predicate rendered Python condition
     * @param targetId  node id returned when the predicate holds
     */
    record Branch(String predicate, String targetId) {
        public Branch {
            Objects.requireNonNull(predicate, "predicate");
            Objects.requireNonNull(targetId, "targetId");
        }
    }

    /**
     * Plain {@code add_edge} per edge. Used for unguarded sources, sources that
     * mix guarded and unguarded edges, and guards that could not be compiled;
     * any guard text is carried along and emitted as a comment.
     */
    record PassThrough(String sourceId, List<EdgeSpec> edges) implements RoutingPlan {
        public PassThrough {
            Objects.requireNonNull(sourceId, "sourceId");
            edges = List.copyOf(edges);
        }
    }
}
