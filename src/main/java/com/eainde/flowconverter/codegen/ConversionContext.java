package com.eainde.flowconverter.codegen;

import com.eainde.flowconverter.config.ConverterSettings;
import com.eainde.flowconverter.edges.RoutingPlan;
import com.eainde.flowconverter.model.GraphModel;
import com.eainde.flowconverter.nodes.NodeCategory;
import com.eainde.flowconverter.state.StateSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything the emitter needs for one conversion.
 *
 * <p>{@code logicOverrides} and {@code discardedLogic} are empty for a first
 * emission and filled in by the repairer: an override replaces a node's custom
 * logic text, a discarded node is emitted from its category template instead.</p>
 */
public record ConversionContext(
        GraphModel model,
        StateSchema schema,
        Map<String, NodeCategory> classifications,
        Map<String, RoutingPlan> plans,
        ConverterSettings settings,
        Map<String, String> logicOverrides,
        Set<String> discardedLogic
) {
    public ConversionContext {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(settings, "settings");
        classifications = Collections.unmodifiableMap(new LinkedHashMap<>(classifications));
        plans = Collections.unmodifiableMap(new LinkedHashMap<>(plans));
        logicOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(logicOverrides));
        discardedLogic = Collections.unmodifiableSet(new LinkedHashSet<>(discardedLogic));
    }

    public ConversionContext(GraphModel model, StateSchema schema, Map<String, NodeCategory> classifications,
                             Map<String, RoutingPlan> plans, ConverterSettings settings) {
        this(model, schema, classifications, plans, settings, Map.of(), Set.of());
    }

    public NodeCategory categoryOf(String nodeId) {
        return classifications.getOrDefault(nodeId, NodeCategory.CUSTOM);
    }

    /** Same conversion with the repairer's per-node decisions applied. */
    public ConversionContext withRepairs(Map<String, String> overrides, Set<String> discarded) {
        return new ConversionContext(model, schema, classifications, plans, settings, overrides, discarded);
    }

    public boolean isRepaired() {
        return !logicOverrides.isEmpty() || !discardedLogic.isEmpty();
    }
}
