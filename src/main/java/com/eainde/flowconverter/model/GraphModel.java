package com.eainde.flowconverter.model;

import com.eainde.flowconverter.document.EdgeSpec;
import com.eainde.flowconverter.document.NodeSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved view over a flow document in which every edge endpoint is a known node.
 *
 * <p>Both maps keep document order: {@link #nodes()} in node declaration order,
 * {@link #edgesBySource()} in order of each source's first outgoing edge.
 * Instances are unmodifiable and built fresh per conversion.</p>
 */
public final class GraphModel {

    private final Map<String, NodeSpec> nodes;
    private final Map<String, List<EdgeSpec>> edgesBySource;
    private final List<EdgeSpec> edges;

    GraphModel(Map<String, NodeSpec> nodes, Map<String, List<EdgeSpec>> edgesBySource, List<EdgeSpec> edges) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        Map<String, List<EdgeSpec>> grouped = new LinkedHashMap<>();
        edgesBySource.forEach((source, outgoing) -> grouped.put(source, List.copyOf(outgoing)));
        this.edgesBySource = Collections.unmodifiableMap(grouped);
        this.edges = List.copyOf(edges);
    }

    public Map<String, NodeSpec> nodes() {
        return nodes;
    }

    public Map<String, List<EdgeSpec>> edgesBySource() {
        return edgesBySource;
    }

    /** All edges in declaration order. */
    public List<EdgeSpec> edges() {
        return edges;
    }

    public NodeSpec node(String id) {
        NodeSpec node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
        return node;
    }

    public List<EdgeSpec> outgoing(String sourceId) {
        return edgesBySource.getOrDefault(sourceId, List.of());
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** First node in document order, the graph's entry. */
    public NodeSpec firstNode() {
        return nodes.values().iterator().next();
    }

    /** Last node in document order, the graph's exit. */
    public NodeSpec lastNode() {
        List<NodeSpec> ordered = new ArrayList<>(nodes.values());
        return ordered.get(ordered.size() - 1);
    }
}
