package com.eainde.flowconverter.document;

import java.util.List;
import java.util.Objects;

/**
 * A loaded flow document: the nodes and edges exactly as declared, in file order.
 *
 * @param nodes nodes in document order
 * @param edges edges in document order; empty when the document has none
 */
public record FlowDocument(
        List<NodeSpec> nodes,
        List<EdgeSpec> edges
) {
    public FlowDocument {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
    }
}
