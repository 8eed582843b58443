package com.eainde.flowconverter.model;

import com.eainde.flowconverter.document.EdgeSpec;
import com.eainde.flowconverter.document.FlowDocument;
import com.eainde.flowconverter.document.NodeSpec;
import com.eainde.flowconverter.exception.NodeReferenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a loaded document into a {@link GraphModel}, failing on the first edge
 * whose source or target is not a node id.
 */
@Slf4j
@Component
public class GraphModelBuilder {

    public GraphModel build(FlowDocument document) {
        Map<String, NodeSpec> nodes = new LinkedHashMap<>();
        for (NodeSpec node : document.nodes()) {
            nodes.put(node.id(), node);
        }

        Map<String, List<EdgeSpec>> edgesBySource = new LinkedHashMap<>();
        for (EdgeSpec edge : document.edges()) {
            if (!nodes.containsKey(edge.source())) {
                throw new NodeReferenceException(edge.source(), "source");
            }
            if (!nodes.containsKey(edge.target())) {
                throw new NodeReferenceException(edge.target(), "target");
            }
            edgesBySource.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
        }

        log.debug("Built graph model: {} nodes, {} edge sources", nodes.size(), edgesBySource.size());
        return new GraphModel(nodes, edgesBySource, document.edges());
    }
}
