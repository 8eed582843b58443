package com.eainde.flowconverter.codegen;

import com.eainde.flowconverter.document.NodeSpec;
import com.eainde.flowconverter.nodes.NodeCategory;

/**
 * Produces the Python function for a node that carries no custom logic.
 */
public interface NodeBodyGenerator {

    /**
     * @param node         the node being emitted
     * @param category     its classification
     * @param functionName the Python name the function must be defined under
     * @return a complete {@code def functionName(state): ...} block starting at column 0
     */
    String generate(NodeSpec node, NodeCategory category, String functionName);
}
