package com.eainde.flowconverter.document;

import com.eainde.flowconverter.exception.FlowFormatException;
import com.eainde.flowconverter.exception.FlowSchemaException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a Langflow JSON export into a {@link FlowDocument}.
 *
 * <p>Only the document's shape is checked here: well-formed JSON, an object root,
 * a {@code nodes} array whose entries carry unique textual ids, and edges that
 * name a source and a target. Whether those ids resolve is the model builder's
 * concern.</p>
 *
 * <h3>Accepted layout:</h3>
 * <pre>
 * {
 *   "nodes": [
 *     { "id": "n1", "class_path": "langchain.llms.openai.OpenAI",
 *       "data": { "label": "OpenAI" }, "inputs": { "model_name": "gpt-4" } }
 *   ],
 *   "edges": [
 *     { "source": "n1", "target": "n2", "data": { "condition": "route == 'a'" } }
 *   ]
 * }
 * </pre>
 */
@Slf4j
@Component
public class FlowDocumentLoader {

    private static final TypeReference<LinkedHashMap<String, Object>> INPUTS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public FlowDocumentLoader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Loads and structurally validates the document at {@code path}.
     *
     * @throws FlowFormatException if the file cannot be read or is not a JSON object
     * @throws FlowSchemaException if {@code nodes} is missing or malformed
     */
    public FlowDocument load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new FlowFormatException("File not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException e) {
            throw new FlowFormatException("Error reading flow document " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a document from an already opened stream. The stream is not closed.
     *
     * @param sourceName used in log lines and error messages only
     */
    public FlowDocument read(InputStream in, String sourceName) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new FlowFormatException("Invalid JSON syntax in " + sourceName + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FlowFormatException("Error reading flow document " + sourceName + ": " + e.getMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new FlowFormatException("Invalid JSON format in " + sourceName + ": root must be an object");
        }

        JsonNode nodesArray = root.get("nodes");
        if (nodesArray == null || nodesArray.isNull()) {
            throw new FlowSchemaException("Invalid flow document " + sourceName + ": 'nodes' field is required");
        }
        if (!nodesArray.isArray()) {
            throw new FlowSchemaException("Invalid flow document " + sourceName + ": 'nodes' must be an array");
        }

        List<NodeSpec> nodes = readNodes(nodesArray);
        List<EdgeSpec> edges = readEdges(root.get("edges"));

        log.info("Loaded flow document {}: {} nodes, {} edges", sourceName, nodes.size(), edges.size());
        return new FlowDocument(nodes, edges);
    }

    // =========================================================================
    //  Nodes
    // =========================================================================

    private List<NodeSpec> readNodes(JsonNode nodesArray) {
        List<NodeSpec> nodes = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        int index = 0;
        for (JsonNode nodeJson : nodesArray) {
            if (!nodeJson.isObject()) {
                throw new FlowSchemaException("Node #" + index + " must be a JSON object");
            }
            JsonNode idNode = nodeJson.get("id");
            if (idNode == null || !idNode.isValueNode() || idNode.asText().isEmpty()) {
                throw new FlowSchemaException("Node #" + index + " has no 'id'");
            }
            String id = idNode.asText();
            if (!seenIds.add(id)) {
                throw new FlowSchemaException("Duplicate node id '" + id + "'");
            }

            String classIdentifier = nodeJson.path("class_path").asText("");
            JsonNode labelNode = nodeJson.path("data").path("label");
            String label = labelNode.isValueNode() && !labelNode.asText().isBlank() ? labelNode.asText() : null;

            nodes.add(new NodeSpec(id, classIdentifier, label, readInputs(id, nodeJson.get("inputs"))));
            index++;
        }
        return nodes;
    }

    private Map<String, Object> readInputs(String nodeId, JsonNode inputsNode) {
        if (inputsNode == null || inputsNode.isNull()) {
            return Map.of();
        }
        if (!inputsNode.isObject()) {
            throw new FlowSchemaException("Node '" + nodeId + "': 'inputs' must be an object");
        }
        return objectMapper.convertValue(inputsNode, INPUTS_TYPE);
    }

    // =========================================================================
    //  Edges
    // =========================================================================

    private List<EdgeSpec> readEdges(JsonNode edgesArray) {
        if (edgesArray == null || edgesArray.isNull()) {
            return List.of();
        }
        if (!edgesArray.isArray()) {
            throw new FlowSchemaException("'edges' must be an array");
        }

        List<EdgeSpec> edges = new ArrayList<>();
        int index = 0;
        for (JsonNode edgeJson : edgesArray) {
            String source = edgeJson.path("source").asText("");
            String target = edgeJson.path("target").asText("");
            if (source.isEmpty() || target.isEmpty()) {
                throw new FlowSchemaException("Edge #" + index + " must name both 'source' and 'target'");
            }
            JsonNode conditionNode = edgeJson.path("data").path("condition");
            String condition = conditionNode.isValueNode() ? conditionNode.asText() : null;
            edges.add(new EdgeSpec(source, target, condition));
            index++;
        }
        return edges;
    }
}
