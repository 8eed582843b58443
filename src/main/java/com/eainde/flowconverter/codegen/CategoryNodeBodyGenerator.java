package com.eainde.flowconverter.codegen;

import com.eainde.flowconverter.document.NodeSpec;
import com.eainde.flowconverter.nodes.NodeCategory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills the {@link NodeTemplates} entry for a node's category with values from
 * the node's inputs.
 *
 * <p>Custom nodes get a template chosen by hints in their id (chat input, prompt,
 * database, ...), falling back to a generic pass-through body.</p>
 */
@Component
public class CategoryNodeBodyGenerator implements NodeBodyGenerator {

    static final String DEFAULT_TEMPERATURE = "0.7";
    static final String DEFAULT_CHUNK_SIZE = "1000";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");

    @Override
    public String generate(NodeSpec node, NodeCategory category, String functionName) {
        String template = category == NodeCategory.CUSTOM
                ? NodeTemplates.forCustomNode(node.id())
                : NodeTemplates.forCategory(category);
        return fill(template, values(node, category, functionName));
    }

    private Map<String, String> values(NodeSpec node, NodeCategory category, String functionName) {
        Map<String, String> values = new HashMap<>();
        values.put("node_name", functionName);
        String className = node.className().replaceAll("\\W", "");
        values.put("class_name", className.isEmpty() ? category.code() : className);
        values.put("model_name", singleLine(node.input("model_name").orElse("")));
        values.put("temperature", singleLine(node.input("temperature").orElse(DEFAULT_TEMPERATURE)));
        values.put("chunk_size", singleLine(node.input("chunk_size").orElse(DEFAULT_CHUNK_SIZE)));
        values.put("template", tripleQuotedBody(node.input("template").or(() -> node.input("prompt")).orElse("")));
        return values;
    }

    /** Single pass, so placeholder syntax inside substituted values is left as is. */
    static String fill(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = values.getOrDefault(matcher.group(1), matcher.group());
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /** Values that end up in comments must not break the line. */
    private static String singleLine(String value) {
        return value.replaceAll("[\\r\\n]+", " ").strip();
    }

    private static String tripleQuotedBody(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
