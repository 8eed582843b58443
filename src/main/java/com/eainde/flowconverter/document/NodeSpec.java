package com.eainde.flowconverter.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One node of a flow document.
 *
 * @param id              unique key within the document
 * @param classIdentifier the {@code class_path}, empty when absent
 * @param displayLabel    the {@code data.label}, {@code null} when absent
 * @param inputs          node configuration in declaration order
 */
public record NodeSpec(
        String id,
        String classIdentifier,
        String displayLabel,
        Map<String, Object> inputs
) {
    /** Key of the embedded custom-logic body inside {@link #inputs()}. */
    public static final String CODE_INPUT = "code";

    public NodeSpec {
        Objects.requireNonNull(id, "id");
        classIdentifier = classIdentifier != null ? classIdentifier : "";
        inputs = inputs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs))
                : Map.of();
    }

    public static NodeSpec of(String id, String classIdentifier) {
        return new NodeSpec(id, classIdentifier, null, Map.of());
    }

    /**
     * The embedded custom logic, if any. Langflow exports either a plain string
     * or a field object carrying the string under {@code value}.
     */
    public Optional<String> customLogic() {
        Object code = inputs.get(CODE_INPUT);
        if (code instanceof Map<?, ?> field) {
            code = field.get("value");
        }
        if (code instanceof String text && !text.isBlank()) {
            return Optional.of(text);
        }
        return Optional.empty();
    }

    /** Textual value of a configuration input, unwrapping Langflow field objects. */
    public Optional<String> input(String key) {
        Object value = inputs.get(key);
        if (value instanceof Map<?, ?> field) {
            value = field.get("value");
        }
        if (value == null || value instanceof Map<?, ?> || value instanceof Iterable<?>) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(value));
    }

    /** Final dotted segment of the class identifier, e.g. {@code ChatOpenAI}. */
    public String className() {
        int dot = classIdentifier.lastIndexOf('.');
        return dot >= 0 ? classIdentifier.substring(dot + 1) : classIdentifier;
    }
}
