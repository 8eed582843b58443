package com.eainde.flowconverter.nodes;

import com.eainde.flowconverter.state.FieldType;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.eainde.flowconverter.state.FieldType.LIST;
import static com.eainde.flowconverter.state.FieldType.STRING;

/**
 * Role of a {@link NodeCategory#CUSTOM} node, recognised from fragments of its id.
 *
 * <p>Langflow names component instances after their type ({@code ChatInput-x8Yk},
 * {@code Prompt-3fQa}), so an otherwise unclassifiable node can still get a
 * fitting body. Each role carries the state fields that body reads or writes.</p>
 */
public enum CustomNodeRole {

    CHAT_INPUT(List.of("chatinput"),
            "messages", LIST,
            "question", STRING),

    CHAT_OUTPUT(List.of("chatoutput"),
            "response", STRING,
            "messages", LIST),

    CONTEXT_PROMPT(List.of("prompt"),
            "context", STRING,
            "question", STRING,
            "prompt", STRING),

    LANGUAGE_MODEL(List.of("languagemodel", "llm"),
            "prompt", STRING,
            "response", STRING),

    TEXT_EMBEDDING(List.of("embedding"),
            "embeddings", STRING),

    DATABASE_QUERY(List.of("localdb", "database"),
            "question", STRING,
            "documents", LIST),

    DOCUMENT_PARSER(List.of("parser"),
            "documents", LIST,
            "context", STRING),

    CONFLUENCE(List.of("confluence"),
            "raw_data", STRING);

    private final List<String> idFragments;
    private final Map<String, FieldType> defaultFields;

    CustomNodeRole(List<String> idFragments, Object... fieldPairs) {
        this.idFragments = idFragments;
        this.defaultFields = NodeCategory.orderedFields(fieldPairs);
    }

    /** State fields the role's generated body touches, in declaration order. */
    public Map<String, FieldType> defaultFields() {
        return defaultFields;
    }

    /** First role, in declaration order, with a fragment contained in the lower-cased id. */
    public static Optional<CustomNodeRole> fromNodeId(String nodeId) {
        String id = nodeId.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(role -> role.idFragments.stream().anyMatch(id::contains))
                .findFirst();
    }
}
