package com.eainde.flowconverter.nodes;

import com.eainde.flowconverter.state.FieldType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.eainde.flowconverter.state.FieldType.LIST;
import static com.eainde.flowconverter.state.FieldType.MAP;
import static com.eainde.flowconverter.state.FieldType.STRING;

/**
 * Behavioural category of a flow node.
 *
 * <p>Each category carries the state fields its generated body reads or writes.
 * The schema inferencer adds these for every node of the category; the body
 * templates live in {@code codegen.NodeTemplates}.</p>
 */
public enum NodeCategory {

    /** Generative text model. */
    LLM("llm",
            "input", STRING,
            "llm_response", STRING),

    /** Chat model working over a message list. */
    CHAT_MODEL("chat_model",
            "input", STRING,
            "messages", LIST,
            "chat_response", STRING),

    /** Sequential pipeline of model calls. */
    CHAIN("chain",
            "input", STRING,
            "chain_result", STRING),

    /** Autonomous agent that reasons over tools. */
    AGENT("agent",
            "input", STRING,
            "agent_result", STRING,
            "intermediate_steps", LIST,
            "tools", LIST),

    /** External tool invocation. */
    TOOL("tool",
            "input", STRING,
            "tool_result", STRING),

    /** Conversational memory. */
    MEMORY("memory",
            "input", STRING,
            "history", LIST,
            "memory_result", STRING,
            "chat_history", LIST),

    /** Prompt template. */
    PROMPT("prompt",
            "input", STRING,
            "prompt", STRING,
            "template", STRING,
            "variables", MAP),

    /** Document retriever. */
    RETRIEVER("retriever",
            "input", STRING,
            "query", STRING,
            "documents", LIST),

    /** Vector index. */
    VECTOR_STORE("vectorstore",
            "input", STRING,
            "search_results", LIST,
            "documents", LIST,
            "query", STRING),

    /** Embedding generator. */
    EMBEDDING("embedding",
            "input", STRING,
            "embeddings", LIST,
            "texts", LIST),

    /** Document loader. */
    DOCUMENT_LOADER("document",
            "file_path", STRING,
            "document_content", STRING,
            "documents", LIST),

    /** Text chunker. */
    TEXT_SPLITTER("text_splitter",
            "input", STRING,
            "chunks", LIST,
            "documents", LIST),

    /** Generic utility wrapper. */
    UTILITY("utility",
            "input", STRING,
            "processed_input", STRING,
            "result", STRING),

    /** User-defined node; the fallback for anything unrecognised. */
    CUSTOM("custom",
            "input", STRING,
            "output", STRING),

    /** Structured output parser. */
    OUTPUT_PARSER("output_parser",
            "input", STRING,
            "parsed_output", MAP,
            "format_instructions", STRING),

    /** Router picking a destination. */
    ROUTER("router",
            "input", STRING,
            "destination", STRING,
            "route", STRING),

    /** Document transformer / compressor. */
    DOCUMENT_TRANSFORMER("document_transformer",
            "documents", LIST,
            "transformed_documents", LIST);

    private final String code;
    private final Map<String, FieldType> defaultFields;

    NodeCategory(String code, Object... fieldPairs) {
        this.code = code;
        this.defaultFields = orderedFields(fieldPairs);
    }

    /** Short lower-case code, as used in log lines. */
    public String code() {
        return code;
    }

    /** State fields a node of this category contributes, in declaration order. */
    public Map<String, FieldType> defaultFields() {
        return defaultFields;
    }

    /** Whether nodes of this category are known to populate a {@code documents} list. */
    public boolean producesDocuments() {
        return defaultFields.get("documents") == LIST;
    }

    static Map<String, FieldType> orderedFields(Object... pairs) {
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException("Field pairs must be name/type pairs");
        }
        Map<String, FieldType> fields = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            fields.put((String) pairs[i], (FieldType) pairs[i + 1]);
        }
        return Collections.unmodifiableMap(fields);
    }
}
