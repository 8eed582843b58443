package com.eainde.flowconverter.codegen;

import com.eainde.flowconverter.nodes.CustomNodeRole;
import com.eainde.flowconverter.nodes.NodeCategory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Python bodies for generated node functions.
 *
 * <p>Templates start at column 0 and are indented by the emitter. Placeholders
 * use {@code {{name}}}: {@code node_name}, {@code class_name}, {@code model_name},
 * {@code temperature}, {@code template}, {@code chunk_size}. Anything else in
 * braces is Python and is left alone.</p>
 */
final class NodeTemplates {

    private NodeTemplates() {}

    static final String LLM = """
            def {{node_name}}(state):
                \"""Process the state using an LLM.\"""
                # Model: {{model_name}}, Temperature: {{temperature}}
                if "prompt" in state:
                    state["llm_response"] = f"Response to: {state['prompt']}"
                elif "input" in state:
                    state["llm_response"] = f"Response to: {state['input']}"
                else:
                    state["llm_response"] = "No input provided"
                return state
            """;

    static final String CHAT_MODEL = """
            def {{node_name}}(state):
                \"""Process the state using a chat model.\"""
                # Model: {{model_name}}, Temperature: {{temperature}}
                if "messages" in state and isinstance(state["messages"], list):
                    state["chat_response"] = f"Response to messages: {len(state['messages'])} messages"
                elif "input" in state:
                    state["chat_response"] = f"Response to: {state['input']}"
                else:
                    state["chat_response"] = "No input provided"
                return state
            """;

    static final String CHAIN = """
            def {{node_name}}(state):
                \"""Process the state through a chain.\"""
                # Chain: {{class_name}}
                if "input" in state:
                    state["chain_result"] = f"Chain processed: {state['input']}"
                return state
            """;

    static final String AGENT = """
            def {{node_name}}(state):
                \"""Process the state using an agent.\"""
                # Agent: {{class_name}}
                if "input" in state:
                    state["agent_result"] = f"Agent processed: {state['input']}"
                    state["intermediate_steps"] = ["Step 1: Thinking", "Step 2: Acting"]
                return state
            """;

    static final String TOOL = """
            def {{node_name}}(state):
                \"""Process the state using a tool.\"""
                # Tool: {{class_name}}
                if "input" in state:
                    state["tool_result"] = f"Tool executed on: {state['input']}"
                return state
            """;

    static final String MEMORY = """
            def {{node_name}}(state):
                \"""Record the latest exchange in memory.\"""
                # Memory: {{class_name}}
                if "history" not in state:
                    state["history"] = []
                if "input" in state and "llm_response" in state:
                    state["history"].append((state["input"], state["llm_response"]))
                return state
            """;

    static final String PROMPT = """
            def {{node_name}}(state):
                \"""Format a prompt template with values from the state.\"""
                import re
                template = \"""{{template}}\"""
                formatted_prompt = template
                for var in re.findall(r'{([^{}]+)}', template):
                    var_clean = var.strip()
                    if var_clean in state:
                        formatted_prompt = formatted_prompt.replace('{' + var + '}', str(state[var_clean]))
                state["prompt"] = formatted_prompt
                return state
            """;

    static final String RETRIEVER = """
            def {{node_name}}(state):
                \"""Retrieve documents relevant to the input.\"""
                # Retriever: {{class_name}}
                if "input" in state:
                    state["documents"] = [
                        {"content": f"Document 1 relevant to {state['input']}", "metadata": {}},
                        {"content": f"Document 2 relevant to {state['input']}", "metadata": {}},
                    ]
                return state
            """;

    static final String VECTOR_STORE = """
            def {{node_name}}(state):
                \"""Search a vector store for the input.\"""
                # Vector store: {{class_name}}
                if "input" in state:
                    state["search_results"] = [
                        {"content": f"Result 1 for {state['input']}", "metadata": {}},
                        {"content": f"Result 2 for {state['input']}", "metadata": {}},
                    ]
                return state
            """;

    static final String EMBEDDING = """
            def {{node_name}}(state):
                \"""Generate embeddings for the input.\"""
                # Embeddings: {{class_name}}
                if "input" in state:
                    state["embeddings"] = [[0.1, 0.2, 0.3]]
                return state
            """;

    static final String DOCUMENT_LOADER = """
            def {{node_name}}(state):
                \"""Load a document.\"""
                # Loader: {{class_name}}
                if "file_path" in state:
                    state["document_content"] = f"Content loaded from {state['file_path']}"
                return state
            """;

    static final String TEXT_SPLITTER = """
            def {{node_name}}(state):
                \"""Split the input into chunks.\"""
                # Splitter: {{class_name}}, chunk size: {{chunk_size}}
                if "input" in state and isinstance(state["input"], str):
                    paragraphs = state["input"].split("\\n\\n")
                    state["chunks"] = [p for p in paragraphs if p.strip()]
                return state
            """;

    static final String UTILITY = """
            def {{node_name}}(state):
                \"""Process the state using a utility function.\"""
                # Utility: {{class_name}}
                if "input" in state:
                    state["processed_input"] = str(state["input"]).upper()
                return state
            """;

    static final String OUTPUT_PARSER = """
            def {{node_name}}(state):
                \"""Parse the input into structured output.\"""
                parser_kind = "{{class_name}}".lower()
                if "input" in state:
                    text = str(state["input"])
                    try:
                        if "json" in parser_kind and text.strip().startswith("{") and text.strip().endswith("}"):
                            import json
                            state["parsed_output"] = json.loads(text)
                        elif "pydantic" in parser_kind:
                            state["parsed_output"] = {"content": text, "metadata": {}}
                        elif "regex" in parser_kind:
                            state["parsed_output"] = {"matched": True, "extracted": text}
                        else:
                            state["parsed_output"] = {"output": text}
                    except Exception as e:
                        state["parsed_output"] = {"error": str(e), "original_input": text}
                return state
            """;

    static final String ROUTER = """
            def {{node_name}}(state):
                \"""Pick a route for the input.\"""
                # Router: {{class_name}}
                if "input" in state:
                    input_text = str(state["input"])
                    if "?" in input_text:
                        state["route"] = "question_route"
                    elif len(input_text) < 20:
                        state["route"] = "short_input_route"
                    elif any(keyword in input_text.lower() for keyword in ["help", "support", "assist"]):
                        state["route"] = "help_route"
                    else:
                        state["route"] = "default_route"
                    state["destination"] = state["route"]
                return state
            """;

    static final String DOCUMENT_TRANSFORMER = """
            def {{node_name}}(state):
                \"""Transform the documents in the state.\"""
                # Transformer: {{class_name}}
                if "documents" in state and isinstance(state["documents"], list):
                    transformed_docs = []
                    for i, doc in enumerate(state["documents"]):
                        if isinstance(doc, dict):
                            content = doc.get("content", "No content")
                        elif isinstance(doc, str):
                            content = doc
                        else:
                            content = f"document {i}"
                        transformed_docs.append({
                            "content": f"Transformed: {content}",
                            "metadata": {"transformed": True, "transformer": "{{class_name}}"},
                        })
                    state["transformed_documents"] = transformed_docs
                return state
            """;

    static final String CUSTOM = """
            def {{node_name}}(state):
                \"""Custom node processing.\"""
                if "input" in state:
                    state["output"] = f"Processed: {state['input']}"
                return state
            """;

    // Custom nodes without code, one per CustomNodeRole

    static final String CHAT_INPUT = """
            def {{node_name}}(state):
                \"""Handle chat input from the user.\"""
                if "input" in state:
                    state["messages"] = [state["input"]]
                    state["question"] = state["input"]
                return state
            """;

    static final String CHAT_OUTPUT = """
            def {{node_name}}(state):
                \"""Format chat output for the user.\"""
                if "response" in state:
                    state["output"] = state["response"]
                elif "messages" in state and state["messages"]:
                    state["output"] = state["messages"][-1]
                return state
            """;

    static final String CONTEXT_PROMPT = """
            def {{node_name}}(state):
                \"""Build a prompt from context and question.\"""
                context = state.get("context", "")
                question = state.get("question", "")
                state["prompt"] = f"Context: {context}\\n\\nQuestion: {question}"
                return state
            """;

    static final String LANGUAGE_MODEL = """
            def {{node_name}}(state):
                \"""Process the prompt with a language model.\"""
                prompt = state.get("prompt", state.get("input", ""))
                state["response"] = f"AI Response: {prompt}"
                return state
            """;

    static final String TEXT_EMBEDDING = """
            def {{node_name}}(state):
                \"""Generate embeddings for text.\"""
                text = state.get("input", "")
                state["embeddings"] = f"embeddings_for_{text}"
                return state
            """;

    static final String DATABASE_QUERY = """
            def {{node_name}}(state):
                \"""Query a local database or vector store.\"""
                query = state.get("question", state.get("input", ""))
                state["documents"] = [f"doc1_for_{query}", f"doc2_for_{query}"]
                return state
            """;

    static final String DOCUMENT_PARSER = """
            def {{node_name}}(state):
                \"""Join retrieved documents into a context string.\"""
                documents = state.get("documents", [])
                state["context"] = " ".join(str(doc) for doc in documents) if documents else ""
                return state
            """;

    static final String CONFLUENCE = """
            def {{node_name}}(state):
                \"""Fetch data from Confluence.\"""
                state["raw_data"] = "confluence_data_content"
                return state
            """;

    private static final Map<NodeCategory, String> BY_CATEGORY = byCategory();
    private static final Map<CustomNodeRole, String> BY_ROLE = byRole();

    static String forCategory(NodeCategory category) {
        return BY_CATEGORY.get(category);
    }

    static String forCustomNode(String nodeId) {
        return CustomNodeRole.fromNodeId(nodeId).map(BY_ROLE::get).orElse(CUSTOM);
    }

    private static Map<CustomNodeRole, String> byRole() {
        Map<CustomNodeRole, String> templates = new EnumMap<>(CustomNodeRole.class);
        templates.put(CustomNodeRole.CHAT_INPUT, CHAT_INPUT);
        templates.put(CustomNodeRole.CHAT_OUTPUT, CHAT_OUTPUT);
        templates.put(CustomNodeRole.CONTEXT_PROMPT, CONTEXT_PROMPT);
        templates.put(CustomNodeRole.LANGUAGE_MODEL, LANGUAGE_MODEL);
        templates.put(CustomNodeRole.TEXT_EMBEDDING, TEXT_EMBEDDING);
        templates.put(CustomNodeRole.DATABASE_QUERY, DATABASE_QUERY);
        templates.put(CustomNodeRole.DOCUMENT_PARSER, DOCUMENT_PARSER);
        templates.put(CustomNodeRole.CONFLUENCE, CONFLUENCE);
        return templates;
    }

    private static Map<NodeCategory, String> byCategory() {
        Map<NodeCategory, String> templates = new EnumMap<>(NodeCategory.class);
        templates.put(NodeCategory.LLM, LLM);
        templates.put(NodeCategory.CHAT_MODEL, CHAT_MODEL);
        templates.put(NodeCategory.CHAIN, CHAIN);
        templates.put(NodeCategory.AGENT, AGENT);
        templates.put(NodeCategory.TOOL, TOOL);
        templates.put(NodeCategory.MEMORY, MEMORY);
        templates.put(NodeCategory.PROMPT, PROMPT);
        templates.put(NodeCategory.RETRIEVER, RETRIEVER);
        templates.put(NodeCategory.VECTOR_STORE, VECTOR_STORE);
        templates.put(NodeCategory.EMBEDDING, EMBEDDING);
        templates.put(NodeCategory.DOCUMENT_LOADER, DOCUMENT_LOADER);
        templates.put(NodeCategory.TEXT_SPLITTER, TEXT_SPLITTER);
        templates.put(NodeCategory.UTILITY, UTILITY);
        templates.put(NodeCategory.CUSTOM, CUSTOM);
        templates.put(NodeCategory.OUTPUT_PARSER, OUTPUT_PARSER);
        templates.put(NodeCategory.ROUTER, ROUTER);
        templates.put(NodeCategory.DOCUMENT_TRANSFORMER, DOCUMENT_TRANSFORMER);
        return templates;
    }
}
