package com.eainde.flowconverter.codegen;

import com.eainde.flowconverter.document.NodeSpec;
import com.eainde.flowconverter.nodes.NodeCategory;
import com.eainde.flowconverter.validation.PythonSyntaxChecker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryNodeBodyGeneratorTest {

    private final CategoryNodeBodyGenerator generator = new CategoryNodeBodyGenerator();

    // =========================================================================
    //  Category templates
    // =========================================================================

    @Nested
    @DisplayName("Category templates")
    class CategoryTemplates {

        @Test
        @DisplayName("should fill model settings into an LLM body")
        void llmSettings() {
            NodeSpec node = new NodeSpec("n2", "OpenAI LLM", null, Map.of("model_name", "gpt-4", "temperature", 0.2));

            String body = generator.generate(node, NodeCategory.LLM, "summarize");

            assertThat(body).startsWith("def summarize(state):\n");
            assertThat(body).contains("    # Model: gpt-4, Temperature: 0.2\n");
            assertThat(body).endsWith("    return state\n");
        }

        @Test
        @DisplayName("should fall back to the default temperature and unwrap field objects")
        void defaults() {
            NodeSpec node = new NodeSpec("n", "ChatOpenAI", null,
                    Map.of("model_name", Map.of("value", "gpt-4o")));

            String body = generator.generate(node, NodeCategory.CHAT_MODEL, "chat");

            assertThat(body).contains("# Model: gpt-4o, Temperature: 0.7");
        }

        @Test
        @DisplayName("should name the class, or the category when there is none")
        void className() {
            assertThat(generator.generate(NodeSpec.of("t", "langchain.tools.Tool"), NodeCategory.TOOL, "t"))
                    .contains("# Tool: Tool\n");
            assertThat(generator.generate(NodeSpec.of("t", ""), NodeCategory.TOOL, "t"))
                    .contains("# Tool: tool\n");
        }

        @Test
        @DisplayName("should escape quotes and backslashes of a prompt template")
        void promptEscaping() {
            NodeSpec node = new NodeSpec("p", "PromptTemplate", null,
                    Map.of("template", "Say \"{topic}\" \\ now"));

            String body = generator.generate(node, NodeCategory.PROMPT, "prompt_node");

            assertThat(body).contains("template = \"\"\"Say \\\"{topic}\\\" \\\\ now\"\"\"");
            assertThat(PythonSyntaxChecker.isValid(body)).isTrue();
        }

        @Test
        @DisplayName("should keep multi-line input values out of comment lines")
        void singleLineComments() {
            NodeSpec node = new NodeSpec("n", "", null, Map.of("model_name", "gpt\n4"));

            assertThat(generator.generate(node, NodeCategory.LLM, "n"))
                    .contains("# Model: gpt 4, Temperature: 0.7\n");
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(NodeCategory.class)
        @DisplayName("should produce well-formed Python for every category")
        void wellFormed(NodeCategory category) {
            String body = generator.generate(NodeSpec.of("x", "some.module.Thing"), category, "node_x");

            assertThat(body).startsWith("def node_x(state):");
            assertThat(PythonSyntaxChecker.check(body)).isEmpty();
        }
    }

    // =========================================================================
    //  Custom nodes
    // =========================================================================

    @Nested
    @DisplayName("Custom nodes")
    class CustomNodes {

        @Test
        @DisplayName("should pick a template from hints in the node id")
        void idHints() {
            assertThat(generator.generate(NodeSpec.of("ChatInput-ab12", ""), NodeCategory.CUSTOM, "a"))
                    .contains("state[\"question\"] = state[\"input\"]");
            assertThat(generator.generate(NodeSpec.of("LocalDB-1", ""), NodeCategory.CUSTOM, "b"))
                    .contains("state[\"documents\"] = [f\"doc1_for_{query}\"");
            assertThat(generator.generate(NodeSpec.of("Confluence-7", ""), NodeCategory.CUSTOM, "c"))
                    .contains("confluence_data_content");
        }

        @Test
        @DisplayName("should use the generic body without a hint")
        void generic() {
            assertThat(generator.generate(NodeSpec.of("n1", "TextInput"), NodeCategory.CUSTOM, "node_n1"))
                    .contains("state[\"output\"] = f\"Processed: {state['input']}\"");
        }

        @ParameterizedTest
        @ValueSource(strings = {"ChatInput-1", "ChatOutput-1", "Prompt-1", "LanguageModel-1",
                "Embedding-1", "LocalDB-1", "Parser-1", "Confluence-1", "plain"})
        @DisplayName("should produce well-formed Python for every id hint")
        void wellFormed(String id) {
            assertThat(PythonSyntaxChecker.check(generator.generate(NodeSpec.of(id, ""), NodeCategory.CUSTOM, "f")))
                    .isEmpty();
        }
    }

    // =========================================================================
    //  Placeholder filling
    // =========================================================================

    @Test
    @DisplayName("should fill in a single pass and leave unknown placeholders alone")
    void fill() {
        String filled = CategoryNodeBodyGenerator.fill("{{a}} {{b}} {{zzz}} {x}",
                Map.of("a", "{{b}}", "b", "$1"));

        assertThat(filled).isEqualTo("{{b}} $1 {{zzz}} {x}");
    }
}
