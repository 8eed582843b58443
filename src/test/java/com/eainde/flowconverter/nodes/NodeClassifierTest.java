package com.eainde.flowconverter.nodes;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NodeClassifierTest {

    private final NodeClassifier classifier = new NodeClassifier();

    // =========================================================================
    //  Table lookups
    // =========================================================================

    @Nested
    @DisplayName("Identifier table")
    class IdentifierTable {

        @Test
        @DisplayName("should classify known class paths exactly")
        void exactMatch() {
            assertThat(classifier.classify("langchain.llms.openai.OpenAI")).isEqualTo(NodeCategory.LLM);
            assertThat(classifier.classify("langchain.chat_models.openai.ChatOpenAI")).isEqualTo(NodeCategory.CHAT_MODEL);
            assertThat(classifier.classify("langchain.chains.llm.LLMChain")).isEqualTo(NodeCategory.CHAIN);
            assertThat(classifier.classify("langchain.prompts.prompt.PromptTemplate")).isEqualTo(NodeCategory.PROMPT);
        }

        @Test
        @DisplayName("should ignore surrounding whitespace")
        void trimmed() {
            assertThat(classifier.classify("  langchain.agents.agent.AgentExecutor ")).isEqualTo(NodeCategory.AGENT);
        }

        @Test
        @DisplayName("should match an identifier that contains a known class path")
        void containsKey() {
            assertThat(classifier.classify("vendor.langchain.chains.llm.LLMChain.v2")).isEqualTo(NodeCategory.CHAIN);
        }

        @Test
        @DisplayName("should match a bare class name contained in a known class path")
        void containedInKey() {
            assertThat(classifier.classify("ChatOpenAI")).isEqualTo(NodeCategory.CHAT_MODEL);
        }

        @Test
        @DisplayName("should prefer the longest match, then a key with the same class name")
        void tieBreak() {
            Map<String, NodeCategory> table = new LinkedHashMap<>();
            table.put("pkg.a.Widget", NodeCategory.TOOL);
            table.put("pkg.b.Widget", NodeCategory.MEMORY);
            table.put("pkg.b.WidgetExtra", NodeCategory.CHAIN);
            NodeClassifier custom = new NodeClassifier(table);

            assertThat(custom.classify("Widget")).isEqualTo(NodeCategory.TOOL);
            assertThat(custom.classify("x.pkg.b.WidgetExtra")).isEqualTo(NodeCategory.CHAIN);
        }

        @Test
        @DisplayName("should not reverse-match identifiers shorter than four characters")
        void shortIdentifier() {
            Map<String, NodeCategory> table = Map.of("pkg.Abc.Thing", NodeCategory.TOOL);

            assertThat(new NodeClassifier(table).classify("Abc")).isEqualTo(NodeCategory.CUSTOM);
        }
    }

    // =========================================================================
    //  Keyword rules
    // =========================================================================

    @Nested
    @DisplayName("Keyword rules")
    class Keywords {

        @Test
        @DisplayName("should fall back to keywords in the class name")
        void keywordMatch() {
            assertThat(classifier.classify("OpenAI LLM")).isEqualTo(NodeCategory.LLM);
            assertThat(classifier.classify("com.acme.MyCustomRetriever")).isEqualTo(NodeCategory.RETRIEVER);
            assertThat(classifier.classify("com.acme.PineconeIndex")).isEqualTo(NodeCategory.VECTOR_STORE);
        }

        @Test
        @DisplayName("should let chat model keywords win over plain LLM keywords")
        void priority() {
            assertThat(classifier.classify("acme.ChatOllamaModel")).isEqualTo(NodeCategory.CHAT_MODEL);
        }

        @Test
        @DisplayName("should only look at the final dotted segment")
        void finalSegmentOnly() {
            assertThat(classifier.classify("acme.agent.Widget")).isEqualTo(NodeCategory.CUSTOM);
            assertThat(NodeClassifier.finalSegment("a.b.C")).isEqualTo("C");
            assertThat(NodeClassifier.finalSegment("C")).isEqualTo("C");
        }
    }

    // =========================================================================
    //  Totality
    // =========================================================================

    @Nested
    @DisplayName("Totality")
    class Totality {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "xyz", "TextInput", "OutputFormatter", "!!!", "été"})
        @DisplayName("should classify anything unrecognised as custom without throwing")
        void unknownIsCustom(String identifier) {
            assertThat(classifier.classify(identifier)).isEqualTo(NodeCategory.CUSTOM);
        }
    }
}
