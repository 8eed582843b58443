package com.eainde.flowconverter.codegen;

import com.eainde.flowconverter.Fixtures;
import com.eainde.flowconverter.codegen.EmittedProgram.Section;
import com.eainde.flowconverter.config.ConverterSettings;
import com.eainde.flowconverter.document.EdgeSpec;
import com.eainde.flowconverter.document.NodeSpec;
import com.eainde.flowconverter.exception.CodeGenerationException;
import com.eainde.flowconverter.validation.ProgramValidator;
import com.eainde.flowconverter.validation.PythonSyntaxChecker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodeEmitterTest {

    private final CodeEmitter emitter = Fixtures.emitter();

    // =========================================================================
    //  Module layout
    // =========================================================================

    @Nested
    @DisplayName("Module layout")
    class Layout {

        @Test
        @DisplayName("should emit a linear flow end to end")
        void threeNodeChain() {
            EmittedProgram program = emitter.emit(Fixtures.context("three-node-chain.json"));

            assertThat(program.section(Section.IMPORTS))
                    .startsWith("from typing import Any, Dict, List, TypedDict\n")
                    .contains("from langgraph.graph import StateGraph\n");
            assertThat(program.section(Section.STATE_SCHEMA)).isEqualTo("""
                    class GraphState(TypedDict, total=False):
                        input: str
                        output: Dict[str, Any]
                        llm_response: str


                    """);
            assertThat(program.section(Section.NODE_FUNCTIONS))
                    .startsWith("def create_graph():\n    graph = StateGraph(GraphState)\n")
                    .contains("    def node_n2(state):\n")
                    .contains("        # Model: gpt-4, Temperature: 0.2\n")
                    .contains("    graph.add_node(\"node_n1\", node_n1)\n")
                    .contains("    graph.add_node(\"node_n2\", node_n2)\n")
                    .contains("    graph.add_node(\"node_n3\", node_n3)\n");
            assertThat(program.section(Section.EDGES)).isEqualTo("""
                        # --- Edges ---
                        graph.add_edge("node_n1", "node_n2")
                        graph.add_edge("node_n2", "node_n3")

                    """);
            assertThat(program.section(Section.ENTRY_EXIT)).isEqualTo("""
                        # --- Entry and Finish ---
                        graph.set_entry_point("node_n1")
                        graph.set_finish_point("node_n3")

                        return graph.compile()


                    """);
            assertThat(program.section(Section.BOOTSTRAP)).isEqualTo("""
                    if __name__ == "__main__":
                        app = create_graph()
                        result = app.invoke({"input": "Test input"})
                        print(result)
                    """);
        }

        @Test
        @DisplayName("should concatenate the sections in order")
        void sourceOrder() {
            EmittedProgram program = emitter.emit(Fixtures.context("three-node-chain.json"));

            String source = program.source();
            assertThat(source.indexOf("class GraphState")).isLessThan(source.indexOf("def create_graph"));
            assertThat(source.indexOf("# --- Edges ---")).isLessThan(source.indexOf("# --- Entry and Finish ---"));
            assertThat(source).endsWith("    print(result)\n");
        }

        @Test
        @DisplayName("should produce identical text for the same input")
        void deterministic() {
            String first = emitter.emit(Fixtures.context("predicate-routing.json")).source();
            String second = Fixtures.emitter().emit(Fixtures.context("predicate-routing.json")).source();

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("should use the configured state class name and bootstrap input")
        void settings() {
            ConversionContext base = Fixtures.context("three-node-chain.json");
            ConverterSettings settings = ConverterSettings.builder()
                    .stateClassName("FlowState")
                    .bootstrapInput("Hi \"there\"")
                    .build();

            String source = emitter.emit(new ConversionContext(base.model(), base.schema(),
                    base.classifications(), base.plans(), settings)).source();

            assertThat(source).contains("class FlowState(TypedDict, total=False):\n");
            assertThat(source).contains("    graph = StateGraph(FlowState)\n");
            assertThat(source).contains("app.invoke({\"input\": \"Hi \\\"there\\\"\"})");
        }

        @Test
        @DisplayName("should fall back to the functional TypedDict form for non-identifier fields")
        void functionalSchema() {
            NodeSpec node = new NodeSpec("n", "", null, Map.of(NodeSpec.CODE_INPUT, "state[\"my-field\"] = 1"));

            EmittedProgram program = emitter.emit(Fixtures.context(Fixtures.model(List.of(node), List.of())));

            assertThat(program.section(Section.STATE_SCHEMA))
                    .startsWith("GraphState = TypedDict(\n    \"GraphState\",\n    {\n")
                    .contains("        \"my-field\": int,\n")
                    .contains("    total=False,\n)\n");
            assertThat(PythonSyntaxChecker.check(program.source())).isEmpty();
        }

        @Test
        @DisplayName("should declare every field the id-recognised custom bodies write")
        void customRoleFields() {
            EmittedProgram program = Fixtures.emit("chat-pipeline.json");

            assertThat(program.section(Section.STATE_SCHEMA))
                    .contains("    messages: List[Any]\n")
                    .contains("    question: str\n")
                    .contains("    context: str\n")
                    .contains("    prompt: str\n")
                    .contains("    response: str\n");
            assertThat(program.section(Section.NODE_FUNCTIONS))
                    .contains("state[\"question\"] = state[\"input\"]")
                    .contains("state[\"response\"] = f\"AI Response: {prompt}\"");
            assertThat(PythonSyntaxChecker.check(program.source())).isEmpty();
        }

        @Test
        @DisplayName("should refuse a flow without nodes")
        void emptyModel() {
            ConversionContext context = Fixtures.context(Fixtures.model(List.of(), List.of()));

            assertThatThrownBy(() -> emitter.emit(context))
                    .isInstanceOf(CodeGenerationException.class)
                    .hasMessage("Flow has no nodes, nothing to generate");
        }

        @ParameterizedTest
        @ValueSource(strings = {"three-node-chain.json", "value-routing.json", "predicate-routing.json",
                "custom-logic.json"})
        @DisplayName("should emit programs that pass validation")
        void validates(String fixture) {
            EmittedProgram program = emitter.emit(Fixtures.context(fixture));

            assertThat(new ProgramValidator().validate(program).messages()).isEmpty();
        }
    }

    // =========================================================================
    //  Edges
    // =========================================================================

    @Nested
    @DisplayName("Edges")
    class Edges {

        @Test
        @DisplayName("should route string-valued guards through a mapping")
        void directTable() {
            EmittedProgram program = emitter.emit(Fixtures.context("value-routing.json"));

            assertThat(program.section(Section.EDGES)).isEqualTo("""
                        # --- Edges ---

                        # Conditional routing from classify on route
                        graph.add_conditional_edges(
                            "classify",
                            lambda state: state.get("route", ""),
                            {
                                "billing": "billing",
                                "support": "support",
                            },
                        )

                    """);
        }

        @Test
        @DisplayName("should generate a decision function for predicate guards")
        void syntheticRouter() {
            String edges = emitter.emit(Fixtures.context("predicate-routing.json")).section(Section.EDGES);

            assertThat(edges)
                    .contains("    # Conditional routing from score\n")
                    .contains("    def score_router(state):\n")
                    .contains("        elif state.get('score') >= 50 or 'flag' in state.get('tags', ''):\n"
                            + "            return \"review\"\n")
                    .contains("        else:\n            return \"reject\"\n")
                    .contains("""
                                graph.add_conditional_edges(
                                    "score",
                                    score_router,
                                    {
                                        "approve": "approve",
                                        "review": "review",
                                        "reject": "reject",
                                    },
                                )
                            """);
        }

        @Test
        @DisplayName("should not let a router shadow a node function")
        void routerNameCollision() {
            List<NodeSpec> nodes = List.of(
                    new NodeSpec("s", "", "Score", Map.of()),
                    new NodeSpec("x", "", "Score Router", Map.of()),
                    NodeSpec.of("a", ""),
                    NodeSpec.of("b", ""));
            List<EdgeSpec> edges = List.of(
                    EdgeSpec.guarded("s", "a", "n > 1"),
                    EdgeSpec.guarded("s", "b", "n <= 1"));

            String source = emitter.emit(Fixtures.context(Fixtures.model(nodes, edges))).source();

            assertThat(source).contains("    def score_router(state):\n        \"\"\"");
            assertThat(source).contains("    def score_router_2(state):\n        if ");
            assertThat(source).contains("        score_router_2,\n");
        }

        @Test
        @DisplayName("should keep guards of mixed edges as comments")
        void guardComments() {
            List<NodeSpec> nodes = List.of(NodeSpec.of("a", ""), NodeSpec.of("b", ""), NodeSpec.of("c", ""));
            List<EdgeSpec> edges = List.of(
                    EdgeSpec.guarded("a", "b", "x == \"1\""),
                    EdgeSpec.unconditional("a", "c"));

            String edgeSection = emitter.emit(Fixtures.context(Fixtures.model(nodes, edges))).section(Section.EDGES);

            assertThat(edgeSection).isEqualTo("""
                        # --- Edges ---
                        # Condition: x == "1"
                        graph.add_edge("node_a", "node_b")
                        graph.add_edge("node_a", "node_c")

                    """);
        }
    }

    // =========================================================================
    //  Custom logic
    // =========================================================================

    @Nested
    @DisplayName("Custom logic")
    class CustomLogic {

        @Test
        @DisplayName("should register a defined function and wrap a bare body")
        void embedded() {
            String functions = emitter.emit(Fixtures.context("custom-logic.json")).section(Section.NODE_FUNCTIONS);

            assertThat(functions)
                    .contains("    def enrich_state(state):\n        state[\"attempts\"] = 0\n")
                    .contains("    graph.add_node(\"enrich\", enrich_state)\n")
                    .contains("    def finish(state):\n        state[\"done\"] = True\n        return state\n")
                    .contains("    graph.add_node(\"finish\", finish)\n");
        }

        @Test
        @DisplayName("should apply overrides and fall back to templates for discarded logic")
        void repairs() {
            ConversionContext context = Fixtures.context("custom-logic.json")
                    .withRepairs(Map.of("finish", "state[\"done\"] = False"), Set.of("enrich"));

            EmittedProgram program = emitter.emit(context);

            assertThat(program.context().isRepaired()).isTrue();
            assertThat(program.section(Section.NODE_FUNCTIONS))
                    .contains("    # Custom logic could not be repaired, generated from the custom template\n"
                            + "    def enrich(state):\n")
                    .contains("    graph.add_node(\"enrich\", enrich)\n")
                    .contains("        state[\"done\"] = False\n")
                    .doesNotContain("enrich_state")
                    .doesNotContain("state[\"done\"] = True");
        }
    }
}
