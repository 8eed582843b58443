package com.eainde.flowconverter.validation;

import com.eainde.flowconverter.Fixtures;
import com.eainde.flowconverter.codegen.EmittedProgram;
import com.eainde.flowconverter.codegen.EmittedProgram.Section;
import com.eainde.flowconverter.document.NodeSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ProgramValidatorTest {

    private final ProgramValidator validator = new ProgramValidator();

    private static EmittedProgram withSection(EmittedProgram program, Section section, String text) {
        Map<Section, String> sections = new EnumMap<>(program.sections());
        sections.put(section, text);
        return new EmittedProgram(sections, program.context());
    }

    // =========================================================================
    //  References
    // =========================================================================

    @Nested
    @DisplayName("References")
    class References {

        @Test
        @DisplayName("should accept an emitted program")
        void valid() {
            ValidationResult result = validator.validate(Fixtures.emit("three-node-chain.json"));

            assertThat(result.isValid()).isTrue();
            assertThat(result.issues()).isEmpty();
        }

        @Test
        @DisplayName("should report an edge to a node that is never added")
        void unregisteredTarget() {
            EmittedProgram program = Fixtures.emit("three-node-chain.json");
            EmittedProgram broken = withSection(program, Section.EDGES,
                    program.section(Section.EDGES).replace("\"node_n2\", \"node_n3\"", "\"node_n2\", \"node_n9\""));

            ValidationResult result = validator.validate(broken);

            assertThat(result.issues())
                    .extracting(ValidationIssue::check, ValidationIssue::message)
                    .containsExactly(tuple(ValidationIssue.Check.REFERENCE,
                            "add_edge references node 'node_n9', which is never added"));
        }

        @Test
        @DisplayName("should report a mapped target of a conditional edge")
        void unregisteredMappingTarget() {
            EmittedProgram program = Fixtures.emit("value-routing.json");
            EmittedProgram broken = withSection(program, Section.EDGES,
                    program.section(Section.EDGES).replace("\"support\": \"support\"", "\"support\": \"helpdesk\""));

            assertThat(validator.validate(broken).issues())
                    .extracting(ValidationIssue::message)
                    .containsExactly("add_conditional_edges references node 'helpdesk', which is never added");
        }

        @Test
        @DisplayName("should report a node given by variable instead of by name")
        void unquotedArgument() {
            EmittedProgram program = Fixtures.emit("three-node-chain.json");
            EmittedProgram broken = withSection(program, Section.EDGES,
                    program.section(Section.EDGES).replace("add_edge(\"node_n1\"", "add_edge(first"));

            assertThat(validator.validate(broken).issues())
                    .extracting(ValidationIssue::message)
                    .containsExactly("add_edge uses 'first', which is not a node name");
        }

        @Test
        @DisplayName("should accept START and END and ignore commented-out calls")
        void builtinsAndComments() {
            EmittedProgram program = Fixtures.emit("three-node-chain.json");
            EmittedProgram edited = withSection(program, Section.EDGES, """
                        # --- Edges ---
                        # graph.add_edge("nowhere", "node_n1")
                        graph.add_edge(START, "node_n1")
                        graph.add_edge("node_n1", "node_n2")
                        graph.add_edge("node_n2", "node_n3")
                        graph.add_edge("node_n3", END)

                    """);

            assertThat(validator.validate(edited).isValid()).isTrue();
        }
    }

    // =========================================================================
    //  Entry and finish
    // =========================================================================

    @Nested
    @DisplayName("Entry and finish")
    class EntryAndFinish {

        @Test
        @DisplayName("should report a second entry point")
        void twoEntryPoints() {
            EmittedProgram program = Fixtures.emit("three-node-chain.json");
            EmittedProgram broken = withSection(program, Section.ENTRY_EXIT, program.section(Section.ENTRY_EXIT)
                    .replace("    graph.set_finish_point", "    graph.set_entry_point(\"node_n2\")\n    graph.set_finish_point"));

            assertThat(validator.validate(broken).issues())
                    .extracting(ValidationIssue::check, ValidationIssue::line, ValidationIssue::message)
                    .containsExactly(tuple(ValidationIssue.Check.ENTRY_EXIT, 0,
                            "expected exactly one set_entry_point call, found 2"));
        }

        @Test
        @DisplayName("should report a missing finish point")
        void noFinishPoint() {
            EmittedProgram program = Fixtures.emit("three-node-chain.json");
            EmittedProgram broken = withSection(program, Section.ENTRY_EXIT, program.section(Section.ENTRY_EXIT)
                    .replace("    graph.set_finish_point(\"node_n3\")\n", ""));

            ValidationResult result = validator.validate(broken);

            assertThat(result.has(ValidationIssue.Check.ENTRY_EXIT)).isTrue();
            assertThat(result.messages()).containsExactly("ENTRY_EXIT: expected exactly one set_finish_point call, found 0");
        }
    }

    // =========================================================================
    //  Syntax
    // =========================================================================

    @Test
    @DisplayName("should report malformed custom logic as a syntax issue")
    void syntax() {
        ValidationResult result = validator.validate(Fixtures.emit("misindented-logic.json"));

        assertThat(result.isValid()).isFalse();
        assertThat(result.has(ValidationIssue.Check.SYNTAX)).isTrue();
        assertThat(result.has(ValidationIssue.Check.REFERENCE)).isFalse();
        assertThat(String.join("\n", result.messages())).contains("token recognition error");
    }

    @Test
    @DisplayName("should report custom logic whose expressions do not parse")
    void expressionSyntax() {
        NodeSpec node = new NodeSpec("calc", "", null, Map.of(NodeSpec.CODE_INPUT, "state[\"x\"] = = 1"));
        EmittedProgram program = Fixtures.emitter().emit(Fixtures.context(Fixtures.model(List.of(node), List.of())));

        ValidationResult result = validator.validate(program);

        assertThat(result.has(ValidationIssue.Check.SYNTAX)).isTrue();
        assertThat(result.has(ValidationIssue.Check.REFERENCE)).isFalse();
        assertThat(result.has(ValidationIssue.Check.ENTRY_EXIT)).isFalse();
    }

    @Test
    @DisplayName("should split graph call arguments at top level only")
    void graphCalls() {
        List<ProgramValidator.GraphCall> calls =
                ProgramValidator.graphCalls("x = 1\ngraph.add_edge(\"a, b\", f(1, 2))\n");

        assertThat(calls).hasSize(1);
        assertThat(calls.get(0).method()).isEqualTo("add_edge");
        assertThat(calls.get(0).arguments()).containsExactly("\"a, b\"", "f(1, 2)");
        assertThat(calls.get(0).line()).isEqualTo(2);
    }
}
