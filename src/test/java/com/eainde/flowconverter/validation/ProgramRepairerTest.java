package com.eainde.flowconverter.validation;

import com.eainde.flowconverter.Fixtures;
import com.eainde.flowconverter.codegen.CodeEmitter;
import com.eainde.flowconverter.codegen.EmittedProgram;
import com.eainde.flowconverter.document.NodeSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

class ProgramRepairerTest {

    private final ProgramValidator validator = new ProgramValidator();

    // =========================================================================
    //  Valid programs
    // =========================================================================

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Valid programs")
    class ValidPrograms {

        @Mock
        private CodeEmitter emitter;

        @Test
        @DisplayName("should hand back a program whose custom logic is valid without re-emitting")
        void unchanged() {
            EmittedProgram program = Fixtures.emit("custom-logic.json");

            EmittedProgram repaired = new ProgramRepairer(emitter).repair(program);

            assertThat(repaired).isSameAs(program);
            verifyNoInteractions(emitter);
        }
    }

    // =========================================================================
    //  Malformed custom logic
    // =========================================================================

    @Nested
    @DisplayName("Malformed custom logic")
    class MalformedLogic {

        private final ProgramRepairer repairer = new ProgramRepairer(Fixtures.emitter());

        @Test
        @DisplayName("should re-indent what it can and template the rest")
        void repairs() {
            EmittedProgram program = Fixtures.emit("misindented-logic.json");
            assertThat(validator.validate(program).has(ValidationIssue.Check.SYNTAX)).isTrue();

            EmittedProgram repaired = repairer.repair(program);

            assertThat(repaired.context().logicOverrides()).containsOnlyKeys("flat");
            assertThat(repaired.context().discardedLogic()).containsExactly("broken");
            assertThat(repaired.source())
                    .contains("""
                                def flat(state):
                                    if "input" in state:
                                        state["output"] = {"text": state["input"]}
                                    else:
                                        state["output"] = {}
                                    return state
                            """)
                    .contains("    # Custom logic could not be repaired, generated from the custom template\n"
                            + "    def broken(state):\n")
                    .doesNotContain("never closed");
            assertThat(validator.validate(repaired).messages()).isEmpty();
        }

        @Test
        @DisplayName("should template custom logic with a malformed expression")
        void malformedExpression() {
            NodeSpec node = new NodeSpec("calc", "", null,
                    Map.of(NodeSpec.CODE_INPUT, "total = state[\"a\"] +\nstate[\"total\"] = total"));
            EmittedProgram program = Fixtures.emitter().emit(Fixtures.context(Fixtures.model(List.of(node), List.of())));
            assertThat(validator.validate(program).has(ValidationIssue.Check.SYNTAX)).isTrue();

            EmittedProgram repaired = repairer.repair(program);

            assertThat(repaired.context().discardedLogic()).containsExactly("calc");
            assertThat(repaired.source())
                    .contains("    # Custom logic could not be repaired, generated from the custom template\n")
                    .doesNotContain("state[\"a\"] +");
            assertThat(validator.validate(repaired).isValid()).isTrue();
        }

        @Test
        @DisplayName("should give the same result when repairing again")
        void stable() {
            EmittedProgram once = repairer.repair(Fixtures.emit("misindented-logic.json"));

            EmittedProgram twice = repairer.repair(once);

            assertThat(twice.source()).isEqualTo(once.source());
            assertThat(twice.context().discardedLogic()).isEqualTo(once.context().discardedLogic());
        }

        @Test
        @DisplayName("should leave nodes without custom logic untouched")
        void templatesUntouched() {
            EmittedProgram program = Fixtures.emit("misindented-logic.json");

            EmittedProgram repaired = repairer.repair(program);

            String start = "    def start(state):\n";
            assertThat(repaired.source()).contains(start);
            assertThat(program.source()).contains(start);
            assertThat(repaired.section(EmittedProgram.Section.EDGES)).isEqualTo(program.section(EmittedProgram.Section.EDGES));
        }
    }
}
