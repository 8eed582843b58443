package com.eainde.flowconverter.codegen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CustomLogicBlockTest {

    @Test
    @DisplayName("should keep a function definition and register its name")
    void definedFunction() {
        CustomLogicBlock block = CustomLogicBlock.of("""
                    def enrich(state):
                        state["x"] = 1
                        return state
                """, "node_fn");

        assertThat(block.registeredName()).isEqualTo("enrich");
        assertThat(block.source()).isEqualTo("""
                def enrich(state):
                    state["x"] = 1
                    return state
                """);
    }

    @Test
    @DisplayName("should wrap a bare body in a node function returning state")
    void wrappedBody() {
        CustomLogicBlock block = CustomLogicBlock.of("state[\"done\"] = True", "finish");

        assertThat(block.registeredName()).isEqualTo("finish");
        assertThat(block.source()).isEqualTo("""
                def finish(state):
                    state["done"] = True
                    return state
                """);
    }

    @Test
    @DisplayName("should not mistake a nested def for the node function")
    void nestedDef() {
        CustomLogicBlock block = CustomLogicBlock.of("x = 1\nif x:\n    def helper():\n        pass\n", "node");

        assertThat(block.registeredName()).isEqualTo("node");
    }

    @Test
    @DisplayName("should expand tabs and drop common indentation and blank edges")
    void dedent() {
        assertThat(CustomLogicBlock.dedent("\n\n\tif a:\n\t\tb = 1   \n\n")).isEqualTo("if a:\n    b = 1\n");
        assertThat(CustomLogicBlock.dedent("  a\r\n    b")).isEqualTo("a\n  b\n");
    }

    @Test
    @DisplayName("should indent non-blank lines only")
    void indent() {
        assertThat(CustomLogicBlock.indent("a\n\nb\n", "    ")).isEqualTo("    a\n\n    b\n");
    }
}
