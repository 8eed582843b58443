package com.eainde.flowconverter.edges;

import com.eainde.flowconverter.Fixtures;
import com.eainde.flowconverter.document.EdgeSpec;
import com.eainde.flowconverter.model.GraphModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuardCompilerTest {

    private final GuardCompiler compiler = new GuardCompiler();

    // =========================================================================
    //  Direct tables
    // =========================================================================

    @Nested
    @DisplayName("Direct table")
    class DirectTables {

        @Test
        @DisplayName("should map each literal to its target in edge order")
        void literalTable() {
            RoutingPlan plan = compiler.compile(List.of(
                    EdgeSpec.guarded("src", "X", "field == \"a\""),
                    EdgeSpec.guarded("src", "Y", "field == \"b\"")));

            assertThat(plan).isEqualTo(new RoutingPlan.DirectTable("src", "field", Map.of("a", "X", "b", "Y")));
            assertThat(((RoutingPlan.DirectTable) plan).valueToTarget().keySet()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("should accept mixed spellings, reversed operands and parentheses")
        void spellings() {
            RoutingPlan plan = compiler.compile(List.of(
                    EdgeSpec.guarded("src", "X", "state['mode'] == 'fast'"),
                    EdgeSpec.guarded("src", "Y", "('slow' == state.get(\"mode\"))")));

            assertThat(plan).isInstanceOfSatisfying(RoutingPlan.DirectTable.class, table -> {
                assertThat(table.field()).isEqualTo("mode");
                assertThat(table.valueToTarget()).containsExactly(
                        Map.entry("fast", "X"), Map.entry("slow", "Y"));
            });
        }

        @Test
        @DisplayName("should compile the value routing fixture to a table")
        void fixture() {
            Map<String, RoutingPlan> plans = compiler.compileAll(Fixtures.model("value-routing.json"));

            assertThat(plans).containsOnlyKeys("classify");
            assertThat(plans.get("classify")).isEqualTo(new RoutingPlan.DirectTable(
                    "classify", "route", Map.of("billing", "billing", "support", "support")));
        }
    }

    // =========================================================================
    //  Synthetic routers
    // =========================================================================

    @Nested
    @DisplayName("Synthetic router")
    class SyntheticRouters {

        @Test
        @DisplayName("should fall back to a router when a second field joins a guard")
        void secondField() {
            RoutingPlan plan = compiler.compile(List.of(
                    EdgeSpec.guarded("src", "X", "field == \"a\" and other == \"c\""),
                    EdgeSpec.guarded("src", "Y", "field == \"b\" or other == \"d\"")));

            assertThat(plan).isEqualTo(new RoutingPlan.SyntheticRouter("src", List.of(
                    new RoutingPlan.Branch("state.get('field') == 'a' and state.get('other') == 'c'", "X"),
                    new RoutingPlan.Branch("state.get('field') == 'b' or state.get('other') == 'd'", "Y")),
                    "Y"));
        }

        @Test
        @DisplayName("should keep declaration order and default to the last target")
        void declarationOrder() {
            RoutingPlan plan = compiler.compileAll(Fixtures.model("predicate-routing.json")).get("score");

            assertThat(plan).isInstanceOfSatisfying(RoutingPlan.SyntheticRouter.class, router -> {
                assertThat(router.branches()).extracting(RoutingPlan.Branch::targetId)
                        .containsExactly("approve", "review", "reject");
                assertThat(router.branches().get(1).predicate())
                        .isEqualTo("state.get('score') >= 50 or 'flag' in state.get('tags', '')");
                assertThat(router.defaultTarget()).isEqualTo("reject");
            });
        }

        @Test
        @DisplayName("should route non-string equality through a router")
        void numericEquality() {
            RoutingPlan plan = compiler.compile(List.of(
                    EdgeSpec.guarded("src", "X", "retries == 0"),
                    EdgeSpec.guarded("src", "Y", "retries == 1")));

            assertThat(plan).isInstanceOf(RoutingPlan.SyntheticRouter.class);
        }

        @Test
        @DisplayName("should build router names from the source function name")
        void routerName() {
            assertThat(RoutingPlan.SyntheticRouter.routerName("classify")).isEqualTo("classify_router");
        }
    }

    // =========================================================================
    //  Pass-through
    // =========================================================================

    @Nested
    @DisplayName("Pass-through")
    class PassThroughs {

        @Test
        @DisplayName("should keep unguarded edges as plain edges")
        void unguarded() {
            GraphModel model = Fixtures.model("three-node-chain.json");

            assertThat(compiler.compileAll(model)).containsExactly(
                    Map.entry("n1", new RoutingPlan.PassThrough("n1", List.of(EdgeSpec.unconditional("n1", "n2")))),
                    Map.entry("n2", new RoutingPlan.PassThrough("n2", List.of(EdgeSpec.unconditional("n2", "n3")))));
        }

        @Test
        @DisplayName("should keep mixed guarded and unguarded edges as plain edges")
        void mixed() {
            List<EdgeSpec> edges = List.of(
                    EdgeSpec.guarded("src", "X", "field == 'a'"),
                    EdgeSpec.unconditional("src", "Y"));

            assertThat(compiler.compile(edges)).isEqualTo(new RoutingPlan.PassThrough("src", edges));
        }

        @Test
        @DisplayName("should fall back when any guard does not parse")
        void unparseable() {
            List<EdgeSpec> edges = List.of(
                    EdgeSpec.guarded("src", "X", "field == 'a'"),
                    EdgeSpec.guarded("src", "Y", "field is not None"));

            assertThat(compiler.compile(edges)).isInstanceOf(RoutingPlan.PassThrough.class);
        }

        @Test
        @DisplayName("should fall back when a guard is nested too deeply to parse")
        void deeplyNested() {
            int levels = 20_000;
            List<EdgeSpec> edges = List.of(
                    EdgeSpec.guarded("src", "X", "(".repeat(levels) + "route == 'a'" + ")".repeat(levels)),
                    EdgeSpec.guarded("src", "Y", "route == 'b'"));

            assertThat(compiler.compile(edges)).isEqualTo(new RoutingPlan.PassThrough("src", edges));
        }

        @Test
        @DisplayName("should fall back when no guard references state")
        void constantGuards() {
            List<EdgeSpec> edges = List.of(
                    EdgeSpec.guarded("src", "X", "True"),
                    EdgeSpec.guarded("src", "Y", "1 == 1"));

            assertThat(compiler.compile(edges)).isInstanceOf(RoutingPlan.PassThrough.class);
        }
    }

    @Test
    @DisplayName("should reject empty input and edges from different sources")
    void invalidArguments() {
        assertThatThrownBy(() -> compiler.compile(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> compiler.compile(List.of(
                EdgeSpec.unconditional("a", "b"),
                EdgeSpec.unconditional("c", "b"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("several sources");
    }
}
