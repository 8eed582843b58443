package com.eainde.flowconverter.codegen;

import com.eainde.flowconverter.codegen.EmittedProgram.Section;
import com.eainde.flowconverter.config.ConverterSettings;
import com.eainde.flowconverter.document.EdgeSpec;
import com.eainde.flowconverter.document.NodeSpec;
import com.eainde.flowconverter.edges.RoutingPlan;
import com.eainde.flowconverter.exception.CodeGenerationException;
import com.eainde.flowconverter.exception.FlowConverterException;
import com.eainde.flowconverter.model.GraphModel;
import com.eainde.flowconverter.nodes.NodeCategory;
import com.eainde.flowconverter.state.FieldType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Assembles the LangGraph Python module for a {@link ConversionContext}.
 *
 * <h3>Output layout:</h3>
 * <pre>
 * from typing import Any, Dict, List, TypedDict
 * from langgraph.graph import StateGraph
 *
 * class GraphState(TypedDict, total=False): ...
 *
 * def create_graph():
 *     graph = StateGraph(GraphState)
 *     def node(state): ...
 *     graph.add_node("node", node)
 *     # --- Edges ---
 *     # --- Entry and Finish ---
 *     return graph.compile()
 *
 * if __name__ == "__main__": ...
 * </pre>
 *
 * <p>Output depends only on the context, so the same input always yields the
 * same text. The entry point is the first node in document order and the
 * finish point the last.</p>
 */
@Slf4j
@Component
public class CodeEmitter {

    private static final String INDENT = "    ";

    private final NodeBodyGenerator bodyGenerator;

    public CodeEmitter(NodeBodyGenerator bodyGenerator) {
        this.bodyGenerator = Objects.requireNonNull(bodyGenerator, "bodyGenerator");
    }

    /**
     * @throws CodeGenerationException if the graph is empty or assembly fails
     */
    public EmittedProgram emit(ConversionContext context) {
        Objects.requireNonNull(context, "context");
        GraphModel model = context.model();
        if (model.isEmpty()) {
            throw new CodeGenerationException("Flow has no nodes, nothing to generate");
        }
        try {
            Map<String, String> names = PythonIdentifiers.functionNames(model.nodes().values());

            Map<Section, String> sections = new EnumMap<>(Section.class);
            sections.put(Section.IMPORTS, imports());
            sections.put(Section.STATE_SCHEMA, stateSchema(context));
            sections.put(Section.NODE_FUNCTIONS, nodeFunctions(context, names));
            sections.put(Section.EDGES, edges(context, names));
            sections.put(Section.ENTRY_EXIT, entryExit(model, names));
            sections.put(Section.BOOTSTRAP, bootstrap(context.settings()));

            log.info("Generated LangGraph program: {} nodes, {} routing plans{}", names.size(),
                    context.plans().size(), context.isRepaired() ? " (repaired)" : "");
            return new EmittedProgram(sections, context);
        } catch (FlowConverterException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CodeGenerationException("Error generating code: " + e.getMessage(), e);
        }
    }

    // =========================================================================
    //  Module header
    // =========================================================================

    private String imports() {
        return """
                from typing import Any, Dict, List, TypedDict

                from langgraph.graph import StateGraph


                """;
    }

    private String stateSchema(ConversionContext context) {
        String className = context.settings().getStateClassName();
        Map<String, FieldType> fields = context.schema().fields();
        boolean classSyntax = fields.keySet().stream().allMatch(PythonIdentifiers::isIdentifier);

        StringBuilder out = new StringBuilder();
        if (classSyntax) {
            out.append("class ").append(className).append("(TypedDict, total=False):\n");
            fields.forEach((name, type) ->
                    out.append(INDENT).append(name).append(": ").append(type.pythonAnnotation()).append('\n'));
        } else {
            // field names that are not identifiers need the functional form
            out.append(className).append(" = TypedDict(\n");
            out.append(INDENT).append(PythonIdentifiers.quoted(className)).append(",\n");
            out.append(INDENT).append("{\n");
            fields.forEach((name, type) -> out.append(INDENT).append(INDENT)
                    .append(PythonIdentifiers.quoted(name)).append(": ").append(type.pythonAnnotation()).append(",\n"));
            out.append(INDENT).append("},\n");
            out.append(INDENT).append("total=False,\n");
            out.append(")\n");
        }
        return out.append("\n\n").toString();
    }

    // =========================================================================
    //  Node functions
    // =========================================================================

    private String nodeFunctions(ConversionContext context, Map<String, String> names) {
        StringBuilder out = new StringBuilder();
        out.append("def create_graph():\n");
        out.append(INDENT).append("graph = StateGraph(").append(context.settings().getStateClassName()).append(")\n");
        out.append('\n');

        for (NodeSpec node : context.model().nodes().values()) {
            String name = names.get(node.id());
            NodeCategory category = context.categoryOf(node.id());
            String registered = name;
            String block;

            Optional<String> logic = logicFor(context, node);
            if (logic.isPresent()) {
                CustomLogicBlock custom = CustomLogicBlock.of(logic.get(), name);
                block = custom.source();
                registered = custom.registeredName();
                log.debug("Node '{}' -> {} (custom logic, registers {})", node.id(), name, registered);
            } else {
                block = bodyGenerator.generate(node, category, name);
                if (context.discardedLogic().contains(node.id())) {
                    block = "# Custom logic could not be repaired, generated from the "
                            + category.code() + " template\n" + block;
                }
                log.debug("Node '{}' -> {} ({} template)", node.id(), name, category.code());
            }

            out.append(CustomLogicBlock.indent(block, INDENT));
            out.append('\n');
            out.append(INDENT).append("graph.add_node(").append(PythonIdentifiers.quoted(name)).append(", ")
                    .append(registered).append(")\n");
            out.append('\n');
        }
        return out.toString();
    }

    private Optional<String> logicFor(ConversionContext context, NodeSpec node) {
        if (context.discardedLogic().contains(node.id())) {
            return Optional.empty();
        }
        String override = context.logicOverrides().get(node.id());
        return override != null ? Optional.of(override) : node.customLogic();
    }

    // =========================================================================
    //  Edges
    // =========================================================================

    private String edges(ConversionContext context, Map<String, String> names) {
        StringBuilder out = new StringBuilder();
        out.append(INDENT).append("# --- Edges ---\n");

        for (RoutingPlan plan : context.plans().values()) {
            if (plan instanceof RoutingPlan.PassThrough passThrough) {
                for (EdgeSpec edge : passThrough.edges()) {
                    if (edge.hasGuard()) {
                        out.append(INDENT).append("# Condition: ")
                                .append(edge.guardExpression().replaceAll("\\s*[\\r\\n]+\\s*", " ")).append('\n');
                    }
                    out.append(INDENT).append("graph.add_edge(")
                            .append(PythonIdentifiers.quoted(names.get(edge.source()))).append(", ")
                            .append(PythonIdentifiers.quoted(names.get(edge.target()))).append(")\n");
                }
            }
        }

        Set<String> taken = new HashSet<>(names.values());
        for (RoutingPlan plan : context.plans().values()) {
            if (plan instanceof RoutingPlan.DirectTable table) {
                directTable(out, table, names);
            } else if (plan instanceof RoutingPlan.SyntheticRouter router) {
                syntheticRouter(out, router, names, taken);
            }
        }
        return out.append('\n').toString();
    }

    private void directTable(StringBuilder out, RoutingPlan.DirectTable table, Map<String, String> names) {
        String source = names.get(table.sourceId());
        out.append('\n');
        out.append(INDENT).append("# Conditional routing from ").append(source).append(" on ")
                .append(table.field()).append('\n');
        out.append(INDENT).append("graph.add_conditional_edges(\n");
        out.append(INDENT).append(INDENT).append(PythonIdentifiers.quoted(source)).append(",\n");
        out.append(INDENT).append(INDENT).append("lambda state: state.get(")
                .append(PythonIdentifiers.quoted(table.field())).append(", \"\"),\n");
        out.append(INDENT).append(INDENT).append("{\n");
        table.valueToTarget().forEach((value, target) -> out.append(INDENT).append(INDENT).append(INDENT)
                .append(PythonIdentifiers.quoted(value)).append(": ")
                .append(PythonIdentifiers.quoted(names.get(target))).append(",\n"));
        out.append(INDENT).append(INDENT).append("},\n");
        out.append(INDENT).append(")\n");
    }

    private void syntheticRouter(StringBuilder out, RoutingPlan.SyntheticRouter router,
                                 Map<String, String> names, Set<String> taken) {
        String source = names.get(router.sourceId());
        String base = RoutingPlan.SyntheticRouter.routerName(source);
        String routerName = base;
        int suffix = 2;
        while (!taken.add(routerName)) {
            routerName = base + "_" + suffix++;
        }

        out.append('\n');
        out.append(INDENT).append("# Conditional routing from ").append(source).append('\n');
        out.append(INDENT).append("def ").append(routerName).append("(state):\n");
        String keyword = "if";
        for (RoutingPlan.Branch branch : router.branches()) {
            out.append(INDENT).append(INDENT).append(keyword).append(' ').append(branch.predicate()).append(":\n");
            out.append(INDENT).append(INDENT).append(INDENT).append("return ")
                    .append(PythonIdentifiers.quoted(names.get(branch.targetId()))).append('\n');
            keyword = "elif";
        }
        out.append(INDENT).append(INDENT).append("else:\n");
        out.append(INDENT).append(INDENT).append(INDENT).append("return ")
                .append(PythonIdentifiers.quoted(names.get(router.defaultTarget()))).append('\n');
        out.append('\n');

        Set<String> targets = new LinkedHashSet<>();
        router.branches().forEach(branch -> targets.add(names.get(branch.targetId())));
        targets.add(names.get(router.defaultTarget()));

        out.append(INDENT).append("graph.add_conditional_edges(\n");
        out.append(INDENT).append(INDENT).append(PythonIdentifiers.quoted(source)).append(",\n");
        out.append(INDENT).append(INDENT).append(routerName).append(",\n");
        out.append(INDENT).append(INDENT).append("{\n");
        for (String target : targets) {
            String quoted = PythonIdentifiers.quoted(target);
            out.append(INDENT).append(INDENT).append(INDENT).append(quoted).append(": ").append(quoted).append(",\n");
        }
        out.append(INDENT).append(INDENT).append("},\n");
        out.append(INDENT).append(")\n");
    }

    // =========================================================================
    //  Entry, finish and bootstrap
    // =========================================================================

    private String entryExit(GraphModel model, Map<String, String> names) {
        List<String> lines = new ArrayList<>();
        lines.add(INDENT + "# --- Entry and Finish ---");
        lines.add(INDENT + "graph.set_entry_point(" + PythonIdentifiers.quoted(names.get(model.firstNode().id())) + ")");
        lines.add(INDENT + "graph.set_finish_point(" + PythonIdentifiers.quoted(names.get(model.lastNode().id())) + ")");
        lines.add("");
        lines.add(INDENT + "return graph.compile()");
        return String.join("\n", lines) + "\n\n\n";
    }

    private String bootstrap(ConverterSettings settings) {
        return "if __name__ == \"__main__\":\n"
                + INDENT + "app = create_graph()\n"
                + INDENT + "result = app.invoke({\"input\": " + PythonIdentifiers.quoted(settings.getBootstrapInput()) + "})\n"
                + INDENT + "print(result)\n";
    }
}
