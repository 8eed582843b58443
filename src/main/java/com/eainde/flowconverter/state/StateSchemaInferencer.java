package com.eainde.flowconverter.state;

import com.eainde.flowconverter.document.EdgeSpec;
import com.eainde.flowconverter.document.NodeSpec;
import com.eainde.flowconverter.edges.ComparisonOperator;
import com.eainde.flowconverter.edges.GuardExpression;
import com.eainde.flowconverter.edges.GuardParser;
import com.eainde.flowconverter.edges.Operand;
import com.eainde.flowconverter.model.GraphModel;
import com.eainde.flowconverter.nodes.CustomNodeRole;
import com.eainde.flowconverter.nodes.NodeCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the shared {@link StateSchema} by static inspection of node logic and edge guards.
 *
 * <p>Contribution order decides the field order and, since the first type
 * proposed for a name wins, the field types:</p>
 * <ol>
 *   <li>the seeds {@code input} and {@code output};</li>
 *   <li>per node, in document order: {@code state["f"] = v} assignments, the
 *       entries of {@code return {...}} literals, fields tested with
 *       {@code "f" in state}, then the fields of the node's {@link CustomNodeRole}
 *       when it is a custom node, then the category's default fields;</li>
 *   <li>per edge, in declaration order: fields compared against literals in the guard.</li>
 * </ol>
 *
 * <p>Never fails: text that matches nothing contributes nothing.</p>
 */
@Slf4j
@Component
public class StateSchemaInferencer {

    private static final Pattern ASSIGNMENT =
            Pattern.compile("state\\[\\s*([\"'])([^\"']+)\\1\\s*]\\s*=(?!=)\\s*(.+?)\\s*(?:\\n|$)");
    private static final Pattern RETURN_DICT = Pattern.compile("return\\s*\\{");
    private static final Pattern DICT_KEY = Pattern.compile("^\\s*([\"'])([^\"']+)\\1\\s*:\\s*(.+)$", Pattern.DOTALL);
    private static final Pattern MEMBERSHIP = Pattern.compile("([\"'])([^\"']+)\\1\\s+(?:not\\s+)?in\\s+state\\b");
    private static final Pattern LOOSE_EQUALITY = Pattern.compile("(\\w+)\\s*==");

    public StateSchema infer(GraphModel model, Map<String, NodeCategory> classifications) {
        StateSchema schema = new StateSchema();

        for (NodeSpec node : model.nodes().values()) {
            Optional<String> code = node.customLogic();
            code.ifPresent(logic -> inferFromLogic(node.id(), logic, schema));

            NodeCategory category = classifications.getOrDefault(node.id(), NodeCategory.CUSTOM);
            if (category == NodeCategory.CUSTOM) {
                CustomNodeRole.fromNodeId(node.id()).ifPresent(role ->
                        role.defaultFields().forEach((field, type) -> propose(schema, node.id(), field, type)));
            }
            category.defaultFields().forEach(schema::propose);
        }

        for (EdgeSpec edge : model.edges()) {
            if (edge.hasGuard()) {
                inferFromGuard(edge.guardExpression(), schema);
            }
        }

        log.debug("Inferred state schema with {} fields: {}", schema.size(), schema.fields().keySet());
        return schema;
    }

    // =========================================================================
    //  Custom logic
    // =========================================================================

    private void inferFromLogic(String nodeId, String code, StateSchema schema) {
        Matcher assignment = ASSIGNMENT.matcher(code);
        while (assignment.find()) {
            propose(schema, nodeId, assignment.group(2), ValueShapes.typeOf(assignment.group(3)));
        }

        for (String[] entry : returnedEntries(code)) {
            propose(schema, nodeId, entry[0], ValueShapes.typeOf(entry[1]));
        }

        Matcher membership = MEMBERSHIP.matcher(code);
        while (membership.find()) {
            String field = membership.group(2);
            if (!schema.contains(field)) {
                propose(schema, nodeId, field, typeFromUsage(field, code));
            }
        }
    }

    private void propose(StateSchema schema, String nodeId, String field, FieldType type) {
        if (schema.propose(field, type)) {
            log.debug("Node '{}' contributes state field {}: {}", nodeId, field, type);
        }
    }

    /** Key/value source pairs of every {@code return {...}} dict literal, in order. */
    static List<String[]> returnedEntries(String code) {
        List<String[]> entries = new ArrayList<>();
        Matcher start = RETURN_DICT.matcher(code);
        while (start.find()) {
            int open = start.end() - 1;
            int close = matchingBrace(code, open);
            if (close < 0) {
                continue;
            }
            for (String item : splitTopLevel(code.substring(open + 1, close))) {
                Matcher key = DICT_KEY.matcher(item);
                if (key.matches()) {
                    entries.add(new String[]{key.group(2), key.group(3).strip()});
                }
            }
        }
        return entries;
    }

    private static int matchingBrace(String code, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < code.length(); i++) {
            char c = code.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{' || c == '[' || c == '(') {
                depth++;
            } else if (c == '}' || c == ']' || c == ')') {
                depth--;
                if (depth == 0) {
                    return c == '}' ? i : -1;
                }
            }
        }
        return -1;
    }

    private static List<String> splitTopLevel(String body) {
        List<String> items = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int itemStart = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{' || c == '[' || c == '(') {
                depth++;
            } else if (c == '}' || c == ']' || c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                items.add(body.substring(itemStart, i));
                itemStart = i + 1;
            }
        }
        if (itemStart < body.length() && !body.substring(itemStart).isBlank()) {
            items.add(body.substring(itemStart));
        }
        return items;
    }

    /** Type of a field only known from a membership test, guessed from how the code uses it. */
    static FieldType typeFromUsage(String field, String code) {
        String name = Pattern.quote(field);
        if (find("\\b" + name + "\\.(append|extend)\\(", code) || find("\\b" + name + "\\[\\s*[^\\s\"']", code)) {
            return FieldType.LIST;
        }
        if (find("\\b" + name + "\\.get\\(", code) || find("\\b" + name + "\\[\\s*[\"']", code)) {
            return FieldType.MAP;
        }
        if (find("\\b" + name + "\\s+is\\s+(True|False)\\b", code) || find("\\bnot\\s+" + name + "\\b", code)) {
            return FieldType.BOOLEAN;
        }
        if (find("\\b" + name + "\\s*[-+]=", code) || find("\\blen\\(\\s*" + name + "\\s*\\)", code)) {
            return FieldType.INTEGER;
        }
        if (find("\\b" + name + "\\s*[-+*/]\\s", code)) {
            return FieldType.FLOAT;
        }
        return FieldType.STRING;
    }

    private static boolean find(String regex, String code) {
        return Pattern.compile(regex).matcher(code).find();
    }

    // =========================================================================
    //  Edge guards
    // =========================================================================

    private void inferFromGuard(String guard, StateSchema schema) {
        Optional<GuardExpression> parsed = GuardParser.tryParse(guard);
        if (parsed.isEmpty()) {
            Matcher loose = LOOSE_EQUALITY.matcher(guard);
            while (loose.find()) {
                schema.propose(loose.group(1), FieldType.STRING);
            }
            return;
        }
        visit(parsed.get(), schema);
    }

    private void visit(GuardExpression expression, StateSchema schema) {
        if (expression instanceof GuardExpression.Or or) {
            or.operands().forEach(operand -> visit(operand, schema));
        } else if (expression instanceof GuardExpression.And and) {
            and.operands().forEach(operand -> visit(operand, schema));
        } else if (expression instanceof GuardExpression.Not not) {
            visit(not.operand(), schema);
        } else if (expression instanceof GuardExpression.Group group) {
            visit(group.inner(), schema);
        } else if (expression instanceof GuardExpression.Truthy truthy) {
            visit(truthy.operand(), schema);
        } else if (expression instanceof GuardExpression.Comparison comparison) {
            visitComparison(comparison, schema);
        }
    }

    private void visitComparison(GuardExpression.Comparison comparison, StateSchema schema) {
        Operand left = comparison.left();
        Operand right = comparison.right();

        if (comparison.operator().isMembership() && right instanceof Operand.FieldRef container) {
            visit(left, schema);
            schema.propose(container.name(), FieldType.LIST);
            return;
        }
        if (left instanceof Operand.FieldRef field) {
            typeOf(right).ifPresent(type -> schema.propose(field.name(), type));
        } else if (right instanceof Operand.FieldRef field && comparison.operator() != ComparisonOperator.IN
                && comparison.operator() != ComparisonOperator.NOT_IN) {
            typeOf(left).ifPresent(type -> schema.propose(field.name(), type));
        }
        visit(left, schema);
        visit(right, schema);
    }

    private void visit(Operand operand, StateSchema schema) {
        if (operand instanceof Operand.FunctionCall call) {
            if ("len".equals(call.name()) && call.arguments().size() == 1
                    && call.arguments().get(0) instanceof Operand.FieldRef field) {
                schema.propose(field.name(), FieldType.LIST);
            }
            call.arguments().forEach(argument -> visit(argument, schema));
        } else if (operand instanceof Operand.MethodCall call) {
            if (call.target() instanceof Operand.FieldRef field) {
                schema.propose(field.name(), FieldType.STRING);
            }
            call.arguments().forEach(argument -> visit(argument, schema));
        }
    }

    /** Field type implied by the other side of a comparison, if it is a constant. */
    private static Optional<FieldType> typeOf(Operand operand) {
        if (operand instanceof Operand.Literal literal) {
            return literalType(literal);
        }
        if (operand instanceof Operand.ListLiteral list && !list.elements().isEmpty()
                && list.elements().get(0) instanceof Operand.Literal first) {
            return literalType(first);
        }
        return Optional.empty();
    }

    private static Optional<FieldType> literalType(Operand.Literal literal) {
        return switch (literal.kind()) {
            case STRING -> Optional.of(FieldType.STRING);
            case INTEGER -> Optional.of(FieldType.INTEGER);
            case FLOAT -> Optional.of(FieldType.FLOAT);
            case BOOLEAN -> Optional.of(FieldType.BOOLEAN);
            case NONE -> Optional.of(FieldType.ANY);
        };
    }
}
