package com.eainde.flowconverter.validation;

import com.eainde.flowconverter.codegen.EmittedProgram;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks an emitted program before it is handed out.
 *
 * <p>Three independent checks, all of which always run:</p>
 * <ul>
 *   <li>{@code REFERENCE}: nodes named by {@code add_edge}, {@code add_conditional_edges}
 *       (source and mapped targets), {@code set_entry_point} and {@code set_finish_point}
 *       are registered with {@code add_node}; {@code START} and {@code END} are exempt;</li>
 *   <li>{@code ENTRY_EXIT}: exactly one entry point and one finish point;</li>
 *   <li>{@code SYNTAX}: {@link PythonSyntaxChecker}.</li>
 * </ul>
 */
@Slf4j
@Component
public class ProgramValidator {

    private static final Set<String> BUILTIN_NODES = Set.of("START", "END");

    private static final Pattern GRAPH_CALL = Pattern.compile(
            "\\bgraph\\.(add_node|add_edge|add_conditional_edges|set_entry_point|set_finish_point)\\s*\\(");
    private static final Pattern QUOTED = Pattern.compile("^(?:\"([^\"\\\\]*)\"|'([^'\\\\]*)')$");

    public ValidationResult validate(EmittedProgram program) {
        Objects.requireNonNull(program, "program");
        String source = program.source();

        List<ValidationIssue> issues = new ArrayList<>();
        List<GraphCall> calls = graphCalls(source);
        issues.addAll(checkReferences(calls));
        issues.addAll(checkEntryExit(calls));
        issues.addAll(PythonSyntaxChecker.check(source));

        ValidationResult result = new ValidationResult(issues);
        if (result.isValid()) {
            log.debug("Generated program passed validation");
        } else {
            log.debug("Generated program has {} validation issues: {}", issues.size(), result.messages());
        }
        return result;
    }

    // =========================================================================
    //  Checks
    // =========================================================================

    private List<ValidationIssue> checkReferences(List<GraphCall> calls) {
        Set<String> registered = new LinkedHashSet<>();
        for (GraphCall call : calls) {
            if (call.method().equals("add_node") && !call.arguments().isEmpty()) {
                nodeName(call.arguments().get(0)).ifPresent(registered::add);
            }
        }

        List<ValidationIssue> issues = new ArrayList<>();
        for (GraphCall call : calls) {
            List<String> referenced = new ArrayList<>();
            switch (call.method()) {
                case "add_edge" -> referenced.addAll(call.arguments());
                case "add_conditional_edges" -> {
                    if (!call.arguments().isEmpty()) {
                        referenced.add(call.arguments().get(0));
                    }
                    if (call.arguments().size() > 2) {
                        referenced.addAll(mappingValues(call.arguments().get(2)));
                    }
                }
                case "set_entry_point", "set_finish_point" -> {
                    if (!call.arguments().isEmpty()) {
                        referenced.add(call.arguments().get(0));
                    }
                }
                default -> {
                    // add_node registers, it does not reference
                }
            }
            for (String argument : referenced) {
                if (BUILTIN_NODES.contains(argument)) {
                    continue;
                }
                Optional<String> name = nodeName(argument);
                if (name.isEmpty()) {
                    issues.add(new ValidationIssue(ValidationIssue.Check.REFERENCE, call.line(),
                            call.method() + " uses '" + argument + "', which is not a node name"));
                } else if (!registered.contains(name.get())) {
                    issues.add(new ValidationIssue(ValidationIssue.Check.REFERENCE, call.line(),
                            call.method() + " references node '" + name.get() + "', which is never added"));
                }
            }
        }
        return issues;
    }

    private List<ValidationIssue> checkEntryExit(List<GraphCall> calls) {
        List<ValidationIssue> issues = new ArrayList<>();
        long entries = calls.stream().filter(call -> call.method().equals("set_entry_point")).count();
        long finishes = calls.stream().filter(call -> call.method().equals("set_finish_point")).count();
        if (entries != 1) {
            issues.add(new ValidationIssue(ValidationIssue.Check.ENTRY_EXIT, 0,
                    "expected exactly one set_entry_point call, found " + entries));
        }
        if (finishes != 1) {
            issues.add(new ValidationIssue(ValidationIssue.Check.ENTRY_EXIT, 0,
                    "expected exactly one set_finish_point call, found " + finishes));
        }
        return issues;
    }

    // =========================================================================
    //  Call extraction
    // =========================================================================

    record GraphCall(String method, List<String> arguments, int line) {}

    /** Every {@code graph.<method>(...)} call outside comments, with its top-level arguments. */
    static List<GraphCall> graphCalls(String source) {
        List<GraphCall> calls = new ArrayList<>();
        Matcher matcher = GRAPH_CALL.matcher(source);
        while (matcher.find()) {
            if (inComment(source, matcher.start())) {
                continue;
            }
            int close = closingParen(source, matcher.end() - 1);
            if (close < 0) {
                continue; // reported by the syntax check
            }
            List<String> arguments = splitTopLevel(source.substring(matcher.end(), close));
            calls.add(new GraphCall(matcher.group(1), arguments, lineOf(source, matcher.start())));
        }
        return calls;
    }

    private static Optional<String> nodeName(String argument) {
        Matcher quoted = QUOTED.matcher(argument.strip());
        if (!quoted.matches()) {
            return Optional.empty();
        }
        return Optional.of(quoted.group(1) != null ? quoted.group(1) : quoted.group(2));
    }

    /** Values of a {@code {"k": "v", ...}} literal argument; anything else yields nothing. */
    private static List<String> mappingValues(String argument) {
        String text = argument.strip();
        if (!text.startsWith("{") || !text.endsWith("}")) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (String entry : splitTopLevel(text.substring(1, text.length() - 1))) {
            int colon = topLevelColon(entry);
            if (colon >= 0) {
                values.add(entry.substring(colon + 1).strip());
            }
        }
        return values;
    }

    private static boolean inComment(String source, int index) {
        int lineStart = source.lastIndexOf('\n', index - 1) + 1;
        return source.substring(lineStart, index).strip().startsWith("#");
    }

    private static int lineOf(String source, int index) {
        int line = 1;
        for (int i = 0; i < index; i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static int closingParen(String source, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < source.length(); i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i).strip());
                start = i + 1;
            }
        }
        String last = text.substring(start).strip();
        if (!last.isEmpty()) {
            parts.add(last);
        }
        return parts;
    }

    private static int topLevelColon(String entry) {
        char quote = 0;
        int depth = 0;
        for (int i = 0; i < entry.length(); i++) {
            char c = entry.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ':' && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
