package com.eainde.flowconverter.codegen;

import com.eainde.flowconverter.document.NodeSpec;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns node labels into Python identifiers.
 */
public final class PythonIdentifiers {

    static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await",
            "break", "class", "continue", "def", "del", "elif", "else", "except",
            "finally", "for", "from", "global", "if", "import", "in", "is", "lambda",
            "nonlocal", "not", "or", "pass", "raise", "return", "try", "while",
            "with", "yield");

    /** Names the generated module itself binds at the create_graph level. */
    private static final Set<String> RESERVED = Set.of("graph", "state", "StateGraph", "create_graph");

    private PythonIdentifiers() {}

    /**
     * Non-alphanumerics become {@code _}, the result is lower-cased, a leading digit
     * gets an {@code f_} prefix and a Python keyword a trailing {@code _}.
     */
    public static String clean(String label) {
        if (label == null || label.isEmpty()) {
            return "_";
        }
        StringBuilder out = new StringBuilder(label.length());
        for (char c : label.toCharArray()) {
            out.append(isAsciiAlphanumeric(c) ? c : '_');
        }
        String clean = out.toString().toLowerCase(Locale.ROOT);
        if (Character.isDigit(clean.charAt(0))) {
            clean = "f_" + clean;
        }
        if (KEYWORDS.contains(clean) || RESERVED.contains(clean)) {
            clean = clean + "_";
        }
        return clean;
    }

    /**
     * Function name per node id, in document order. Nodes without a label are
     * named {@code node_<id>}; repeated names get {@code _2}, {@code _3}, ...
     */
    public static Map<String, String> functionNames(Collection<NodeSpec> nodes) {
        Map<String, String> names = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>();
        for (NodeSpec node : nodes) {
            String base = node.displayLabel() != null ? clean(node.displayLabel()) : clean("node_" + node.id());
            String name = base;
            int suffix = 2;
            while (!taken.add(name)) {
                name = base + "_" + suffix++;
            }
            names.put(node.id(), name);
        }
        return names;
    }

    public static boolean isIdentifier(String text) {
        if (text == null || text.isEmpty() || KEYWORDS.contains(text)) {
            return false;
        }
        char first = text.charAt(0);
        if (!(first == '_' || Character.isLetter(first))) {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!(c == '_' || Character.isLetterOrDigit(c))) {
                return false;
            }
        }
        return true;
    }

    /** Double-quoted Python string literal, as used for node names in graph calls. */
    public static String quoted(String value) {
        StringBuilder out = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
