package com.eainde.flowconverter.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A node's embedded custom logic, laid out as a column-0 Python block.
 *
 * <p>When the logic defines a top-level {@code def name(...)}, the block is the
 * logic itself and {@code name} is what gets registered. Otherwise the logic
 * becomes the body of {@code def <node>(state):} followed by {@code return state}.</p>
 *
 * @param source         the block, starting at column 0, ending with a newline
 * @param registeredName the function the node registration must point at
 */
public record CustomLogicBlock(String source, String registeredName) {

    private static final Pattern TOP_LEVEL_DEF = Pattern.compile("(?m)^(?:async\\s+)?def\\s+(\\w+)\\s*\\(");
    private static final int TAB_WIDTH = 4;

    public static CustomLogicBlock of(String code, String nodeFunctionName) {
        String dedented = dedent(code);
        Matcher def = TOP_LEVEL_DEF.matcher(dedented);
        if (def.find()) {
            return new CustomLogicBlock(withTrailingNewline(dedented), def.group(1));
        }
        StringBuilder wrapped = new StringBuilder();
        wrapped.append("def ").append(nodeFunctionName).append("(state):\n");
        wrapped.append(indent(dedented, "    "));
        wrapped.append("    return state\n");
        return new CustomLogicBlock(wrapped.toString(), nodeFunctionName);
    }

    /**
     * Expands tabs, strips trailing whitespace and the indentation common to all
     * non-blank lines, and drops leading and trailing blank lines.
     */
    public static String dedent(String code) {
        List<String> lines = new ArrayList<>();
        for (String line : code.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1)) {
            lines.add(expandTabs(line).stripTrailing());
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }

        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (!line.isEmpty()) {
                common = Math.min(common, leadingSpaces(line));
            }
        }
        StringBuilder out = new StringBuilder();
        for (String line : lines) {
            out.append(line.isEmpty() ? "" : line.substring(common)).append('\n');
        }
        return out.toString();
    }

    /** Prefixes every non-blank line with {@code prefix}. */
    public static String indent(String block, String prefix) {
        StringBuilder out = new StringBuilder();
        for (String line : block.split("\n", -1)) {
            if (!line.isEmpty()) {
                out.append(prefix).append(line);
            }
            out.append('\n');
        }
        // split keeps a trailing empty element for a block ending in '\n'
        return block.endsWith("\n") ? out.substring(0, out.length() - 1) : out.toString();
    }

    public static int leadingSpaces(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == ' ') {
            count++;
        }
        return count;
    }

    static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder out = new StringBuilder();
        for (char c : line.toCharArray()) {
            if (c == '\t') {
                int spaces = TAB_WIDTH - (out.length() % TAB_WIDTH);
                out.append(" ".repeat(spaces));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static String withTrailingNewline(String text) {
        return text.endsWith("\n") ? text : text + "\n";
    }
}
