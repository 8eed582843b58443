package com.eainde.flowconverter.validation;

import com.eainde.flowconverter.codegen.CustomLogicBlock;
import com.eainde.flowconverter.validation.PythonLexer.LogicalLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Re-indents a custom logic snippet from its block structure.
 *
 * <p>Every statement is placed one level (four spaces) below the nearest open
 * block header; the original indentation is only used to decide where a block
 * ends and which {@code if}/{@code try} a continuation clause belongs to.
 * Lines inside multi-line strings are left alone, and continuation lines of a
 * bracketed statement move by the same amount as the statement's first line.
 * A header without a body gets a {@code pass}.</p>
 *
 * <p>The result is not guaranteed to be valid; the caller checks it.</p>
 */
public final class LogicNormalizer {

    private static final Logger log = LoggerFactory.getLogger(LogicNormalizer.class);

    private static final int INDENT_WIDTH = 4;

    private static final Map<String, Set<String>> FOLLOWS = Map.of(
            "elif", Set.of("if", "elif"),
            "else", Set.of("if", "elif", "for", "while", "except"),
            "except", Set.of("try", "except"),
            "finally", Set.of("try", "except", "else"));

    /** A block whose body is currently open. */
    private record OpenBlock(String headerKeyword, int headerIndent, int headerDepth, int bodyIndent) {
        int bodyDepth() {
            return headerDepth + 1;
        }
    }

    private LogicNormalizer() {}

    public static String normalize(String code) {
        String text = CustomLogicBlock.dedent(code);
        String[] physical = text.split("\n", -1);
        List<LogicalLine> lines = PythonLexer.lex(text);
        if (lines.isEmpty()) {
            return text;
        }

        int[] depths = new int[lines.size()];
        Map<Integer, String> insertBefore = new HashMap<>();
        Deque<OpenBlock> open = new ArrayDeque<>();

        int depth = 0;
        LogicalLine header = null;
        int headerDepth = 0;
        for (int i = 0; i < lines.size(); i++) {
            LogicalLine line = lines.get(i);
            Set<String> follows = FOLLOWS.get(line.keyword());

            if (header != null) {
                if (follows != null) {
                    insertBefore.put(line.firstLine(), pass(headerDepth + 1));
                    open.push(new OpenBlock(header.keyword(), header.indent(), headerDepth, header.indent() + 1));
                } else {
                    open.push(new OpenBlock(header.keyword(), header.indent(), headerDepth, line.indent()));
                    depth = headerDepth + 1;
                }
            }

            if (follows != null) {
                OpenBlock match = continuedBlock(open, follows, line.indent());
                if (match != null) {
                    while (open.peek() != match) {
                        open.pop();
                    }
                    open.pop();
                    depth = match.headerDepth();
                }
            } else if (header == null) {
                while (!open.isEmpty() && line.indent() < open.peek().bodyIndent()) {
                    open.pop();
                }
                depth = open.isEmpty() ? 0 : open.peek().bodyDepth();
            }

            depths[i] = depth;
            header = line.endsWithColon() ? line : null;
            headerDepth = depth;
        }
        if (header != null) {
            // text ends with '\n', so the last physical element is empty
            insertBefore.put(physical.length, pass(headerDepth + 1));
        }

        String[] result = new String[physical.length];
        Map<Integer, Integer> statementIndent = new HashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            LogicalLine line = lines.get(i);
            int newIndent = depths[i] * INDENT_WIDTH;
            int delta = newIndent - line.indent();
            statementIndent.put(line.firstLine(), newIndent);
            for (int p = line.firstLine(); p <= line.lastLine(); p++) {
                String original = physical[p - 1];
                if (p == line.firstLine()) {
                    result[p - 1] = " ".repeat(newIndent) + original.stripLeading();
                } else if (line.linesInString().contains(p)) {
                    result[p - 1] = original;
                } else {
                    result[p - 1] = shift(original, delta);
                }
            }
        }

        // blank lines stay blank, comment lines follow the next statement
        int nextIndent = 0;
        for (int p = physical.length; p >= 1; p--) {
            Integer indent = statementIndent.get(p);
            if (indent != null) {
                nextIndent = indent;
            } else if (result[p - 1] == null) {
                String stripped = physical[p - 1].strip();
                result[p - 1] = stripped.isEmpty() ? "" : " ".repeat(nextIndent) + stripped;
            }
        }

        List<String> out = new ArrayList<>();
        for (int p = 1; p <= physical.length; p++) {
            String inserted = insertBefore.get(p);
            if (inserted != null) {
                out.add(inserted);
            }
            out.add(result[p - 1]);
        }
        String normalized = String.join("\n", out);
        if (log.isDebugEnabled() && !normalized.equals(text)) {
            log.debug("Re-indented custom logic ({} statements)", lines.size());
        }
        return normalized;
    }

    /**
     * The open block a continuation clause belongs to: preferably one whose header
     * sat at the clause's own original indentation, else the innermost that fits.
     */
    private static OpenBlock continuedBlock(Deque<OpenBlock> open, Set<String> follows, int indent) {
        OpenBlock innermost = null;
        for (OpenBlock block : open) {
            if (!follows.contains(block.headerKeyword())) {
                continue;
            }
            if (block.headerIndent() == indent) {
                return block;
            }
            if (innermost == null) {
                innermost = block;
            }
        }
        return innermost;
    }

    private static String shift(String line, int delta) {
        if (delta >= 0) {
            return line.isEmpty() ? line : " ".repeat(delta) + line;
        }
        int removable = Math.min(-delta, CustomLogicBlock.leadingSpaces(line));
        return line.substring(removable);
    }

    private static String pass(int depth) {
        return " ".repeat(depth * INDENT_WIDTH) + "pass";
    }
}
