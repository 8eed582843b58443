package com.eainde.flowconverter.validation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits Python source into logical lines.
 *
 * <p>A logical line ends at a newline that is outside brackets, outside string
 * literals and not escaped by a trailing backslash. String contents are masked
 * (every literal becomes {@code ""}) and comments are dropped from
 * {@link LogicalLine#code()}, so the normalizer can look at keywords and colons
 * without tripping over text. Malformed input (an unterminated string, an
 * unbalanced bracket) still yields lines; reporting it is left to
 * {@link PythonSyntaxChecker}.</p>
 */
final class PythonLexer {

    /**
     * @param firstLine       1-based number of the physical line the statement starts on
     * @param lastLine        1-based number of its last physical line
     * @param indent          indentation width of the first physical line, tabs expanded to 8
     * @param code            masked statement text, comments removed, trimmed
     * @param linesInString   physical line numbers that begin inside a multi-line string
     */
    record LogicalLine(int firstLine, int lastLine, int indent, String code, Set<Integer> linesInString) {

        /** The first word, or the second after {@code async}. */
        String keyword() {
            String[] words = code.split("[^A-Za-z0-9_]+", 3);
            if (words.length == 0) {
                return "";
            }
            if ("async".equals(words[0]) && words.length > 1) {
                return words[1];
            }
            return words[0];
        }

        boolean endsWithColon() {
            return code.endsWith(":");
        }
    }

    private static final String OPENERS = "([{";
    private static final String CLOSERS = ")]}";

    private PythonLexer() {}

    static List<LogicalLine> lex(String source) {
        List<LogicalLine> lines = new ArrayList<>();

        int depth = 0;
        StringBuilder code = new StringBuilder();
        Set<Integer> inString = new HashSet<>();

        int line = 1;
        int statementStart = -1;
        int statementIndent = 0;
        boolean atLineStart = true;
        boolean continued = false;
        int i = 0;
        int n = source.length();

        while (i < n) {
            char c = source.charAt(i);

            if (atLineStart) {
                atLineStart = false;
                if (statementStart < 0 && depth == 0 && !continued) {
                    int width = 0;
                    int j = i;
                    while (j < n && (source.charAt(j) == ' ' || source.charAt(j) == '\t')) {
                        width = source.charAt(j) == '\t' ? (width / 8 + 1) * 8 : width + 1;
                        j++;
                    }
                    statementIndent = width;
                    i = j;
                    continue;
                }
                continued = false;
            }

            if (c == '\n') {
                if (depth > 0 || continued) {
                    code.append(' ');
                } else if (statementStart >= 0) {
                    lines.add(new LogicalLine(statementStart, line, statementIndent, code.toString().strip(),
                            Set.copyOf(inString)));
                    code.setLength(0);
                    inString.clear();
                    statementStart = -1;
                }
                line++;
                atLineStart = true;
                i++;
                continue;
            }

            if (c == '#') {
                while (i < n && source.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }

            if (c == ' ' || c == '\t' || c == '\f' || c == '\r') {
                code.append(' ');
                i++;
                continue;
            }

            if (statementStart < 0) {
                statementStart = line;
            }

            if (c == '\\' && i + 1 < n && (source.charAt(i + 1) == '\n'
                    || (source.charAt(i + 1) == '\r' && i + 2 < n && source.charAt(i + 2) == '\n'))) {
                continued = true;
                i += source.charAt(i + 1) == '\r' ? 2 : 1;
                continue;
            }

            if (c == '"' || c == '\'') {
                boolean triple = i + 2 < n && source.charAt(i + 1) == c && source.charAt(i + 2) == c;
                i += triple ? 3 : 1;
                while (i < n) {
                    char s = source.charAt(i);
                    if (s == '\\') {
                        if (i + 1 < n && source.charAt(i + 1) == '\n') {
                            line++;
                            inString.add(line);
                        }
                        i += 2;
                        continue;
                    }
                    if (s == '\n') {
                        if (!triple) {
                            break;
                        }
                        line++;
                        inString.add(line);
                        i++;
                        continue;
                    }
                    if (s == c && (!triple || (i + 2 < n && source.charAt(i + 1) == c && source.charAt(i + 2) == c))) {
                        i += triple ? 3 : 1;
                        break;
                    }
                    i++;
                }
                code.append("\"\"");
                continue;
            }

            if (OPENERS.indexOf(c) >= 0) {
                depth++;
            } else if (CLOSERS.indexOf(c) >= 0 && depth > 0) {
                depth--;
            }
            code.append(c);
            i++;
        }

        if (statementStart >= 0) {
            lines.add(new LogicalLine(statementStart, line, statementIndent, code.toString().strip(),
                    Set.copyOf(inString)));
        }
        return lines;
    }
}
