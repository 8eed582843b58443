package com.eainde.flowconverter.edges;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a guard expression into tokens.
 *
 * <p>Recognises Python-style names, single- or double-quoted strings with
 * backslash escapes (an unknown escape keeps its backslash, as in Python), integer and decimal numbers (with a leading minus where a
 * value is expected), the comparison operators and the punctuation
 * {@code ( ) [ ] , .}. Anything else is a {@link GuardSyntaxException}.</p>
 */
final class GuardTokenizer {

    enum TokenType {
        NAME, STRING, NUMBER, OPERATOR, LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA, DOT, END
    }

    record Token(TokenType type, String text, int position) {

        boolean is(TokenType expected) {
            return type == expected;
        }

        boolean isName(String name) {
            return type == TokenType.NAME && text.equals(name);
        }
    }

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    private GuardTokenizer(String source) {
        this.source = source;
    }

    static List<Token> tokenize(String source) {
        GuardTokenizer tokenizer = new GuardTokenizer(source);
        tokenizer.run();
        return tokenizer.tokens;
    }

    private void run() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '"' || c == '\'') {
                readString(c);
            } else if (Character.isDigit(c) || (c == '-' && expectsValue() && nextIsDigit())) {
                readNumber();
            } else if (Character.isLetter(c) || c == '_') {
                readName();
            } else {
                readSymbol(c);
            }
        }
        tokens.add(new Token(TokenType.END, "", pos));
    }

    private void readString(char quote) {
        int start = pos++;
        StringBuilder value = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                tokens.add(new Token(TokenType.STRING, value.toString(), start));
                return;
            }
            if (c == '\\' && pos < source.length()) {
                char escaped = source.charAt(pos++);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 'r' -> value.append('\r');
                    case 't' -> value.append('\t');
                    case '\\', '\'', '"' -> value.append(escaped);
                    default -> value.append('\\').append(escaped);
                }
            } else {
                value.append(c);
            }
        }
        throw new GuardSyntaxException("Unterminated string literal", start);
    }

    private void readNumber() {
        int start = pos;
        if (source.charAt(pos) == '-') {
            pos++;
        }
        consumeDigits();
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            pos++;
            consumeDigits();
        }
        if (pos < source.length() && (Character.isLetter(source.charAt(pos)) || source.charAt(pos) == '_')) {
            throw new GuardSyntaxException("Malformed number", start);
        }
        tokens.add(new Token(TokenType.NUMBER, source.substring(start, pos), start));
    }

    private void consumeDigits() {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
    }

    private void readName() {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        tokens.add(new Token(TokenType.NAME, source.substring(start, pos), start));
    }

    private void readSymbol(char c) {
        int start = pos;
        char next = pos + 1 < source.length() ? source.charAt(pos + 1) : '\0';
        switch (c) {
            case '(' -> single(TokenType.LPAREN, start);
            case ')' -> single(TokenType.RPAREN, start);
            case '[' -> single(TokenType.LBRACKET, start);
            case ']' -> single(TokenType.RBRACKET, start);
            case ',' -> single(TokenType.COMMA, start);
            case '.' -> single(TokenType.DOT, start);
            case '=', '!' -> {
                if (next != '=') {
                    throw new GuardSyntaxException("Unexpected character '" + c + "'", start);
                }
                pos += 2;
                tokens.add(new Token(TokenType.OPERATOR, c + "=", start));
            }
            case '<', '>' -> {
                if (next == '=') {
                    pos += 2;
                    tokens.add(new Token(TokenType.OPERATOR, c + "=", start));
                } else {
                    single(TokenType.OPERATOR, start);
                }
            }
            default -> throw new GuardSyntaxException("Unexpected character '" + c + "'", start);
        }
    }

    private void single(TokenType type, int start) {
        tokens.add(new Token(type, String.valueOf(source.charAt(pos)), start));
        pos++;
    }

    private boolean nextIsDigit() {
        return pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1));
    }

    /** A minus sign starts a number only where an operand may begin. */
    private boolean expectsValue() {
        if (tokens.isEmpty()) {
            return true;
        }
        Token last = tokens.get(tokens.size() - 1);
        return switch (last.type()) {
            case OPERATOR, LPAREN, LBRACKET, COMMA -> true;
            case NAME -> GuardParser.isKeyword(last.text());
            default -> false;
        };
    }
}
