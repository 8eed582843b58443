package com.eainde.flowconverter.validation.grammar;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Superclass of the generated {@code Python3Lexer} that turns line breaks into
 * Python's {@code NEWLINE}, {@code INDENT} and {@code DEDENT} tokens.
 *
 * <p>A line break inside brackets, or one followed by a blank or comment-only
 * line, produces nothing. Otherwise it produces {@code NEWLINE} and then an
 * {@code INDENT} or as many {@code DEDENT}s as the change in indentation needs.
 * At end of input a missing final {@code NEWLINE} and the outstanding
 * {@code DEDENT}s are supplied. An unindent to a width no enclosing block
 * uses is reported to the error listeners.</p>
 */
public abstract class Python3LexerBase extends Lexer {

    private static final int TAB_WIDTH = 8;

    private final Deque<Token> pending = new ArrayDeque<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int opened;
    private int lastEmittedType = Token.INVALID_TYPE;
    private boolean endOfInputHandled;

    protected Python3LexerBase(CharStream input) {
        super(input);
    }

    @Override
    public void emit(Token token) {
        super.setToken(token);
        pending.offer(token);
        if (token.getChannel() == Token.DEFAULT_CHANNEL) {
            lastEmittedType = token.getType();
        }
    }

    @Override
    public Token nextToken() {
        super.nextToken();
        return pending.poll();
    }

    @Override
    public Token emitEOF() {
        if (!endOfInputHandled) {
            endOfInputHandled = true;
            if (lastEmittedType != Token.INVALID_TYPE && lastEmittedType != Python3Lexer.NEWLINE
                    && lastEmittedType != Python3Lexer.DEDENT) {
                emit(layoutToken(Python3Lexer.NEWLINE, "\n"));
            }
            while (!indents.isEmpty()) {
                emit(layoutToken(Python3Lexer.DEDENT, ""));
                indents.pop();
            }
        }
        return super.emitEOF();
    }

    @Override
    public void reset() {
        pending.clear();
        indents.clear();
        opened = 0;
        lastEmittedType = Token.INVALID_TYPE;
        endOfInputHandled = false;
        super.reset();
    }

    boolean atStartOfInput() {
        return getCharIndex() == 0 && getLine() == 1;
    }

    void openBrace() {
        opened++;
    }

    void closeBrace() {
        if (opened > 0) {
            opened--;
        }
    }

    void onNewLine() {
        String text = getText();
        String spaces = text.replaceAll("[\r\n\f]+", "");
        int next = _input.LA(1);

        if (opened > 0 || next == '\r' || next == '\n' || next == '\f' || next == '#') {
            skip();
            return;
        }

        CommonToken newline = layoutToken(Python3Lexer.NEWLINE, text.substring(0, text.length() - spaces.length()));
        newline.setLine(_tokenStartLine);
        newline.setCharPositionInLine(_tokenStartCharPositionInLine);
        emit(newline);

        int indent = indentationWidth(spaces);
        int previous = indents.isEmpty() ? 0 : indents.peek();
        if (indent == previous) {
            skip();
        } else if (indent > previous) {
            indents.push(indent);
            emit(layoutToken(Python3Lexer.INDENT, spaces));
        } else {
            while (!indents.isEmpty() && indents.peek() > indent) {
                emit(layoutToken(Python3Lexer.DEDENT, ""));
                indents.pop();
            }
            int outer = indents.isEmpty() ? 0 : indents.peek();
            if (indent != outer) {
                getErrorListenerDispatch().syntaxError(this, null, getLine(), indent,
                        "unindent does not match any outer indentation level", null);
            }
        }
    }

    private static int indentationWidth(String spaces) {
        int width = 0;
        for (char c : spaces.toCharArray()) {
            width = c == '\t' ? (width / TAB_WIDTH + 1) * TAB_WIDTH : width + 1;
        }
        return width;
    }

    /** A token that covers no input, positioned where the lexer stands. */
    private CommonToken layoutToken(int type, String text) {
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL,
                getCharIndex(), getCharIndex() - 1);
        token.setText(text);
        return token;
    }
}
