package com.eainde.flowconverter.edges;

import com.eainde.flowconverter.edges.GuardTokenizer.Token;
import com.eainde.flowconverter.edges.GuardTokenizer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for edge guard expressions.
 *
 * <h3>Grammar:</h3>
 * <pre>
 * expression := and ( "or" and )*
 * and        := not ( "and" not )*
 * not        := "not" not | "(" expression ")" | comparison
 * comparison := operand ( op operand )?
 * op         := "==" | "!=" | "&lt;" | "&gt;" | "&lt;=" | "&gt;=" | "in" | "not" "in"
 * operand    := atom ( "." NAME "(" args ")" )*
 * atom       := STRING | NUMBER | True | False | None | "[" args "]"
 *             | state "[" STRING "]" | state ".get(" STRING ( "," operand )? ")"
 *             | NAME "(" args ")" | NAME
 * </pre>
 *
 * <p>{@code not} binds tighter than {@code and}, which binds tighter than {@code or}.
 * Chained comparisons, attribute access without a call, arithmetic and
 * {@code is} are not part of the language and raise {@link GuardSyntaxException},
 * as does nesting deeper than {@value #MAX_NESTING} levels.</p>
 */
public final class GuardParser {

    private static final Set<String> KEYWORDS = Set.of("and", "or", "not", "in", "True", "False", "None");
    private static final String STATE = "state";
    /** Deepest allowed nesting of parentheses, brackets and {@code not}. */
    static final int MAX_NESTING = 100;

    private final List<Token> tokens;
    private int index;
    private int depth;

    private GuardParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses {@code text} into a predicate tree.
     *
     * @throws GuardSyntaxException if the text is blank or not a supported expression
     */
    public static GuardExpression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new GuardSyntaxException("Empty guard expression", 0);
        }
        GuardParser parser = new GuardParser(GuardTokenizer.tokenize(text));
        GuardExpression expression = parser.parseOr();
        Token trailing = parser.peek();
        if (!trailing.is(TokenType.END)) {
            throw new GuardSyntaxException("Unexpected '" + trailing.text() + "'", trailing.position());
        }
        return expression;
    }

    /** Parses {@code text}, or returns empty when it is not a supported expression. */
    public static Optional<GuardExpression> tryParse(String text) {
        try {
            return Optional.of(parse(text));
        } catch (GuardSyntaxException e) {
            return Optional.empty();
        }
    }

    static boolean isKeyword(String name) {
        return KEYWORDS.contains(name);
    }

    // =========================================================================
    //  Boolean structure
    // =========================================================================

    private GuardExpression parseOr() {
        List<GuardExpression> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (peek().isName("or")) {
            advance();
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new GuardExpression.Or(operands);
    }

    private GuardExpression parseAnd() {
        List<GuardExpression> operands = new ArrayList<>();
        operands.add(parseNot());
        while (peek().isName("and")) {
            advance();
            operands.add(parseNot());
        }
        return operands.size() == 1 ? operands.get(0) : new GuardExpression.And(operands);
    }

    private GuardExpression parseNot() {
        if (peek().isName("not")) {
            descend();
            advance();
            GuardExpression operand = parseNot();
            depth--;
            return new GuardExpression.Not(operand);
        }
        if (peek().is(TokenType.LPAREN)) {
            descend();
            advance();
            GuardExpression inner = parseOr();
            expect(TokenType.RPAREN);
            depth--;
            return new GuardExpression.Group(inner);
        }
        return parseComparison();
    }

    private GuardExpression parseComparison() {
        Operand left = parseOperand();
        Optional<ComparisonOperator> operator = readOperator();
        if (operator.isEmpty()) {
            return new GuardExpression.Truthy(left);
        }
        Operand right = parseOperand();
        if (peek().is(TokenType.OPERATOR) || peek().isName("in")) {
            throw new GuardSyntaxException("Chained comparisons are not supported", peek().position());
        }
        return new GuardExpression.Comparison(left, operator.get(), right);
    }

    private Optional<ComparisonOperator> readOperator() {
        Token token = peek();
        if (token.is(TokenType.OPERATOR)) {
            advance();
            return ComparisonOperator.fromSymbol(token.text());
        }
        if (token.isName("in")) {
            advance();
            return Optional.of(ComparisonOperator.IN);
        }
        if (token.isName("not") && peekAhead(1).isName("in")) {
            advance();
            advance();
            return Optional.of(ComparisonOperator.NOT_IN);
        }
        return Optional.empty();
    }

    // =========================================================================
    //  Operands
    // =========================================================================

    private Operand parseOperand() {
        Operand operand = parseAtom();
        while (peek().is(TokenType.DOT)) {
            advance();
            Token method = expect(TokenType.NAME);
            if (!peek().is(TokenType.LPAREN)) {
                throw new GuardSyntaxException("Attribute access is not supported", method.position());
            }
            operand = new Operand.MethodCall(operand, method.text(), parseArguments(TokenType.LPAREN, TokenType.RPAREN));
        }
        return operand;
    }

    private Operand parseAtom() {
        Token token = peek();
        switch (token.type()) {
            case STRING -> {
                advance();
                return Operand.Literal.string(token.text());
            }
            case NUMBER -> {
                advance();
                return Operand.Literal.number(token.text());
            }
            case LBRACKET -> {
                return new Operand.ListLiteral(parseArguments(TokenType.LBRACKET, TokenType.RBRACKET));
            }
            case NAME -> {
                return parseNameAtom(token);
            }
            default -> throw new GuardSyntaxException("Expected a value but found '" + token.text() + "'",
                    token.position());
        }
    }

    private Operand parseNameAtom(Token token) {
        String name = token.text();
        switch (name) {
            case "True", "False" -> {
                advance();
                return new Operand.Literal(Operand.LiteralKind.BOOLEAN, name);
            }
            case "None" -> {
                advance();
                return new Operand.Literal(Operand.LiteralKind.NONE, name);
            }
            case "and", "or", "not", "in" ->
                    throw new GuardSyntaxException("Unexpected keyword '" + name + "'", token.position());
            default -> {
                // fall through to the name forms below
            }
        }
        advance();

        if (STATE.equals(name) && peek().is(TokenType.LBRACKET)) {
            advance();
            Token key = expect(TokenType.STRING);
            expect(TokenType.RBRACKET);
            return new Operand.FieldRef(key.text());
        }
        if (STATE.equals(name) && peek().is(TokenType.DOT) && peekAhead(1).isName("get")
                && peekAhead(2).is(TokenType.LPAREN)) {
            advance();
            advance();
            List<Operand> arguments = parseArguments(TokenType.LPAREN, TokenType.RPAREN);
            if (arguments.isEmpty() || arguments.size() > 2
                    || !(arguments.get(0) instanceof Operand.Literal key)
                    || key.kind() != Operand.LiteralKind.STRING) {
                throw new GuardSyntaxException("state.get() needs a string key", token.position());
            }
            return new Operand.FieldRef(key.value());
        }
        if (peek().is(TokenType.LPAREN)) {
            return new Operand.FunctionCall(name, parseArguments(TokenType.LPAREN, TokenType.RPAREN));
        }
        return new Operand.FieldRef(name);
    }

    /** Comma-separated operands between {@code open} and {@code close}; a trailing comma is allowed. */
    private List<Operand> parseArguments(TokenType open, TokenType close) {
        descend();
        expect(open);
        List<Operand> arguments = new ArrayList<>();
        while (!peek().is(close)) {
            arguments.add(parseOperand());
            if (peek().is(TokenType.COMMA)) {
                advance();
            } else if (!peek().is(close)) {
                throw new GuardSyntaxException("Expected ',' or closing bracket", peek().position());
            }
        }
        advance();
        depth--;
        return arguments;
    }

    // =========================================================================
    //  Token cursor
    // =========================================================================

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private void advance() {
        if (index < tokens.size() - 1) {
            index++;
        }
    }

    private void descend() {
        if (++depth > MAX_NESTING) {
            throw new GuardSyntaxException("Guard expression nested deeper than " + MAX_NESTING + " levels",
                    peek().position());
        }
    }

    private Token expect(TokenType type) {
        Token token = peek();
        if (!token.is(type)) {
            throw new GuardSyntaxException("Expected " + type + " but found '" + token.text() + "'",
                    token.position());
        }
        advance();
        return token;
    }
}
