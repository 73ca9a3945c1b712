package com.wflint.syntax.expression;

import com.wflint.exception.ExpressionParseException;
import com.wflint.syntax.ast.ExprNode;
import com.wflint.syntax.ast.ExprNode.ArrayDerefNode;
import com.wflint.syntax.ast.ExprNode.CompareOpNode;
import com.wflint.syntax.ast.ExprNode.FloatNode;
import com.wflint.syntax.ast.ExprNode.FuncCallNode;
import com.wflint.syntax.ast.ExprNode.IndexAccessNode;
import com.wflint.syntax.ast.ExprNode.IntNode;
import com.wflint.syntax.ast.ExprNode.LogicalOpKind;
import com.wflint.syntax.ast.ExprNode.LogicalOpNode;
import com.wflint.syntax.ast.ExprNode.NotOpNode;
import com.wflint.syntax.ast.ExprNode.ObjectDerefNode;
import com.wflint.syntax.ast.ExprNode.StringNode;
import com.wflint.syntax.ast.ExprNode.VariableNode;

import java.util.ArrayList;
import java.util.List;

import static com.wflint.syntax.expression.ExpressionConfig.*;

/**
 * Parser for {@code ${{ }}} expressions.
 * Converts tokens into an {@link ExprNode} tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: postfix > ! > comparison > && > ||):
 * <pre>
 * expression := or
 * or         := and ('||' and)*
 * and        := compare ('&amp;&amp;' compare)*
 * compare    := not (('==' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=') not)*
 * not        := '!'* postfix
 * postfix    := primary ('.' IDENT | '.' '*' | '[' expression ']')*
 * primary    := literal | IDENT '(' arguments? ')' | IDENT | '(' expression ')'
 * arguments  := expression (',' expression)*
 * </pre>
 * Operator runs and postfix chains are folded in loops. Only parentheses,
 * brackets and call arguments recurse, so nesting depth is bounded by the
 * thread's stack size and nothing else.
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    /**
     * @param input  Source text, used in error messages
     * @param tokens Tokens from {@link ExpressionLexer}, terminated by an EOF token
     */
    public ExpressionParser(String input, List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token sequence must end with " + TokenType.EOF);
        }
        this.input = input;
        this.tokens = List.copyOf(tokens);
        this.index = 0;
    }

    /**
     * Parse the token stream into an expression tree.
     *
     * @return Root node
     * @throws ExpressionParseException if the tokens do not form exactly one expression
     */
    public ExprNode parse() {
        if (isAtEnd()) {
            throw error("Empty expression");
        }
        ExprNode result = parseExpression();
        if (!isAtEnd()) {
            throw error("Unexpected " + describe(peek()) + " after end of expression");
        }
        return result;
    }

    private ExprNode parseExpression() {
        return parseOr();
    }

    private ExprNode parseOr() {
        ExprNode left = parseAnd();

        while (match(TokenType.OR)) {
            left = new LogicalOpNode(LogicalOpKind.OR, left, parseAnd());
        }

        return left;
    }

    private ExprNode parseAnd() {
        ExprNode left = parseCompare();

        while (match(TokenType.AND)) {
            left = new LogicalOpNode(LogicalOpKind.AND, left, parseCompare());
        }

        return left;
    }

    private ExprNode parseCompare() {
        ExprNode left = parseNot();

        while (COMPARE_OPERATORS.containsKey(peek().type())) {
            ExprNode.CompareOpKind kind = COMPARE_OPERATORS.get(advance().type());
            left = new CompareOpNode(kind, left, parseNot());
        }

        return left;
    }

    private ExprNode parseNot() {
        int count = 0;
        while (match(TokenType.NOT)) {
            count++;
        }

        ExprNode operand = parsePostfix();
        for (int i = 0; i < count; i++) {
            operand = new NotOpNode(operand);
        }
        return operand;
    }

    private ExprNode parsePostfix() {
        ExprNode receiver = parsePrimary();

        while (true) {
            if (match(TokenType.DOT)) {
                if (match(TokenType.STAR)) {
                    receiver = new ArrayDerefNode(receiver);
                } else if (match(TokenType.IDENT)) {
                    receiver = new ObjectDerefNode(receiver, previous().text());
                } else {
                    throw error("Expected property name or '*' after '.' but got " + describe(peek()));
                }
            } else if (check(TokenType.LBRACKET)) {
                Token open = advance();
                ExprNode index = parseExpression();
                expectClosing(TokenType.RBRACKET, open);
                receiver = new IndexAccessNode(receiver, index);
            } else {
                return receiver;
            }
        }
    }

    private ExprNode parsePrimary() {
        // Parenthesized expression
        if (check(TokenType.LPAREN)) {
            Token open = advance();
            ExprNode expr = parseExpression();
            expectClosing(TokenType.RPAREN, open);
            return expr;
        }

        if (match(TokenType.INT)) {
            return new IntNode((Long) previous().literal());
        }
        if (match(TokenType.FLOAT)) {
            return new FloatNode((Double) previous().literal());
        }
        if (match(TokenType.STRING)) {
            return new StringNode((String) previous().literal());
        }

        if (match(TokenType.IDENT)) {
            Token ident = previous();
            if (check(TokenType.LPAREN)) {
                return parseCall(ident);
            }
            ExprNode keyword = KEYWORDS.get(ident.text());
            return keyword != null ? keyword : new VariableNode(ident.text());
        }

        throw error("Unexpected " + describe(peek()) + ", expecting literal, identifier or '('");
    }

    private ExprNode parseCall(Token name) {
        Token open = advance();
        List<ExprNode> args = new ArrayList<>();

        if (match(TokenType.RPAREN)) {
            return new FuncCallNode(name.text(), args);
        }

        args.add(parseExpression());
        while (match(TokenType.COMMA)) {
            args.add(parseExpression());
        }

        if (isAtEnd()) {
            throw error("Unmatched '(' of call to " + name.text() + "() at position " + open.offset());
        }
        if (!match(TokenType.RPAREN)) {
            throw error("Expected ',' or ')' in arguments of " + name.text() + "() but got " + describe(peek()));
        }
        return new FuncCallNode(name.text(), args);
    }

    private void expectClosing(TokenType closing, Token open) {
        if (match(closing)) {
            return;
        }
        if (isAtEnd()) {
            throw error("Unmatched '" + open.text() + "' at position " + open.offset());
        }
        throw error("Expected " + closing.description() + " but got " + describe(peek()));
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private static String describe(Token token) {
        return switch (token.type()) {
            case EOF -> TokenType.EOF.description();
            case IDENT, STRING, INT, FLOAT -> token.type().description() + " " + token.text();
            default -> token.type().description();
        };
    }

    private ExpressionParseException error(String message) {
        return new ExpressionParseException(input, peek().offset(), message);
    }
}
