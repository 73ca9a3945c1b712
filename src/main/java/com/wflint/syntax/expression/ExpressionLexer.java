package com.wflint.syntax.expression;

import com.wflint.exception.ExpressionLexException;

import java.util.ArrayList;
import java.util.List;

import static com.wflint.syntax.expression.ExpressionConfig.*;

/**
 * Lexer for {@code ${{ }}} expressions.
 * Converts the interior of an expression into a sequence of tokens.
 * <p>
 * Lexing stops at end of input or in front of the first {@code }}} outside a
 * string literal, whichever comes first. The returned list always ends with
 * one {@link TokenType#EOF} token; its text is {@code "}}"} when the closing
 * marker was reached and empty otherwise.
 * <p>
 * An instance lexes exactly one input and is not thread-safe.
 */
public final class ExpressionLexer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionLexer(String input) {
        this(input, 0);
    }

    /**
     * Lex {@code input} starting at {@code start}. Token offsets stay relative to
     * the whole input, which lets callers lex an expression embedded in a larger string.
     */
    public ExpressionLexer(String input, int start) {
        if (start < 0 || start > input.length()) {
            throw new IndexOutOfBoundsException("start " + start + " out of bounds for length " + input.length());
        }
        this.input = input;
        this.length = input.length();
        this.pos = start;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens terminated by an EOF token
     * @throws ExpressionLexException on an unterminated string, a malformed number
     *                                or an unrecognized character
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.RIGHT_BRACE -> {
                    if (lookahead(1) == Operators.RIGHT_BRACE) {
                        tokens.add(new Token(TokenType.EOF, EXPRESSION_END, null, start));
                        return tokens;
                    }
                    throw error("Unexpected character '}'", start);
                }
                case Operators.LEFT_PAREN -> tokens.add(single(TokenType.LPAREN));
                case Operators.RIGHT_PAREN -> tokens.add(single(TokenType.RPAREN));
                case Operators.LEFT_BRACKET -> tokens.add(single(TokenType.LBRACKET));
                case Operators.RIGHT_BRACKET -> tokens.add(single(TokenType.RBRACKET));
                case Operators.DOT -> tokens.add(single(TokenType.DOT));
                case Operators.STAR -> tokens.add(single(TokenType.STAR));
                case Operators.COMMA -> tokens.add(single(TokenType.COMMA));
                case Operators.EQUALS -> {
                    advance();
                    if (!match(Operators.EQUALS)) {
                        throw error("Unexpected character '=', did you mean '=='?", start);
                    }
                    tokens.add(new Token(TokenType.EQ, "==", null, start));
                }
                case Operators.BANG -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.NE, "!=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.NOT, "!", null, start));
                    }
                }
                case Operators.GREATER -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.GTE, ">=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.GT, ">", null, start));
                    }
                }
                case Operators.LESS -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.LTE, "<=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.LT, "<", null, start));
                    }
                }
                case Operators.AMPERSAND -> {
                    advance();
                    if (!match(Operators.AMPERSAND)) {
                        throw error("Unexpected character '&', did you mean '&&'?", start);
                    }
                    tokens.add(new Token(TokenType.AND, "&&", null, start));
                }
                case Operators.PIPE -> {
                    advance();
                    if (!match(Operators.PIPE)) {
                        throw error("Unexpected character '|', did you mean '||'?", start);
                    }
                    tokens.add(new Token(TokenType.OR, "||", null, start));
                }
                case Operators.QUOTE -> tokens.add(readString());
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifier());
                    } else if (isNumberStart(c)) {
                        tokens.add(readNumber());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token single(TokenType type) {
        int start = pos;
        char c = advance();
        return new Token(type, String.valueOf(c), null, start);
    }

    private Token readIdentifier() {
        int start = pos;

        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        return new Token(TokenType.IDENT, input.substring(start, pos), null, start);
    }

    private Token readNumber() {
        int start = pos;
        boolean negative = match(Operators.MINUS);

        if (isAtEnd() || !isDigit(peek())) {
            throw error("Expected digit after '-' in number", start);
        }

        if (peek() == '0' && (lookahead(1) == 'x' || lookahead(1) == 'X')) {
            return readHexNumber(start, negative);
        }

        skipDigits();
        boolean isFloat = false;

        if (match(Operators.DOT)) {
            if (isAtEnd() || !isDigit(peek())) {
                throw error("Expected digit after '.' in number", start);
            }
            skipDigits();
            isFloat = true;
        }

        if (match('e') || match('E')) {
            if (!match(Operators.PLUS)) {
                match(Operators.MINUS);
            }
            if (isAtEnd() || !isDigit(peek())) {
                throw error("Expected digit in exponent part of number", start);
            }
            skipDigits();
            isFloat = true;
        }

        checkNumberEnd(start);
        String text = input.substring(start, pos);

        if (isFloat) {
            double value = Double.parseDouble(text);
            if (Double.isInfinite(value)) {
                throw error("Float literal out of range '" + text + "'", start);
            }
            return new Token(TokenType.FLOAT, text, value, start);
        }

        try {
            return new Token(TokenType.INT, text, Long.parseLong(text), start);
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range '" + text + "'", start);
        }
    }

    private Token readHexNumber(int start, boolean negative) {
        pos += 2; // 0x
        int digitsStart = pos;

        while (!isAtEnd() && isHexDigit(peek())) {
            advance();
        }

        if (pos == digitsStart) {
            throw error("Expected hexadecimal digit after '0x' in number", start);
        }

        checkNumberEnd(start);
        String text = input.substring(start, pos);
        String digits = input.substring(digitsStart, pos);

        try {
            long value = Long.parseLong(negative ? "-" + digits : digits, 16);
            return new Token(TokenType.INT, text, value, start);
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range '" + text + "'", start);
        }
    }

    private void checkNumberEnd(int start) {
        if (!isAtEnd() && (isIdentifierPart(peek()) || peek() == Operators.DOT)) {
            throw error("Unexpected character '" + peek() + "' in number", start);
        }
    }

    private Token readString() {
        int start = pos;
        advance(); // opening quote
        StringBuilder sb = new StringBuilder();

        while (true) {
            if (isAtEnd()) {
                throw error("Unterminated string literal", start);
            }
            char c = advance();
            if (c == Operators.QUOTE) {
                // '' is an escaped quote, a single quote ends the literal
                if (!match(Operators.QUOTE)) {
                    break;
                }
            }
            sb.append(c);
        }

        return new Token(TokenType.STRING, input.substring(start, pos), sb.toString(), start);
    }

    private void skipDigits() {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == Operators.UNDERSCORE;
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == Operators.MINUS;
    }

    private static boolean isNumberStart(char c) {
        return isDigit(c) || c == Operators.MINUS;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char lookahead(int distance) {
        int index = pos + distance;
        return index < length ? input.charAt(index) : '\0';
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private ExpressionLexException error(String message, int position) {
        return new ExpressionLexException(input, position, message);
    }
}
