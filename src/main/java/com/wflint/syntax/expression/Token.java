package com.wflint.syntax.expression;

/**
 * Represents a token in an expression.
 *
 * @param type    Token type
 * @param text    Raw lexeme as written in the source
 * @param literal Decoded value for INT (Long), FLOAT (Double) and STRING (String) tokens
 * @param offset  Char offset of the first character in the lexed input
 */
public record Token(TokenType type, String text, Object literal, int offset) {

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
