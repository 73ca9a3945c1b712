package com.wflint.exception;

/**
 * Thrown when expression text cannot be split into tokens:
 * unterminated string literal, malformed number, unrecognized character.
 */
public class ExpressionLexException extends ExpressionSyntaxException {

    public ExpressionLexException(String input, int offset, String reason) {
        super(input, offset, reason);
    }
}
