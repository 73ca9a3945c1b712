package com.wflint.exception;

/**
 * Thrown when a token stream does not form exactly one expression.
 */
public class ExpressionParseException extends ExpressionSyntaxException {

    public ExpressionParseException(String input, int offset, String reason) {
        super(input, offset, reason);
    }
}
