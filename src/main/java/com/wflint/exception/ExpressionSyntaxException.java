package com.wflint.exception;

/**
 * Base exception for malformed {@code ${{ }}} expressions.
 * Carries the offset (char index into the lexed input) of the offending
 * character or token.
 */
public abstract class ExpressionSyntaxException extends WorkflowLintException {

    private final int offset;
    private final String reason;

    protected ExpressionSyntaxException(String input, int offset, String reason) {
        super("Invalid expression at position " + offset + ": " + reason + " in '" + input + "'");
        this.offset = offset;
        this.reason = reason;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * The message without position and input, e.g. for diagnostics that render
     * their own location.
     */
    public String getReason() {
        return reason;
    }
}
