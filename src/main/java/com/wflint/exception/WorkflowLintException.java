package com.wflint.exception;

/**
 * Base exception for the workflow expression front end.
 */
public class WorkflowLintException extends RuntimeException {

    public WorkflowLintException(String message) {
        super(message);
    }

    public WorkflowLintException(String message, Throwable cause) {
        super(message, cause);
    }
}
