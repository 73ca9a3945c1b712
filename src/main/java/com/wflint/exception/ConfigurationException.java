package com.wflint.exception;

/**
 * Exception thrown when the context availability data is invalid.
 * Results in fail-fast when the table is loaded.
 */
public class ConfigurationException extends WorkflowLintException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
