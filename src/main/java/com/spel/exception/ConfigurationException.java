package com.spel.exception;

/**
 * Exception thrown when parser configuration is invalid or cannot be loaded.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends ExpressionException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
