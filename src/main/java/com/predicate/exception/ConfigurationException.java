package com.predicate.exception;

/**
 * Exception thrown when predicate configuration cannot be loaded.
 * Raised at the configuration boundary, never during evaluation.
 */
public class ConfigurationException extends PredicateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
