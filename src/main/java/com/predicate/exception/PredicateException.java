package com.predicate.exception;

/**
 * Base exception for the predicates library.
 */
public class PredicateException extends RuntimeException {

    public PredicateException(String message) {
        super(message);
    }

    public PredicateException(String message, Throwable cause) {
        super(message, cause);
    }
}
