package com.predicate.exception;

/**
 * Exception thrown when a raw predicate does not have a valid shape.
 * The path identifies the offending node, e.g. {@code $.$all[1].owner.$in}.
 */
public class InvalidPredicateException extends ConfigurationException {

    private final String path;

    public InvalidPredicateException(String path, String message) {
        super("Invalid predicate at " + path + ": " + message);
        this.path = path;
    }

    public InvalidPredicateException(String message, InvalidPredicateException cause) {
        super(message + ": " + cause.getMessage(), cause);
        this.path = cause.getPath();
    }

    /**
     * Location of the invalid node within the raw predicate.
     */
    public String getPath() {
        return path;
    }
}
