package com.predicate.config;

/**
 * How {@link PredicateParser} treats input that does not have a valid shape.
 */
public enum ParseMode {
    /**
     * Reject invalid shapes with an {@link com.predicate.exception.InvalidPredicateException}.
     * Used at configuration boundaries.
     */
    STRICT,

    /**
     * Accept any JSON-like input. Unknown operators and malformed operands are
     * kept in the tree so that evaluation fails closed on them.
     */
    LENIENT
}
