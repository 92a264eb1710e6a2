package com.predicate.model;

/**
 * Shapes a {@link FilterPredicateValue} can take.
 */
public enum PredicateValueType {
    // Leaf
    LITERAL,

    // Value operators
    CONTAINS,
    IN,
    EXISTS,

    // Any other object shape, never matches
    UNRECOGNIZED
}
