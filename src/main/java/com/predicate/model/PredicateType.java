package com.predicate.model;

/**
 * Shapes a {@link FilterPredicate} can take.
 */
public enum PredicateType {
    // Leaf
    LITERAL,

    // Combinators
    ALL,
    ANY,
    NOT,

    // Per-field matching
    FIELDS
}
