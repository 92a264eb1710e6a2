package com.predicate.equality;

/**
 * Decides whether two JSON-like values are equal under the predicate
 * language's coercion rules. Used for literal leaves and {@code $in}.
 */
public interface ValueComparator {

    /**
     * Compare two values.
     *
     * @param a Actual value
     * @param b Expected value
     * @return true if the values are considered equal
     */
    boolean equal(Object a, Object b);
}
