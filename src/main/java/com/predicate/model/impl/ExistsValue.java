package com.predicate.model.impl;

import com.predicate.model.FilterPredicateValue;
import com.predicate.model.Operators;
import com.predicate.model.PredicateValueType;

/**
 * Matches on presence of a field, not on its truthiness.
 * A field explicitly set to null exists.
 *
 * @param exists true to require presence, false to require absence
 */
public record ExistsValue(boolean exists) implements FilterPredicateValue {

    @Override
    public PredicateValueType getType() {
        return PredicateValueType.EXISTS;
    }

    @Override
    public String toString() {
        return "{" + Operators.EXISTS + ":" + exists + "}";
    }
}
