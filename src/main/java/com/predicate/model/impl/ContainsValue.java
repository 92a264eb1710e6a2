package com.predicate.model.impl;

import com.predicate.model.FilterPredicate;
import com.predicate.model.FilterPredicateValue;
import com.predicate.model.Operators;
import com.predicate.model.PredicateValueType;

import java.util.Objects;

/**
 * Matches an array field when at least one element satisfies the predicate.
 * Strings are not searched for substrings.
 *
 * @param predicate Predicate applied to each element
 */
public record ContainsValue(FilterPredicate predicate) implements FilterPredicateValue {

    public ContainsValue {
        Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public PredicateValueType getType() {
        return PredicateValueType.CONTAINS;
    }

    @Override
    public String toString() {
        return "{" + Operators.CONTAINS + ":" + predicate + "}";
    }
}
