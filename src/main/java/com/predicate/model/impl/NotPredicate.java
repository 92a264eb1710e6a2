package com.predicate.model.impl;

import com.predicate.model.FilterPredicate;
import com.predicate.model.Operators;
import com.predicate.model.PredicateType;

import java.util.Objects;

/**
 * Logical NOT - negates the nested predicate.
 *
 * @param predicate Predicate to negate
 */
public record NotPredicate(FilterPredicate predicate) implements FilterPredicate {

    public NotPredicate {
        Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public PredicateType getType() {
        return PredicateType.NOT;
    }

    @Override
    public String toString() {
        return "{" + Operators.NOT + ":" + predicate + "}";
    }
}
