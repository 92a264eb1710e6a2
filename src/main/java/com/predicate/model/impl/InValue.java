package com.predicate.model.impl;

import com.predicate.model.FilterPredicateValue;
import com.predicate.model.Operators;
import com.predicate.model.PredicateValueType;

import java.util.List;

/**
 * Matches a field equal to at least one of the candidates.
 *
 * @param candidates Allowed values, null members are kept but never match
 */
public record InValue(List<Object> candidates) implements FilterPredicateValue {

    public InValue {
        candidates = Immutables.freezeList(candidates);
    }

    @Override
    public PredicateValueType getType() {
        return PredicateValueType.IN;
    }

    @Override
    public String toString() {
        return "{" + Operators.IN + ":" + Immutables.render(candidates) + "}";
    }
}
