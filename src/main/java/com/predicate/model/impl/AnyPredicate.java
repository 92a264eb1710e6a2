package com.predicate.model.impl;

import com.predicate.model.FilterPredicate;
import com.predicate.model.Operators;
import com.predicate.model.PredicateType;

import java.util.List;

/**
 * Logical OR - at least one nested predicate must match.
 *
 * @param predicates Nested predicates, evaluated in order
 */
public record AnyPredicate(List<FilterPredicate> predicates) implements FilterPredicate {

    public AnyPredicate {
        predicates = List.copyOf(predicates);
    }

    @Override
    public PredicateType getType() {
        return PredicateType.ANY;
    }

    @Override
    public String toString() {
        return "{" + Operators.ANY + ":" + predicates + "}";
    }
}
