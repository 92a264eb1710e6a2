package com.predicate.model.impl;

import com.predicate.model.FilterPredicate;
import com.predicate.model.Operators;
import com.predicate.model.PredicateType;

import java.util.List;

/**
 * Logical AND - all nested predicates must match.
 *
 * @param predicates Nested predicates, evaluated in order
 */
public record AllPredicate(List<FilterPredicate> predicates) implements FilterPredicate {

    public AllPredicate {
        predicates = List.copyOf(predicates);
    }

    @Override
    public PredicateType getType() {
        return PredicateType.ALL;
    }

    @Override
    public String toString() {
        return "{" + Operators.ALL + ":" + predicates + "}";
    }
}
