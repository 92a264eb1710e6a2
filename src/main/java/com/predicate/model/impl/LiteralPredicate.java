package com.predicate.model.impl;

import com.predicate.model.FilterPredicate;
import com.predicate.model.PredicateType;

/**
 * Matches the whole value by equality with a scalar or array.
 *
 * @param value Expected value, may be null (which never matches)
 */
public record LiteralPredicate(Object value) implements FilterPredicate {

    public LiteralPredicate {
        value = Immutables.freeze(value);
    }

    @Override
    public PredicateType getType() {
        return PredicateType.LITERAL;
    }

    @Override
    public String toString() {
        return Immutables.render(value);
    }
}
