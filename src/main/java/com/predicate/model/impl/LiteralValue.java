package com.predicate.model.impl;

import com.predicate.model.FilterPredicateValue;
import com.predicate.model.PredicateValueType;

/**
 * Matches a projected field by equality with a scalar or array.
 *
 * @param value Expected value, may be null (which never matches)
 */
public record LiteralValue(Object value) implements FilterPredicateValue {

    public LiteralValue {
        value = Immutables.freeze(value);
    }

    @Override
    public PredicateValueType getType() {
        return PredicateValueType.LITERAL;
    }

    @Override
    public String toString() {
        return Immutables.render(value);
    }
}
