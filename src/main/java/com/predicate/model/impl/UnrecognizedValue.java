package com.predicate.model.impl;

import com.predicate.model.FilterPredicateValue;
import com.predicate.model.PredicateValueType;

import java.util.Map;

/**
 * An object shape in value position that is not a known operator.
 * Kept verbatim for diagnostics; never matches.
 *
 * @param raw The unrecognized object
 */
public record UnrecognizedValue(Map<String, Object> raw) implements FilterPredicateValue {

    @SuppressWarnings("unchecked")
    public UnrecognizedValue {
        raw = (Map<String, Object>) Immutables.freeze(raw);
    }

    @Override
    public PredicateValueType getType() {
        return PredicateValueType.UNRECOGNIZED;
    }

    @Override
    public String toString() {
        return String.valueOf(raw);
    }
}
