package com.predicate.model;

import com.predicate.model.impl.ContainsValue;
import com.predicate.model.impl.ExistsValue;
import com.predicate.model.impl.InValue;
import com.predicate.model.impl.LiteralValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A boolean matching expression over the value projected at one field path.
 */
public interface FilterPredicateValue {

    /**
     * Get the value predicate shape.
     */
    PredicateValueType getType();

    /**
     * Create a scalar-equality leaf.
     */
    static FilterPredicateValue literal(Object value) {
        return new LiteralValue(value);
    }

    /**
     * Match arrays with at least one element satisfying the predicate.
     */
    static FilterPredicateValue contains(FilterPredicate predicate) {
        return new ContainsValue(predicate);
    }

    /**
     * Match values equal to at least one candidate.
     */
    static FilterPredicateValue in(Object... candidates) {
        return new InValue(new ArrayList<Object>(Arrays.asList(candidates)));
    }

    static FilterPredicateValue in(List<?> candidates) {
        return new InValue(new ArrayList<Object>(candidates));
    }

    /**
     * Match on presence ({@code true}) or absence ({@code false}) of the field.
     */
    static FilterPredicateValue exists(boolean exists) {
        return new ExistsValue(exists);
    }
}
