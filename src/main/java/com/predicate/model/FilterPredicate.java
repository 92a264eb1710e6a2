package com.predicate.model;

import com.predicate.model.impl.AllPredicate;
import com.predicate.model.impl.AnyPredicate;
import com.predicate.model.impl.FieldsPredicate;
import com.predicate.model.impl.LiteralPredicate;
import com.predicate.model.impl.NotPredicate;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A boolean matching expression over a whole JSON-like value.
 * <p>
 * Implementations are immutable and can be shared freely between threads.
 * Trees are usually produced by {@link com.predicate.config.PredicateParser}
 * from configuration, or assembled with the factory methods below.
 */
public interface FilterPredicate {

    /**
     * Get the predicate shape.
     */
    PredicateType getType();

    /**
     * Create a scalar-equality leaf (string, number, boolean, null or array).
     */
    static FilterPredicate literal(Object value) {
        return new LiteralPredicate(value);
    }

    /**
     * Create a conjunction; an empty list matches everything.
     */
    static FilterPredicate all(FilterPredicate... predicates) {
        return new AllPredicate(Arrays.asList(predicates));
    }

    static FilterPredicate all(List<FilterPredicate> predicates) {
        return new AllPredicate(predicates);
    }

    /**
     * Create a disjunction; an empty list matches nothing.
     */
    static FilterPredicate any(FilterPredicate... predicates) {
        return new AnyPredicate(Arrays.asList(predicates));
    }

    static FilterPredicate any(List<FilterPredicate> predicates) {
        return new AnyPredicate(predicates);
    }

    /**
     * Create a negation.
     */
    static FilterPredicate not(FilterPredicate predicate) {
        return new NotPredicate(predicate);
    }

    /**
     * Create a field map. Iteration order of the map is kept.
     */
    static FilterPredicate fields(Map<String, FilterPredicateValue> fields) {
        return new FieldsPredicate(fields);
    }

    /**
     * Create a field map with a single entry.
     */
    static FilterPredicate field(String path, FilterPredicateValue value) {
        Map<String, FilterPredicateValue> fields = new LinkedHashMap<>();
        fields.put(path, value);
        return new FieldsPredicate(fields);
    }

    /**
     * Create a field map with a single equality entry.
     */
    static FilterPredicate field(String path, Object expected) {
        return field(path, FilterPredicateValue.literal(expected));
    }
}
