package com.predicate.evaluation;

import com.predicate.model.FilterPredicate;
import com.predicate.model.FilterPredicateValue;
import com.predicate.path.Projection;

import java.util.function.Predicate;

/**
 * Evaluates predicate trees against JSON-like values.
 * <p>
 * Evaluation is pure and total: it never mutates its inputs, never throws for
 * JSON-like input, and resolves unrecognized shapes to {@code false}.
 * Implementations hold no mutable state and may be shared between threads.
 * <p>
 * Evaluation cost grows with the size of the predicate and of the arrays
 * reached through {@code $contains}. Callers evaluating externally supplied
 * predicates should bound their nesting depth, see
 * {@link com.predicate.config.PredicateParser}.
 */
public interface PredicateEvaluator {

    /**
     * Evaluate a predicate against a whole value.
     *
     * @param predicate Predicate tree
     * @param value     Value to test (maps, lists, arrays, scalars or null)
     * @return true if the value matches
     */
    boolean evaluate(FilterPredicate predicate, Object value);

    /**
     * Evaluate a value predicate against the projection of one field.
     *
     * @param filter    Value predicate
     * @param projected Value found at the field path, possibly absent
     * @return true if the projection matches
     */
    boolean evaluateValue(FilterPredicateValue filter, Projection projected);

    /**
     * Wrap a predicate into a reusable filter function.
     * The function captures the immutable predicate and can be shared.
     *
     * @param predicate Predicate tree
     * @param <T>       Type of the filtered values
     * @return Function equivalent to {@code value -> evaluate(predicate, value)}
     */
    default <T> Predicate<T> toFilterFunction(FilterPredicate predicate) {
        return value -> evaluate(predicate, value);
    }
}
