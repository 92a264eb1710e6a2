package com.predicate;

import com.predicate.config.PredicateParser;
import com.predicate.evaluation.DefaultPredicateEvaluator;
import com.predicate.evaluation.PredicateEvaluator;
import com.predicate.json.JsonValues;
import com.predicate.model.FilterPredicate;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Static entry points over a shared default evaluator.
 * <p>
 * Usage:
 * <pre>
 * FilterPredicate predicate = Predicates.parse("""
 *     { "$all": [ { "kind": "Component" }, { "metadata.tags": { "$contains": "java" } } ] }
 *     """);
 * List&lt;Object&gt; matching = Predicates.filter(entities, predicate);
 * </pre>
 */
public final class Predicates {

    private static final PredicateEvaluator evaluator = new DefaultPredicateEvaluator();
    private static final PredicateParser parser = new PredicateParser();

    private Predicates() {
    }

    /**
     * Evaluate a predicate against a value.
     */
    public static boolean evaluate(FilterPredicate predicate, Object value) {
        return evaluator.evaluate(predicate, value);
    }

    /**
     * Convert a predicate to a filter function.
     */
    public static <T> java.util.function.Predicate<T> toFilterFunction(FilterPredicate predicate) {
        return evaluator.toFilterFunction(predicate);
    }

    /**
     * Keep the values matching the predicate, in iteration order.
     */
    public static <T> List<T> filter(Collection<T> values, FilterPredicate predicate) {
        return values.stream()
                .filter(toFilterFunction(predicate))
                .collect(Collectors.toList());
    }

    /**
     * Parse and validate a predicate received as JSON text.
     *
     * @throws IllegalArgumentException if the text is not valid JSON
     * @throws com.predicate.exception.InvalidPredicateException if the predicate is malformed
     */
    public static FilterPredicate parse(String json) {
        return parser.parse(JsonValues.parse(json));
    }
}
