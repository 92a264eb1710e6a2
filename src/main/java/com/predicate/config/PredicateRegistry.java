package com.predicate.config;

import com.predicate.evaluation.PredicateEvaluator;
import com.predicate.exception.ConfigurationException;
import com.predicate.model.FilterPredicate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Named predicates loaded once from configuration and shared by callers,
 * e.g. a catalog filter and an event subscription filter.
 */
public class PredicateRegistry {

    private final Map<String, FilterPredicate> predicates;
    private final PredicateEvaluator evaluator;

    public PredicateRegistry(Map<String, FilterPredicate> predicates, PredicateEvaluator evaluator) {
        this.predicates = Collections.unmodifiableMap(new LinkedHashMap<>(predicates));
        this.evaluator = evaluator;
    }

    public Set<String> names() {
        return predicates.keySet();
    }

    public Optional<FilterPredicate> find(String name) {
        return Optional.ofNullable(predicates.get(name));
    }

    /**
     * Get a predicate by name.
     *
     * @throws ConfigurationException if no predicate has that name
     */
    public FilterPredicate get(String name) {
        return find(name).orElseThrow(() -> new ConfigurationException(
                "Unknown predicate '" + name + "', configured: " + predicates.keySet()));
    }

    /**
     * Get the filter function of a named predicate.
     */
    public <T> Predicate<T> filter(String name) {
        return evaluator.toFilterFunction(get(name));
    }

    /**
     * Evaluate a named predicate against a value.
     */
    public boolean matches(String name, Object value) {
        return evaluator.evaluate(get(name), value);
    }
}
