package com.predicate.config;

import com.predicate.exception.InvalidPredicateException;
import com.predicate.model.FilterPredicate;
import com.predicate.model.FilterPredicateValue;
import com.predicate.model.Operators;
import com.predicate.model.impl.AllPredicate;
import com.predicate.model.impl.AnyPredicate;
import com.predicate.model.impl.ContainsValue;
import com.predicate.model.impl.ExistsValue;
import com.predicate.model.impl.FieldsPredicate;
import com.predicate.model.impl.InValue;
import com.predicate.model.impl.LiteralPredicate;
import com.predicate.model.impl.LiteralValue;
import com.predicate.model.impl.NotPredicate;
import com.predicate.model.impl.UnrecognizedValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds predicate trees from JSON-like values (maps, lists and scalars as
 * produced by Jackson or SnakeYAML).
 * <p>
 * In {@link ParseMode#STRICT} mode the input must match the predicate grammar:
 * <pre>
 * Predicate      := scalar | [scalar, ...]
 *                 | { $all: [Predicate, ...] } | { $any: [Predicate, ...] }
 *                 | { $not: Predicate }
 *                 | { field.path: PredicateValue, ... }
 * PredicateValue := scalar | [scalar, ...]
 *                 | { $contains: Predicate } | { $in: [scalar, ...] }
 *                 | { $exists: boolean }
 * </pre>
 * where combinator lists are non-empty, every operator object has exactly one
 * key, and nesting stays within the configured depth.
 * <p>
 * In {@link ParseMode#LENIENT} mode the combinator with the highest priority
 * ({@code $all}, {@code $any}, {@code $not}) wins when several are present,
 * and anything malformed is kept in a shape that evaluates to false.
 * <p>
 * Instances are immutable and thread-safe.
 */
public class PredicateParser {

    public static final int DEFAULT_MAX_DEPTH = 64;

    private static final String ROOT = "$";

    private final int maxDepth;

    public PredicateParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth Maximum nesting depth accepted in strict mode
     */
    public PredicateParser(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Parse and validate a raw predicate.
     *
     * @param raw JSON-like predicate
     * @return Predicate tree
     * @throws InvalidPredicateException if the shape is invalid
     */
    public FilterPredicate parse(Object raw) {
        return parse(raw, ParseMode.STRICT);
    }

    /**
     * Parse a raw predicate.
     *
     * @param raw  JSON-like predicate
     * @param mode Validation mode
     * @return Predicate tree
     * @throws InvalidPredicateException if the shape is invalid and mode is STRICT
     */
    public FilterPredicate parse(Object raw, ParseMode mode) {
        return new Walk(mode == ParseMode.STRICT).predicate(raw, ROOT, 1);
    }

    /**
     * One parse run. Strictness is fixed per run.
     */
    private class Walk {

        private final boolean strict;

        Walk(boolean strict) {
            this.strict = strict;
        }

        FilterPredicate predicate(Object raw, String path, int depth) {
            checkDepth(path, depth);

            if (!(raw instanceof Map<?, ?> rawMap)) {
                return new LiteralPredicate(literal(raw, path, depth));
            }

            Map<String, Object> map = stringKeyed(rawMap);
            for (String operator : Operators.COMBINATORS) {
                if (!map.containsKey(operator)) {
                    continue;
                }
                if (Operators.NOT.equals(operator)) {
                    onlyKey(map, operator, path);
                    return new NotPredicate(predicate(map.get(operator), path + "." + operator, depth + 1));
                }
                return combinator(map, operator, path, depth);
            }
            return fields(map, path, depth);
        }

        private FilterPredicate combinator(Map<String, Object> map, String operator, String path, int depth) {
            onlyKey(map, operator, path);
            String operatorPath = path + "." + operator;
            Object operand = map.get(operator);

            if (!(operand instanceof List<?> list)) {
                if (strict) {
                    throw new InvalidPredicateException(operatorPath, "expected a list of predicates");
                }
                return failClosed(operator, operand);
            }
            if (strict && list.isEmpty()) {
                throw new InvalidPredicateException(operatorPath, "expected at least one predicate");
            }

            List<FilterPredicate> predicates = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                predicates.add(predicate(list.get(i), operatorPath + "[" + i + "]", depth + 1));
            }
            return Operators.ALL.equals(operator) ? new AllPredicate(predicates) : new AnyPredicate(predicates);
        }

        private FilterPredicate fields(Map<String, Object> map, String path, int depth) {
            Map<String, FilterPredicateValue> fields = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : map.entrySet()) {
                String key = entry.getKey();
                String fieldPath = path + "." + key;
                if (strict && Operators.isOperator(key)) {
                    throw new InvalidPredicateException(fieldPath, "unknown operator '" + key + "'");
                }
                if (strict && key.isEmpty()) {
                    throw new InvalidPredicateException(fieldPath, "field path must not be empty");
                }
                fields.put(key, value(entry.getValue(), fieldPath, depth + 1));
            }
            return new FieldsPredicate(fields);
        }

        FilterPredicateValue value(Object raw, String path, int depth) {
            checkDepth(path, depth);

            if (!(raw instanceof Map<?, ?> rawMap)) {
                return new LiteralValue(literal(raw, path, depth));
            }

            Map<String, Object> map = stringKeyed(rawMap);
            if (map.containsKey(Operators.CONTAINS)) {
                onlyKey(map, Operators.CONTAINS, path);
                return new ContainsValue(predicate(map.get(Operators.CONTAINS),
                        path + "." + Operators.CONTAINS, depth + 1));
            }
            if (map.containsKey(Operators.IN)) {
                onlyKey(map, Operators.IN, path);
                return in(map, path);
            }
            if (map.containsKey(Operators.EXISTS)) {
                onlyKey(map, Operators.EXISTS, path);
                Object flag = map.get(Operators.EXISTS);
                if (flag instanceof Boolean exists) {
                    return new ExistsValue(exists);
                }
                if (strict) {
                    throw new InvalidPredicateException(path + "." + Operators.EXISTS, "expected a boolean");
                }
                return new UnrecognizedValue(map);
            }

            if (strict) {
                String detail = map.isEmpty()
                        ? "expected one of " + Operators.VALUE_OPERATORS
                        : "unknown operator or nested object " + map.keySet() + ", expected one of "
                          + Operators.VALUE_OPERATORS;
                throw new InvalidPredicateException(path, detail);
            }
            return new UnrecognizedValue(map);
        }

        private FilterPredicateValue in(Map<String, Object> map, String path) {
            String operatorPath = path + "." + Operators.IN;
            Object operand = map.get(Operators.IN);
            if (!(operand instanceof List<?> candidates)) {
                if (strict) {
                    throw new InvalidPredicateException(operatorPath, "expected a list of values");
                }
                return new UnrecognizedValue(map);
            }
            if (strict) {
                for (int i = 0; i < candidates.size(); i++) {
                    requireScalar(candidates.get(i), operatorPath + "[" + i + "]");
                }
            }
            return new InValue(new ArrayList<Object>(candidates));
        }

        private Object literal(Object raw, String path, int depth) {
            if (!strict) {
                return raw;
            }
            if (raw instanceof List<?> list) {
                checkDepth(path, depth + 1);
                for (int i = 0; i < list.size(); i++) {
                    requireScalar(list.get(i), path + "[" + i + "]");
                }
                return raw;
            }
            requireScalar(raw, path);
            return raw;
        }

        private void requireScalar(Object raw, String path) {
            if (raw == null || raw instanceof String || raw instanceof Number || raw instanceof Boolean) {
                return;
            }
            throw new InvalidPredicateException(path,
                    "expected a string, number, boolean or null but got " + describe(raw));
        }

        private void onlyKey(Map<String, Object> map, String operator, String path) {
            if (strict && map.size() != 1) {
                List<String> others = new ArrayList<>(map.keySet());
                others.remove(operator);
                throw new InvalidPredicateException(path,
                        "'" + operator + "' must be the only key, found also " + others);
            }
        }

        private void checkDepth(String path, int depth) {
            if (strict && depth > maxDepth) {
                throw new InvalidPredicateException(path, "nesting exceeds maximum depth of " + maxDepth);
            }
        }

        private FilterPredicate failClosed(String operator, Object operand) {
            Map<String, FilterPredicateValue> fields = new LinkedHashMap<>();
            fields.put(operator, new LiteralValue(operand instanceof Map<?, ?> ? null : operand));
            return new FieldsPredicate(fields);
        }
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> raw) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            map.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return map;
    }

    private static String describe(Object raw) {
        if (raw instanceof Map<?, ?>) {
            return "an object";
        }
        if (raw instanceof List<?>) {
            return "a list";
        }
        return raw.getClass().getSimpleName();
    }
}
