package com.predicate.model.impl;

import com.predicate.model.FilterPredicate;
import com.predicate.model.FilterPredicateValue;
import com.predicate.model.PredicateType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunction of per-field matches. Keys are dotted field paths.
 * <p>
 * Keys in operator position (starting with {@code $}) are kept as given:
 * a field map holding one never matches.
 *
 * @param fields Field path to value predicate, in evaluation order
 */
public record FieldsPredicate(Map<String, FilterPredicateValue> fields) implements FilterPredicate {

    public FieldsPredicate {
        Map<String, FilterPredicateValue> copy = new LinkedHashMap<>();
        for (Map.Entry<String, FilterPredicateValue> entry : fields.entrySet()) {
            copy.put(Objects.requireNonNull(entry.getKey(), "field path"),
                    Objects.requireNonNull(entry.getValue(), "field predicate"));
        }
        fields = Collections.unmodifiableMap(copy);
    }

    @Override
    public PredicateType getType() {
        return PredicateType.FIELDS;
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>(fields.size());
        fields.forEach((path, value) -> parts.add("\"" + path + "\":" + value));
        return "{" + String.join(",", parts) + "}";
    }
}
