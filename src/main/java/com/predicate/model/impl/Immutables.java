package com.predicate.model.impl;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep, null-tolerant copies of JSON-like values held by predicate nodes.
 */
final class Immutables {

    private Immutables() {
    }

    static Object freeze(Object value) {
        if (value instanceof List<?> list) {
            return freezeList(list);
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> copy = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                copy.add(freeze(Array.get(value, i)));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        return value;
    }

    static List<Object> freezeList(List<?> list) {
        List<Object> copy = new ArrayList<>(list.size());
        for (Object element : list) {
            copy.add(freeze(element));
        }
        return Collections.unmodifiableList(copy);
    }

    static String render(Object value) {
        if (value instanceof CharSequence) {
            return "\"" + value + "\"";
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>(list.size());
            for (Object element : list) {
                parts.add(render(element));
            }
            return "[" + String.join(",", parts) + "]";
        }
        return String.valueOf(value);
    }
}
