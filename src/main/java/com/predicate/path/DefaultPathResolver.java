package com.predicate.path;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Default implementation of PathResolver.
 * <p>
 * Each dot-separated segment is a literal key lookup into a map. When a
 * segment is not a key of the current map, longer keys made by joining it
 * with the following segments are tried, shortest first, so keys that
 * contain dots (e.g. {@code metadata.annotations.backstage.io/owner}) are
 * reachable.
 * <p>
 * Lists and arrays met along the path are mapped over: the remaining path is
 * resolved against every element and the present results are returned as a
 * list. If no element yields a value the result is absent.
 * <p>
 * Stateless and thread-safe. Never throws for malformed input.
 */
public class DefaultPathResolver implements PathResolver {

    public static final DefaultPathResolver INSTANCE = new DefaultPathResolver();

    @Override
    public Projection resolve(Object value, String path) {
        if (path == null || path.isEmpty()) {
            return Projection.absent();
        }
        return resolveSegments(value, path.split("\\.", -1), 0);
    }

    private Projection resolveSegments(Object current, String[] segments, int from) {
        if (from == segments.length) {
            return Projection.of(current);
        }
        if (current instanceof Map<?, ?> map) {
            return descend(map, segments, from);
        }
        if (current instanceof List<?> list) {
            return mapOver(list, segments, from);
        }
        if (current != null && current.getClass().isArray()) {
            return mapOver(asList(current), segments, from);
        }
        return Projection.absent();
    }

    private Projection descend(Map<?, ?> map, String[] segments, int from) {
        StringBuilder key = new StringBuilder();
        for (int to = from; to < segments.length; to++) {
            if (to > from) {
                key.append('.');
            }
            key.append(segments[to]);
            String candidate = key.toString();
            if (map.containsKey(candidate)) {
                return resolveSegments(map.get(candidate), segments, to + 1);
            }
        }
        return Projection.absent();
    }

    private Projection mapOver(List<?> elements, String[] segments, int from) {
        List<Object> results = new ArrayList<>(elements.size());
        for (Object element : elements) {
            Projection projected = resolveSegments(element, segments, from);
            if (projected.isPresent()) {
                results.add(projected.get());
            }
        }
        if (results.isEmpty()) {
            return Projection.absent();
        }
        return Projection.of(Collections.unmodifiableList(results));
    }

    private static List<Object> asList(Object array) {
        int length = Array.getLength(array);
        List<Object> list = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            list.add(Array.get(array, i));
        }
        return list;
    }
}
