package com.predicate.path;

/**
 * Projects a JSON-like value down to the sub-value at a dotted field path.
 */
public interface PathResolver {

    /**
     * Resolve a field path.
     *
     * @param value Value to project (maps, lists, arrays, scalars or null)
     * @param path  Dotted field path (e.g., "metadata.name")
     * @return Projected value, or absent if nothing lives at the path
     */
    Projection resolve(Object value, String path);
}
