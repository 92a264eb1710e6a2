package com.predicate.path;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Result of projecting a value down a field path.
 * <p>
 * Unlike {@link java.util.Optional}, a projection can hold {@code null}:
 * a field explicitly set to null is present, a missing field is absent.
 */
public final class Projection {

    private static final Projection ABSENT = new Projection(null, false);
    private static final Projection NULL = new Projection(null, true);

    private final Object value;
    private final boolean present;

    private Projection(Object value, boolean present) {
        this.value = value;
        this.present = present;
    }

    /**
     * The "no value here" result.
     */
    public static Projection absent() {
        return ABSENT;
    }

    /**
     * A present value, possibly null.
     */
    public static Projection of(Object value) {
        return value == null ? NULL : new Projection(value, true);
    }

    public boolean isPresent() {
        return present;
    }

    public boolean isAbsent() {
        return !present;
    }

    /**
     * Get the projected value.
     *
     * @throws NoSuchElementException if absent
     */
    public Object get() {
        if (!present) {
            throw new NoSuchElementException("No value present");
        }
        return value;
    }

    /**
     * Get the projected value, or the fallback if absent.
     */
    public Object orElse(Object fallback) {
        return present ? value : fallback;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Projection other)) return false;
        return present == other.present && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return present ? Objects.hashCode(value) : -1;
    }

    @Override
    public String toString() {
        return present ? "Projection[" + value + "]" : "Projection.absent";
    }
}
