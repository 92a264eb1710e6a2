package com.predicate.equality;

import java.lang.reflect.Array;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Default implementation of ValueComparator.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>null on either side never matches, not even null itself</li>
 *   <li>the same value matches</li>
 *   <li>two strings match ignoring case, upper-cased under {@link Locale#US}</li>
 *   <li>if either side is a number, both canonical strings must match
 *       ({@code 1} matches {@code "1"}, but not {@code "1.0"})</li>
 *   <li>two arrays match when equal in length and equal index by index</li>
 *   <li>anything else, including two objects, does not match</li>
 * </ol>
 * Stateless and thread-safe.
 */
public class DefaultValueComparator implements ValueComparator {

    public static final DefaultValueComparator INSTANCE = new DefaultValueComparator();

    @Override
    public boolean equal(Object a, Object b) {
        if (a == null || b == null) {
            return false;
        }
        if (a == b || sameScalar(a, b)) {
            return true;
        }
        if (a instanceof CharSequence && b instanceof CharSequence) {
            return a.toString().toUpperCase(Locale.US).equals(b.toString().toUpperCase(Locale.US));
        }
        if (a instanceof Number || b instanceof Number) {
            String left = CanonicalStrings.of(a);
            return left != null && left.equals(CanonicalStrings.of(b));
        }
        if (isArray(a) && isArray(b)) {
            return arraysEqual(a, b);
        }
        return false;
    }

    private boolean arraysEqual(Object a, Object b) {
        int length = lengthOf(a);
        if (length != lengthOf(b)) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (!equal(elementAt(a, i), elementAt(b, i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean sameScalar(Object a, Object b) {
        return a.getClass() == b.getClass()
                && !(a instanceof Map<?, ?>)
                && !isArray(a)
                && a.equals(b);
    }

    private static boolean isArray(Object value) {
        return value instanceof List<?> || value.getClass().isArray();
    }

    private static int lengthOf(Object array) {
        return array instanceof List<?> list ? list.size() : Array.getLength(array);
    }

    private static Object elementAt(Object array, int index) {
        return array instanceof List<?> list ? list.get(index) : Array.get(array, index);
    }
}
