package com.predicate.model;

import java.util.List;

/**
 * Operator keys of the predicate language.
 */
public final class Operators {

    public static final String ALL = "$all";
    public static final String ANY = "$any";
    public static final String NOT = "$not";

    public static final String CONTAINS = "$contains";
    public static final String IN = "$in";
    public static final String EXISTS = "$exists";

    /**
     * Combinators in the order they take precedence when several are present.
     */
    public static final List<String> COMBINATORS = List.of(ALL, ANY, NOT);

    /**
     * Value operators in the order they take precedence when several are present.
     */
    public static final List<String> VALUE_OPERATORS = List.of(CONTAINS, IN, EXISTS);

    private Operators() {
    }

    /**
     * Whether a map key is in operator position rather than a field path.
     */
    public static boolean isOperator(String key) {
        return key != null && key.startsWith("$");
    }
}
