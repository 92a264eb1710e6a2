package com.predicate.equality;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Canonical string forms used when a number is compared with another value.
 * <p>
 * Numbers are printed the way JSON producers print them: integral values
 * without a fractional part ({@code 1.0} prints as {@code 1}), the shortest
 * decimal digits otherwise, and exponent notation from 1e21 upwards and below
 * 1e-6 ({@code 1e+21}, {@code 1e-7}). Floats are widened to double first,
 * so {@code 0.1f} prints its double digits {@code 0.10000000149011612}.
 */
public final class CanonicalStrings {

    private static final int MAX_PLAIN_EXPONENT = 21;
    private static final int MIN_PLAIN_EXPONENT = -6;
    private static final int MAX_DOUBLE_DIGITS = 17;

    private CanonicalStrings() {
    }

    /**
     * Get the canonical string of a value.
     *
     * @param value Any JSON-like value
     * @return Canonical string, or null if the value has none (maps, opaque objects)
     */
    public static String of(Object value) {
        if (value instanceof Number number) {
            return ofNumber(number);
        }
        if (value instanceof CharSequence || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof List<?> list) {
            return join(list);
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return join(elements);
        }
        return null;
    }

    /**
     * Get the canonical string of a number.
     */
    public static String ofNumber(Number number) {
        if (number instanceof Integer || number instanceof Long
                || number instanceof Short || number instanceof Byte
                || number instanceof BigInteger
                || number instanceof AtomicInteger || number instanceof AtomicLong) {
            return number.toString();
        }
        if (number instanceof BigDecimal decimal) {
            return format(decimal);
        }
        // Floats are widened: 0.1f prints as 0.10000000149011612
        return ofDouble(number.doubleValue());
    }

    private static String ofDouble(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == 0.0) {
            return "0";
        }
        return format(shortest(d));
    }

    /**
     * Fewest significant digits that read back as the same double, nearest
     * to the exact binary value.
     */
    private static BigDecimal shortest(double d) {
        BigDecimal exact = new BigDecimal(d);
        for (int precision = 1; precision < MAX_DOUBLE_DIGITS; precision++) {
            BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == d) {
                return candidate;
            }
        }
        return exact.round(new MathContext(MAX_DOUBLE_DIGITS, RoundingMode.HALF_EVEN));
    }

    private static String format(BigDecimal decimal) {
        if (decimal.signum() == 0) {
            return "0";
        }
        BigDecimal stripped = decimal.stripTrailingZeros();
        String sign = stripped.signum() < 0 ? "-" : "";
        String digits = stripped.unscaledValue().abs().toString();
        int k = digits.length();
        int n = k - stripped.scale();

        StringBuilder out = new StringBuilder(sign);
        if (k <= n && n <= MAX_PLAIN_EXPONENT) {
            out.append(digits);
            out.append("0".repeat(n - k));
        } else if (0 < n && n <= MAX_PLAIN_EXPONENT) {
            out.append(digits, 0, n).append('.').append(digits, n, k);
        } else if (MIN_PLAIN_EXPONENT < n && n <= 0) {
            out.append("0.").append("0".repeat(-n)).append(digits);
        } else {
            int exponent = n - 1;
            out.append(digits.charAt(0));
            if (k > 1) {
                out.append('.').append(digits, 1, k);
            }
            out.append('e').append(exponent < 0 ? '-' : '+').append(Math.abs(exponent));
        }
        return out.toString();
    }

    private static String join(List<?> elements) {
        List<String> parts = new ArrayList<>(elements.size());
        for (Object element : elements) {
            if (element == null) {
                parts.add("");
                continue;
            }
            if (element instanceof Map<?, ?>) {
                return null;
            }
            String part = of(element);
            if (part == null) {
                return null;
            }
            parts.add(part);
        }
        return String.join(",", parts);
    }
}
