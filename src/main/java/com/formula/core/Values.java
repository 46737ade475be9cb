package com.formula.core;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Conversions shared by the executor and the built-in functions.
 */
public final class Values {

    private Values() {
    }

    /**
     * Truthiness coercion: null, false, zero, empty text and empty collections are false.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    /**
     * Whether the value is a number for formula purposes. Booleans are not numbers.
     */
    public static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    /**
     * Whether the number is integral ({@link Long}, {@link Integer}, {@link Short}, {@link Byte}).
     */
    public static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte;
    }

    public static Optional<Double> asDouble(Object value) {
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        return Optional.empty();
    }

    /**
     * Normalize integral numbers to {@link Long} and other numbers to {@link Double}.
     */
    public static Number normalize(Number value) {
        if (isIntegral(value)) {
            return value.longValue();
        }
        return value.doubleValue();
    }

    /**
     * Name of the value's formula type, used in user-facing error messages.
     */
    public static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Boolean) {
            return "BOOLEAN";
        }
        if (value instanceof Number) {
            return "NUMBER";
        }
        if (value instanceof CharSequence) {
            return "TEXT";
        }
        return value.getClass().getSimpleName();
    }

    /**
     * Equality used by {@code ==}: numbers compare by value across representations.
     */
    public static boolean areEqual(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return Double.compare(l.doubleValue(), r.doubleValue()) == 0;
        }
        if (left == null || right == null) {
            return left == right;
        }
        return left.equals(right);
    }
}
