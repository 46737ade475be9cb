package com.formula.function;

import com.formula.core.Values;
import com.formula.exception.FormulaEvaluationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runtime implementations of the built-in functions.
 * Arity has already been checked by the caller.
 */
final class BuiltinFunctions {

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private BuiltinFunctions() {
    }

    static Object abs(List<Object> args) {
        Number value = requireNumber("abs", args.get(0));
        if (Values.isIntegral(value)) {
            return Math.abs(value.longValue());
        }
        return Math.abs(value.doubleValue());
    }

    static Object min(List<Object> args) {
        return extreme("min", args, true);
    }

    static Object max(List<Object> args) {
        return extreme("max", args, false);
    }

    /**
     * Round half to even, to the given number of decimal places (default 0).
     * Zero or negative places yield an integer.
     */
    static Object round(List<Object> args) {
        Number value = requireNumber("round", args.get(0));
        int places = 0;
        if (args.size() > 1) {
            Number digits = requireNumber("round", args.get(1));
            if (!Values.isIntegral(digits)) {
                throw new FormulaEvaluationException(
                        "Function 'round' requires an integer number of digits, got " + digits);
            }
            places = digits.intValue();
        }
        if (Values.isIntegral(value) && places >= 0) {
            return value.longValue();
        }
        if (Double.isNaN(value.doubleValue()) || Double.isInfinite(value.doubleValue())) {
            return value.doubleValue();
        }
        BigDecimal rounded = new BigDecimal(value.toString()).setScale(places, RoundingMode.HALF_EVEN);
        if (places <= 0 && fitsInLong(rounded)) {
            return rounded.longValueExact();
        }
        // Integral results beyond the long range stay decimal
        return rounded.doubleValue();
    }

    static Object sum(List<Object> args) {
        List<Number> numbers = numericArguments("sum", args);
        boolean integral = numbers.stream().allMatch(Values::isIntegral);
        if (integral) {
            long total = 0L;
            for (Number n : numbers) {
                total = Math.addExact(total, n.longValue());
            }
            return total;
        }
        double total = 0.0;
        for (Number n : numbers) {
            total += n.doubleValue();
        }
        return total;
    }

    static Object pow(List<Object> args) {
        Number base = requireNumber("pow", args.get(0));
        Number exponent = requireNumber("pow", args.get(1));
        return Math.pow(base.doubleValue(), exponent.doubleValue());
    }

    static Object concat(List<Object> args) {
        StringBuilder sb = new StringBuilder();
        for (Object arg : args) {
            if (arg != null) {
                sb.append(arg);
            }
        }
        return sb.toString();
    }

    static Object upper(List<Object> args) {
        Object value = args.get(0);
        return value == null ? null : value.toString().toUpperCase(Locale.ROOT);
    }

    static Object lower(List<Object> args) {
        Object value = args.get(0);
        return value == null ? null : value.toString().toLowerCase(Locale.ROOT);
    }

    static Object ifElse(List<Object> args) {
        return Values.isTruthy(args.get(0)) ? args.get(1) : args.get(2);
    }

    static Object coalesce(List<Object> args) {
        for (Object arg : args) {
            if (arg != null) {
                return arg;
            }
        }
        return null;
    }

    static Object isEmpty(List<Object> args) {
        Object value = args.get(0);
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence s) {
            return s.toString().isBlank();
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return m.isEmpty();
        }
        return false;
    }

    private static Object extreme(String function, List<Object> args, boolean lowest) {
        List<Number> numbers = numericArguments(function, args);
        if (numbers.isEmpty()) {
            throw new FormulaEvaluationException("Function '" + function + "' requires at least one value");
        }
        Number best = numbers.get(0);
        for (Number candidate : numbers.subList(1, numbers.size())) {
            int cmp = Double.compare(candidate.doubleValue(), best.doubleValue());
            if (lowest ? cmp < 0 : cmp > 0) {
                best = candidate;
            }
        }
        return Values.normalize(best);
    }

    /**
     * Collect numeric arguments, expanding list arguments (table columns) in place.
     */
    private static List<Number> numericArguments(String function, List<Object> args) {
        List<Number> numbers = new ArrayList<>();
        for (Object arg : args) {
            if (arg instanceof Collection<?> items) {
                for (Object item : items) {
                    numbers.add(requireNumber(function, item));
                }
            } else {
                numbers.add(requireNumber(function, arg));
            }
        }
        return numbers;
    }

    private static boolean fitsInLong(BigDecimal value) {
        return value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0;
    }

    private static Number requireNumber(String function, Object value) {
        if (value instanceof Number n) {
            return n;
        }
        throw new FormulaEvaluationException(
                "Function '" + function + "' requires numeric arguments, got " + Values.typeName(value));
    }
}
