package com.pathway.rules;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Loose value semantics shared by comparisons and membership tests: numbers compare numerically (numeric strings
 * are coerced when the other side is a number), strings compare case-insensitively, booleans match
 * {@code "true"/"false"} strings, and null only equals null.
 */
public final class Values {

    private Values() {
    }

    public static boolean looselyEquals(Object left, Object right) {
        if (left == null || right == null) return left == null && right == null;
        if (left instanceof Number || right instanceof Number) {
            Double l = toDouble(left);
            Double r = toDouble(right);
            if (l != null && r != null) return l.doubleValue() == r.doubleValue();
            return false;
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            Boolean l = toBoolean(left);
            Boolean r = toBoolean(right);
            return l != null && l.equals(r);
        }
        if (left instanceof CharSequence && right instanceof CharSequence) {
            return left.toString().toLowerCase(Locale.ROOT).equals(right.toString().toLowerCase(Locale.ROOT));
        }
        return left.equals(right);
    }

    /**
     * Orders two values. Returns null when they are not comparable (missing value, text against number);
     * ordering comparisons treat that as false.
     *
     * @throws RuleEvaluationException when a collection or map is ordered
     */
    public static Integer compare(Object left, Object right) {
        if (left instanceof Collection || left instanceof Map || right instanceof Collection || right instanceof Map) {
            throw new RuleEvaluationException("Cannot order collections: " + left + " vs " + right);
        }
        if (left == null || right == null) return null;
        if (left instanceof Number || right instanceof Number) {
            Double l = toDouble(left);
            Double r = toDouble(right);
            return l != null && r != null ? Double.compare(l, r) : null;
        }
        if (left instanceof CharSequence && right instanceof CharSequence) {
            return left.toString().toLowerCase(Locale.ROOT).compareTo(right.toString().toLowerCase(Locale.ROOT));
        }
        if (left instanceof Boolean && right instanceof Boolean) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }
        return null;
    }

    /** Truthiness: null, false, zero, empty text and empty collections are false. */
    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Number) return ((Number) value).doubleValue() != 0.0;
        if (value instanceof CharSequence) return ((CharSequence) value).length() > 0;
        if (value instanceof Collection) return !((Collection<?>) value).isEmpty();
        if (value instanceof Map) return !((Map<?, ?>) value).isEmpty();
        return true;
    }

    /** Numeric view of a value, or null when it has none. */
    public static Double toDouble(Object value) {
        if (value instanceof Number) return ((Number) value).doubleValue();
        if (value instanceof CharSequence) {
            String s = value.toString().trim();
            if (s.isEmpty()) return null;
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof CharSequence) {
            String s = value.toString().trim();
            if ("true".equalsIgnoreCase(s)) return Boolean.TRUE;
            if ("false".equalsIgnoreCase(s)) return Boolean.FALSE;
        }
        return null;
    }

    /** Canonical string of a value for pick-assign comparisons and summaries (integral doubles lose the ".0"). */
    public static String asText(Object value) {
        if (value == null) return "null";
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
        }
        return String.valueOf(value);
    }
}
