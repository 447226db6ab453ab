package com.benefits.operator;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value coercion shared by the operators.
 * <p>
 * Follows JSON-logic conventions: {@code null}, {@code false}, {@code 0}, {@code ""} and
 * empty lists are falsy; loose equality and ordering compare numerically unless both
 * sides are strings.
 */
public final class Values {

    private Values() {
    }

    public static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        return true;
    }

    /**
     * Numeric value, NaN when the value has none.
     */
    public static double toNumber(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) {
                return 0;
            }
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    public static boolean isNumeric(Object value) {
        return !Double.isNaN(toNumber(value));
    }

    /**
     * Loose ({@code ==}) equality.
     */
    public static boolean looseEquals(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof String sa && b instanceof String sb) {
            return sa.equals(sb);
        }
        if (isScalar(a) && isScalar(b)) {
            double x = toNumber(a);
            double y = toNumber(b);
            return x == y;
        }
        return Objects.equals(a, b);
    }

    /**
     * Strict ({@code ===}) equality: same type family and same value.
     */
    public static boolean strictEquals(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number na && b instanceof Number nb) {
            return na.doubleValue() == nb.doubleValue();
        }
        if (a.getClass() != b.getClass()
                && !(a instanceof List && b instanceof List)
                && !(a instanceof Map && b instanceof Map)) {
            return false;
        }
        return a.equals(b);
    }

    /**
     * Ordering test. Two strings compare lexicographically, anything else numerically.
     * Returns false when either side has no numeric value.
     */
    public static boolean compare(Object a, Object b, Ordering ordering) {
        int cmp;
        if (a instanceof String sa && b instanceof String sb
                && !(isNumericString(sa) && isNumericString(sb))) {
            cmp = sa.compareTo(sb);
        } else {
            double x = toNumber(a);
            double y = toNumber(b);
            if (Double.isNaN(x) || Double.isNaN(y)) {
                return false;
            }
            cmp = Double.compare(x, y);
        }
        return switch (ordering) {
            case LESS -> cmp < 0;
            case LESS_OR_EQUAL -> cmp <= 0;
            case GREATER -> cmp > 0;
            case GREATER_OR_EQUAL -> cmp >= 0;
        };
    }

    /**
     * Narrow a computed double back to a Long when it is integral.
     */
    public static Number normalize(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 9.0e15) {
            return (long) value;
        }
        return value;
    }

    /**
     * String form used by {@code cat} and {@code in}.
     */
    public static String toText(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d)) {
                return Long.toString((long) d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Collection<?> c) {
            StringBuilder sb = new StringBuilder();
            for (Object item : c) {
                if (sb.length() > 0) {
                    sb.append(',');
                }
                sb.append(item == null ? "" : toText(item));
            }
            return sb.toString();
        }
        return String.valueOf(value);
    }

    public static List<?> asList(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        return List.of();
    }

    private static boolean isScalar(Object value) {
        return value instanceof Number || value instanceof Boolean || value instanceof String;
    }

    private static boolean isNumericString(String s) {
        return !s.isBlank() && isNumeric(s);
    }

    public enum Ordering {
        LESS,
        LESS_OR_EQUAL,
        GREATER,
        GREATER_OR_EQUAL
    }
}
