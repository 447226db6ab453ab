package com.benefits.operator;

import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;

/**
 * Comparison-class operators whose operands can be explained as "value versus threshold".
 */
public enum ComparisonOperator {
    EQUALS("=="),
    STRICT_EQUALS("==="),
    NOT_EQUALS("!="),
    STRICT_NOT_EQUALS("!=="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUALS(">="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUALS("<="),
    IN("in"),
    BETWEEN("between");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol))
                .findFirst();
    }

    /**
     * Test {@code value <op> threshold}. For {@link #BETWEEN} the threshold is a two-element
     * collection holding the inclusive bounds.
     */
    public boolean test(Object value, Object threshold) {
        return switch (this) {
            case EQUALS -> Values.looseEquals(value, threshold);
            case STRICT_EQUALS -> Values.strictEquals(value, threshold);
            case NOT_EQUALS -> !Values.looseEquals(value, threshold);
            case STRICT_NOT_EQUALS -> !Values.strictEquals(value, threshold);
            case GREATER_THAN -> Values.compare(value, threshold, Values.Ordering.GREATER);
            case GREATER_THAN_OR_EQUALS -> Values.compare(value, threshold, Values.Ordering.GREATER_OR_EQUAL);
            case LESS_THAN -> Values.compare(value, threshold, Values.Ordering.LESS);
            case LESS_THAN_OR_EQUALS -> Values.compare(value, threshold, Values.Ordering.LESS_OR_EQUAL);
            case IN -> contains(threshold, value);
            case BETWEEN -> inRange(value, threshold);
        };
    }

    static boolean contains(Object container, Object item) {
        if (container instanceof String s) {
            return item != null && s.contains(Values.toText(item));
        }
        if (container instanceof Collection<?> c) {
            for (Object element : c) {
                if (Values.strictEquals(element, item)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean inRange(Object value, Object bounds) {
        if (value == null || !(bounds instanceof java.util.List<?> range) || range.size() != 2) {
            return false;
        }
        return Values.compare(value, range.get(0), Values.Ordering.GREATER_OR_EQUAL)
                && Values.compare(value, range.get(1), Values.Ordering.LESS_OR_EQUAL);
    }
}
