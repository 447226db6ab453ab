package com.benefits.evaluation;

import com.benefits.operator.ComparisonOperator;
import com.benefits.operator.Values;

import java.text.NumberFormat;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Plain-language text for criterion results and overall explanations.
 */
public final class CriterionFormatter {

    private static final Pattern MONETARY = Pattern.compile(
            "(?i).*(income|asset|amount|rent|cost|expense|saving|resource|wage|earning|payment|salary|benefit).*");

    private CriterionFormatter() {
    }

    public static String describe(ComparisonOperator operator, String criterion, Object value,
                                  Object threshold, boolean met) {
        boolean money = isMonetary(criterion);
        String v = format(value, money);
        String t = format(threshold, money);
        return switch (operator) {
            case LESS_THAN_OR_EQUALS -> met
                    ? v + " is within the limit of " + t
                    : v + " exceeds the limit of " + t;
            case LESS_THAN -> met
                    ? v + " is below the threshold of " + t
                    : v + " is not below the threshold of " + t;
            case GREATER_THAN_OR_EQUALS -> met
                    ? v + " meets the minimum of " + t
                    : v + " is below the minimum of " + t;
            case GREATER_THAN -> met
                    ? v + " exceeds the minimum of " + t
                    : v + " does not exceed the minimum of " + t;
            case EQUALS, STRICT_EQUALS -> met
                    ? v + " matches the required value of " + t
                    : v + " does not match the required value of " + t;
            case NOT_EQUALS, STRICT_NOT_EQUALS -> met
                    ? v + " is different from " + t + " (as required)"
                    : v + " incorrectly matches " + t;
            case IN -> met
                    ? v + " is one of the accepted values (" + t + ")"
                    : v + " is not one of the accepted values (" + t + ")";
            case BETWEEN -> {
                List<?> range = threshold instanceof List<?> l && l.size() == 2 ? l : List.of("?", "?");
                String range0 = format(range.get(0), money);
                String range1 = format(range.get(1), money);
                yield met
                        ? v + " is within the range of " + range0 + " to " + range1
                        : v + " is outside the range of " + range0 + " to " + range1;
            }
        };
    }

    public static String explain(List<CriterionResult> criteria, boolean overall) {
        if (criteria.isEmpty()) {
            return overall ? "Eligibility confirmed" : "Eligibility requirements not met";
        }
        if (overall) {
            return "All eligibility requirements have been met";
        }
        List<String> reasons = criteria.stream()
                .filter(c -> !c.met())
                .map(c -> c.message() != null ? c.message() : c.criterion() + " requirement not met")
                .toList();
        if (reasons.isEmpty()) {
            return "Eligibility requirements not met due to program rules";
        }
        return "Eligibility requirements not met: " + String.join(", ", reasons);
    }

    static boolean isMonetary(String criterion) {
        return criterion != null && MONETARY.matcher(criterion).matches();
    }

    static String format(Object value, boolean money) {
        if (value instanceof Number n) {
            NumberFormat format = money
                    ? NumberFormat.getCurrencyInstance(Locale.US)
                    : NumberFormat.getNumberInstance(Locale.US);
            format.setMaximumFractionDigits(money ? 0 : 2);
            format.setMinimumFractionDigits(0);
            return format.format(n.doubleValue());
        }
        if (value instanceof Collection<?> c) {
            return String.join(", ", c.stream().map(item -> format(item, money)).toList());
        }
        return Values.toText(value);
    }
}
