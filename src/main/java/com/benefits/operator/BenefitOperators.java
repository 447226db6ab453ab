package com.benefits.operator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Benefit-domain operators. Not part of the base set; added with {@link #register} and
 * removed with {@link #unregister}.
 */
public final class BenefitOperators {

    private static final Logger log = LoggerFactory.getLogger(BenefitOperators.class);

    public static final List<String> NAMES = List.of(
            "between", "within_percent", "age_from_dob", "date_in_past", "date_in_future",
            "matches_any", "count_true", "all_true", "any_true");

    private BenefitOperators() {
    }

    /**
     * Register the benefit operators. Date operators read the current date from {@code clock}.
     */
    public static void register(OperatorRegistry registry, Clock clock) {
        registry.register("between", (EagerOperator) args -> between(
                StandardOperators.arg(args, 0), StandardOperators.arg(args, 1), StandardOperators.arg(args, 2)));
        registry.register("within_percent", (EagerOperator) args -> withinPercent(
                StandardOperators.arg(args, 0), StandardOperators.arg(args, 1), StandardOperators.arg(args, 2)));
        registry.register("age_from_dob", (EagerOperator) args ->
                parseDate(StandardOperators.arg(args, 0))
                        .map(dob -> (Object) (long) Period.between(dob, LocalDate.now(clock)).getYears())
                        .orElse(null));
        registry.register("date_in_past", (EagerOperator) args ->
                parseDate(StandardOperators.arg(args, 0))
                        .map(date -> date.isBefore(LocalDate.now(clock)))
                        .orElse(false));
        registry.register("date_in_future", (EagerOperator) args ->
                parseDate(StandardOperators.arg(args, 0))
                        .map(date -> date.isAfter(LocalDate.now(clock)))
                        .orElse(false));
        registry.register("matches_any", (EagerOperator) args ->
                matchesAny(StandardOperators.arg(args, 0), StandardOperators.arg(args, 1)));
        registry.register("count_true", (EagerOperator) args ->
                (long) items(args).stream().filter(Values::truthy).count());
        registry.register("all_true", (EagerOperator) args -> {
            Collection<?> items = items(args);
            return !items.isEmpty() && items.stream().allMatch(Values::truthy);
        });
        registry.register("any_true", (EagerOperator) args -> items(args).stream().anyMatch(Values::truthy));
        log.debug("Registered {} benefit operators", NAMES.size());
    }

    public static void unregister(OperatorRegistry registry) {
        NAMES.forEach(registry::unregister);
    }

    static boolean between(Object value, Object low, Object high) {
        if (value == null) {
            return false;
        }
        return Values.compare(value, low, Values.Ordering.GREATER_OR_EQUAL)
                && Values.compare(value, high, Values.Ordering.LESS_OR_EQUAL);
    }

    static boolean withinPercent(Object value, Object target, Object percent) {
        double v = Values.toNumber(value);
        double t = Values.toNumber(target);
        double p = Values.toNumber(percent);
        if (value == null || Double.isNaN(v) || Double.isNaN(t) || Double.isNaN(p)) {
            return false;
        }
        return Math.abs(v - t) <= Math.abs(t * (p / 100));
    }

    static boolean matchesAny(Object value, Object candidates) {
        if (value == null || !(candidates instanceof Collection<?> options)) {
            return false;
        }
        String needle = Values.toText(value);
        for (Object option : options) {
            if (option != null && Values.toText(option).equalsIgnoreCase(needle)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A single list argument is the list itself, otherwise the arguments are the items.
     */
    private static Collection<?> items(List<Object> args) {
        if (args.size() == 1 && args.get(0) instanceof Collection<?> c) {
            return c;
        }
        return args;
    }

    /**
     * Parse an ISO date or date-time string.
     */
    public static Optional<LocalDate> parseDate(Object value) {
        if (!(value instanceof String text) || text.isBlank()) {
            return Optional.empty();
        }
        try {
            if (text.length() <= 10) {
                return Optional.of(LocalDate.parse(text));
            }
            if (text.endsWith("Z")) {
                return Optional.of(LocalDate.ofInstant(Instant.parse(text), ZoneOffset.UTC));
            }
            return Optional.of(OffsetDateTime.parse(text).toLocalDate());
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(LocalDate.parse(text.substring(0, 10)));
            } catch (DateTimeParseException | IndexOutOfBoundsException e2) {
                log.warn("Unparseable date value: {}", text);
                return Optional.empty();
            }
        }
    }
}
