package com.benefits.eligibility;

import com.benefits.operator.BenefitOperators;
import com.benefits.operator.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a profile into the data context rules are evaluated against.
 * <ul>
 *   <li>{@code age} is derived from {@code dateOfBirth} whenever that parses, replacing a
 *       stored age; otherwise a given {@code age} is kept</li>
 *   <li>{@code householdIncome} is converted from annual to monthly
 *       ({@code Math.round(annual / 12)}) unless {@code incomePeriod} is {@code "monthly"};
 *       the annual figure is kept as {@code annualHouseholdIncome}</li>
 * </ul>
 * The income conversion is a fixed policy, not configurable per rule.
 */
public class DataContextPreparer {

    private static final Logger log = LoggerFactory.getLogger(DataContextPreparer.class);

    public static final String HOUSEHOLD_INCOME = "householdIncome";
    public static final String ANNUAL_HOUSEHOLD_INCOME = "annualHouseholdIncome";
    public static final String INCOME_PERIOD = "incomePeriod";
    public static final String DATE_OF_BIRTH = "dateOfBirth";
    public static final String AGE = "age";

    private final Clock clock;

    public DataContextPreparer(Clock clock) {
        this.clock = clock;
    }

    public Map<String, Object> prepare(UserProfile profile) {
        Map<String, Object> data = new LinkedHashMap<>(profile.fields());
        addAge(data);
        convertIncome(data);
        return data;
    }

    private void addAge(Map<String, Object> data) {
        BenefitOperators.parseDate(data.get(DATE_OF_BIRTH)).ifPresent(dob -> {
            int age = Period.between(dob, LocalDate.now(clock)).getYears();
            Object stored = data.put(AGE, age);
            if (stored != null && !Values.looseEquals(stored, age)) {
                log.debug("Stored age {} replaced by {} derived from date of birth", stored, age);
            }
        });
    }

    private void convertIncome(Map<String, Object> data) {
        if (!(data.get(HOUSEHOLD_INCOME) instanceof Number income)) {
            return;
        }
        if ("monthly".equals(data.get(INCOME_PERIOD))) {
            log.debug("Household income already monthly: {}", income);
            return;
        }
        long monthly = Math.round(income.doubleValue() / 12);
        data.put(ANNUAL_HOUSEHOLD_INCOME, income);
        data.put(HOUSEHOLD_INCOME, monthly);
        log.debug("Converted household income {}/year to {}/month", income, monthly);
    }
}
