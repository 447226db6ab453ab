package com.benefits.eligibility;

/**
 * A benefit program that eligibility rules belong to.
 */
public record BenefitProgram(String id, String name, String category, String description, boolean active) {

    public static BenefitProgram of(String id, String name, String category) {
        return new BenefitProgram(id, name, category, null, true);
    }
}
