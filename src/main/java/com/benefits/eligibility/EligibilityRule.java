package com.benefits.eligibility;

import com.benefits.rule.RuleNode;

import java.util.List;
import java.util.Objects;

/**
 * An eligibility rule of a program.
 * <p>
 * Rules are versioned values: {@link #revise} produces the next version instead of
 * changing this one.
 *
 * @param id                Rule id, stable across versions
 * @param programId         Owning program
 * @param name              Display name
 * @param logic             Rule tree; passes when it evaluates truthy
 * @param priority          Higher priorities are evaluated first
 * @param active            Inactive rules are never evaluated
 * @param requiredFields    Profile fields the rule needs
 * @param explanation       Reason text shown when the rule passes
 * @param requiredDocuments Documents an applicant must provide
 * @param version           Semantic version, e.g. {@code 1.0.0}
 */
public record EligibilityRule(
        String id,
        String programId,
        String name,
        RuleNode logic,
        int priority,
        boolean active,
        List<String> requiredFields,
        String explanation,
        List<String> requiredDocuments,
        String version
) {

    public static final String INITIAL_VERSION = "1.0.0";

    public EligibilityRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(programId, "programId");
        Objects.requireNonNull(logic, "logic");
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        requiredDocuments = requiredDocuments == null ? List.of() : List.copyOf(requiredDocuments);
        version = version == null ? INITIAL_VERSION : version;
    }

    public static EligibilityRule of(String id, String programId, RuleNode logic, int priority,
                                     List<String> requiredFields) {
        return new EligibilityRule(id, programId, id, logic, priority, true, requiredFields, null,
                List.of(), INITIAL_VERSION);
    }

    /**
     * New version of this rule with different logic.
     */
    public EligibilityRule revise(RuleNode newLogic) {
        return new EligibilityRule(id, programId, name, newLogic, priority, active, requiredFields,
                explanation, requiredDocuments, nextPatchVersion(version));
    }

    /**
     * New version of this rule with a different active flag.
     */
    public EligibilityRule withActive(boolean newActive) {
        return new EligibilityRule(id, programId, name, logic, priority, newActive, requiredFields,
                explanation, requiredDocuments, nextPatchVersion(version));
    }

    static String nextPatchVersion(String version) {
        String[] parts = version.split("\\.");
        if (parts.length != 3) {
            return version + ".1";
        }
        try {
            return parts[0] + "." + parts[1] + "." + (Integer.parseInt(parts[2]) + 1);
        } catch (NumberFormatException e) {
            return version + ".1";
        }
    }
}
