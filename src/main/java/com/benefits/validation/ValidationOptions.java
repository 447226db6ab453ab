package com.benefits.validation;

import java.util.Set;

/**
 * Options for {@link RuleValidator}.
 *
 * @param allowedOperators    Operators considered known; null means every operator the
 *                            validator's registry holds
 * @param disallowedOperators Operators that make a rule invalid
 * @param maxComplexity       Complexity above which decomposition is suggested
 * @param maxDepth            Nesting depth above which a warning is raised
 * @param requiredVariables   Variables the rule must reference
 * @param strict              Report unknown operators as errors instead of warnings
 */
public record ValidationOptions(
        Set<String> allowedOperators,
        Set<String> disallowedOperators,
        int maxComplexity,
        int maxDepth,
        Set<String> requiredVariables,
        boolean strict
) {

    public static final int DEFAULT_MAX_COMPLEXITY = 100;
    public static final int DEFAULT_MAX_DEPTH = 20;

    public ValidationOptions {
        allowedOperators = allowedOperators == null ? null : Set.copyOf(allowedOperators);
        disallowedOperators = disallowedOperators == null ? Set.of() : Set.copyOf(disallowedOperators);
        requiredVariables = requiredVariables == null ? Set.of() : Set.copyOf(requiredVariables);
    }

    public static ValidationOptions defaults() {
        return new ValidationOptions(null, Set.of(), DEFAULT_MAX_COMPLEXITY, DEFAULT_MAX_DEPTH, Set.of(), false);
    }

    public ValidationOptions withStrict(boolean strict) {
        return new ValidationOptions(allowedOperators, disallowedOperators, maxComplexity, maxDepth,
                requiredVariables, strict);
    }

    public ValidationOptions withRequiredVariables(Set<String> variables) {
        return new ValidationOptions(allowedOperators, disallowedOperators, maxComplexity, maxDepth,
                variables, strict);
    }

    public ValidationOptions withDisallowedOperators(Set<String> operators) {
        return new ValidationOptions(allowedOperators, operators, maxComplexity, maxDepth,
                requiredVariables, strict);
    }

    public ValidationOptions withMaxComplexity(int max) {
        return new ValidationOptions(allowedOperators, disallowedOperators, max, maxDepth,
                requiredVariables, strict);
    }

    public ValidationOptions withMaxDepth(int max) {
        return new ValidationOptions(allowedOperators, disallowedOperators, maxComplexity, max,
                requiredVariables, strict);
    }
}
