package com.benefits.config;

import com.benefits.eligibility.BenefitProgram;
import com.benefits.eligibility.EligibilityRule;
import com.benefits.eligibility.InMemoryEligibilityRepository;

import java.util.List;

/**
 * Programs and their eligibility rules as loaded from configuration.
 */
public record RuleCatalog(List<BenefitProgram> programs, List<EligibilityRule> rules) {

    public RuleCatalog {
        programs = List.copyOf(programs);
        rules = List.copyOf(rules);
    }

    /**
     * Save every program and rule into the repository.
     */
    public InMemoryEligibilityRepository populate(InMemoryEligibilityRepository repository) {
        programs.forEach(repository::saveProgram);
        rules.forEach(repository::saveRule);
        return repository;
    }
}
