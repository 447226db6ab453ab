package com.benefits.eligibility;

import com.benefits.exception.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link EligibilityRepository} held in memory. Saving a rule with an existing id stores
 * it as the current version and keeps earlier versions in its history.
 */
public class InMemoryEligibilityRepository implements EligibilityRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEligibilityRepository.class);

    private final Map<String, UserProfile> profiles = new ConcurrentHashMap<>();
    private final Map<String, BenefitProgram> programs = new ConcurrentHashMap<>();
    private final Map<String, List<EligibilityRule>> ruleVersions = new ConcurrentHashMap<>();

    public void saveProfile(UserProfile profile) {
        profiles.put(profile.id(), profile);
    }

    public void saveProgram(BenefitProgram program) {
        programs.put(program.id(), program);
    }

    public void saveRule(EligibilityRule rule) {
        ruleVersions.computeIfAbsent(rule.id(), id -> new CopyOnWriteArrayList<>()).add(rule);
        log.debug("Saved rule {} version {}", rule.id(), rule.version());
    }

    /**
     * All stored versions of a rule, oldest first.
     */
    public List<EligibilityRule> ruleHistory(String ruleId) {
        return List.copyOf(ruleVersions.getOrDefault(ruleId, List.of()));
    }

    @Override
    public CompletableFuture<UserProfile> findProfile(String profileId) {
        UserProfile profile = profiles.get(profileId);
        if (profile == null) {
            return CompletableFuture.failedFuture(new EntityNotFoundException("Profile " + profileId + " not found"));
        }
        return CompletableFuture.completedFuture(profile);
    }

    @Override
    public CompletableFuture<BenefitProgram> findProgram(String programId) {
        BenefitProgram program = programs.get(programId);
        if (program == null) {
            return CompletableFuture.failedFuture(new EntityNotFoundException("Program " + programId + " not found"));
        }
        return CompletableFuture.completedFuture(program);
    }

    @Override
    public CompletableFuture<List<EligibilityRule>> findActiveRulesForProgram(String programId) {
        List<EligibilityRule> rules = new ArrayList<>();
        for (List<EligibilityRule> versions : ruleVersions.values()) {
            EligibilityRule current = versions.get(versions.size() - 1);
            if (current.programId().equals(programId) && current.active()) {
                rules.add(current);
            }
        }
        if (rules.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new EntityNotFoundException("No active rules found for program " + programId));
        }
        rules.sort(Comparator.comparingInt(EligibilityRule::priority).reversed()
                .thenComparing(EligibilityRule::id));
        return CompletableFuture.completedFuture(rules);
    }

    @Override
    public CompletableFuture<List<BenefitProgram>> findActivePrograms() {
        List<BenefitProgram> active = programs.values().stream()
                .filter(BenefitProgram::active)
                .sorted(Comparator.comparing(BenefitProgram::id))
                .toList();
        return CompletableFuture.completedFuture(active);
    }
}
