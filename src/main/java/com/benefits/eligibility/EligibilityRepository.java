package com.benefits.eligibility;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Persistence collaborator for profiles, programs and rules.
 * <p>
 * Lookups complete exceptionally with {@link com.benefits.exception.EntityNotFoundException}
 * when the requested data does not exist.
 */
public interface EligibilityRepository {

    CompletableFuture<UserProfile> findProfile(String profileId);

    CompletableFuture<BenefitProgram> findProgram(String programId);

    /**
     * Active rules of a program, highest priority first.
     */
    CompletableFuture<List<EligibilityRule>> findActiveRulesForProgram(String programId);

    CompletableFuture<List<BenefitProgram>> findActivePrograms();
}
