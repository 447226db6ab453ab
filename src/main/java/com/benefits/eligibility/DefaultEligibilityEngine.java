package com.benefits.eligibility;

import com.benefits.evaluation.CriterionResult;
import com.benefits.evaluation.DetailedEvaluationResult;
import com.benefits.evaluation.DetailedEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Default implementation of EligibilityEngine.
 * <p>
 * Per program: load the profile and the active rules, evaluate every rule in descending
 * priority order and aggregate. The program is eligible only if every rule passes. The
 * first failing rule in priority order explains the result; when all pass, the highest
 * priority rule does.
 */
public class DefaultEligibilityEngine implements EligibilityEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultEligibilityEngine.class);

    private final EligibilityRepository repository;
    private final DetailedEvaluator detailedEvaluator;
    private final DataContextPreparer contextPreparer;
    private final Clock clock;

    public DefaultEligibilityEngine(EligibilityRepository repository, DetailedEvaluator detailedEvaluator,
                                    Clock clock) {
        this(repository, detailedEvaluator, new DataContextPreparer(clock), clock);
    }

    public DefaultEligibilityEngine(EligibilityRepository repository, DetailedEvaluator detailedEvaluator,
                                    DataContextPreparer contextPreparer, Clock clock) {
        this.repository = repository;
        this.detailedEvaluator = detailedEvaluator;
        this.contextPreparer = contextPreparer;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<EligibilityEvaluationResult> evaluateEligibility(String profileId, String programId) {
        long start = System.nanoTime();
        return safely(() -> repository.findProfile(profileId))
                .thenCombine(safely(() -> repository.findProgram(programId)), (profile, program) -> profile)
                .thenCompose(profile -> safely(() -> repository.findActiveRulesForProgram(programId))
                        .thenApply(rules -> evaluateRules(profile, programId, rules, start)))
                .exceptionally(error -> {
                    Throwable cause = unwrap(error);
                    log.error("Eligibility evaluation failed for profile {} program {}: {}",
                            profileId, programId, cause.getMessage());
                    String reason = cause.getMessage() != null ? cause.getMessage() : "Unknown error occurred";
                    return EligibilityEvaluationResult.error(profileId, programId, reason, clock.instant(),
                            elapsedMillis(start));
                });
    }

    @Override
    public CompletableFuture<BatchEligibilityResult> evaluateMultiplePrograms(String profileId,
                                                                              List<String> programIds) {
        long start = System.nanoTime();
        Map<String, EligibilityEvaluationResult> results = new LinkedHashMap<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String programId : programIds) {
            chain = chain.thenCompose(ignored -> evaluateEligibility(profileId, programId)
                    .thenAccept(result -> results.put(programId, result)));
        }
        return chain.thenApply(ignored -> {
            BatchEligibilityResult batch = BatchEligibilityResult.of(profileId, results, elapsedMillis(start));
            log.info("Evaluated {} programs for profile {}: {} eligible",
                    batch.summary().total(), profileId, batch.summary().eligible());
            return batch;
        });
    }

    @Override
    public CompletableFuture<BatchEligibilityResult> evaluateAllPrograms(String profileId) {
        long start = System.nanoTime();
        return safely(repository::findActivePrograms)
                .thenCompose(programs -> evaluateMultiplePrograms(profileId,
                        programs.stream().map(BenefitProgram::id).toList()))
                .exceptionally(error -> {
                    log.error("Could not list active programs: {}", unwrap(error).getMessage());
                    return BatchEligibilityResult.of(profileId, Map.of(), elapsedMillis(start));
                });
    }

    EligibilityEvaluationResult evaluateRules(UserProfile profile, String programId,
                                              List<EligibilityRule> activeRules, long start) {
        Map<String, Object> data = contextPreparer.prepare(profile);
        List<EligibilityRule> rules = new ArrayList<>(activeRules);
        rules.sort(Comparator.comparingInt(EligibilityRule::priority).reversed());

        Set<String> allMissing = new LinkedHashSet<>();
        RuleOutcome first = null;
        RuleOutcome firstFailed = null;
        for (EligibilityRule rule : rules) {
            allMissing.addAll(missingFields(rule, data));
            DetailedEvaluationResult detailed = detailedEvaluator.evaluateWithDetails(rule.logic(), data);
            RuleOutcome outcome = new RuleOutcome(rule, detailed);
            log.debug("Rule {} v{} for program {}: passed={}, success={}",
                    rule.id(), rule.version(), programId, detailed.passed(), detailed.success());
            if (first == null) {
                first = outcome;
            }
            if (!detailed.passed() && firstFailed == null) {
                firstFailed = outcome;
            }
        }
        if (first == null) {
            return EligibilityEvaluationResult.error(profile.id(), programId,
                    "No active rules found for program " + programId, clock.instant(), elapsedMillis(start));
        }

        boolean allPassed = firstFailed == null;
        RuleOutcome representative = allPassed ? first : firstFailed;
        DetailedEvaluationResult detailed = representative.detailed();
        boolean incomplete = !allMissing.isEmpty();
        boolean eligible = allPassed && detailed.success();

        List<CriterionResult> criteria = detailed.criteriaResults().isEmpty()
                ? criteriaFromRequiredFields(representative.rule(), data)
                : detailed.criteriaResults();

        EligibilityEvaluationResult result = new EligibilityEvaluationResult(
                profile.id(),
                programId,
                representative.rule().id(),
                representative.rule().version(),
                eligible,
                confidence(detailed.success(), incomplete),
                reason(detailed.success(), eligible, representative.rule(), incomplete),
                criteria,
                incomplete ? new ArrayList<>(allMissing) : List.of(),
                representative.rule().requiredDocuments(),
                !detailed.success() || incomplete,
                incomplete,
                clock.instant(),
                elapsedMillis(start));
        log.debug("Program {} for profile {}: eligible={}, confidence={}",
                programId, profile.id(), result.eligible(), result.confidence());
        return result;
    }

    /**
     * Required fields that are absent, null or empty strings.
     */
    static List<String> missingFields(EligibilityRule rule, Map<String, Object> data) {
        List<String> missing = new ArrayList<>();
        for (String field : rule.requiredFields()) {
            Object value = data.get(field);
            if (value == null || "".equals(value)) {
                missing.add(field);
            }
        }
        return missing;
    }

    static int confidence(boolean success, boolean incomplete) {
        if (!success) {
            return EligibilityEvaluationResult.CONFIDENCE_ERROR;
        }
        if (incomplete) {
            return EligibilityEvaluationResult.CONFIDENCE_INCOMPLETE;
        }
        return EligibilityEvaluationResult.CONFIDENCE_COMPLETE;
    }

    static String reason(boolean success, boolean eligible, EligibilityRule rule, boolean incomplete) {
        if (!success) {
            return "Unable to evaluate eligibility due to an error";
        }
        if (incomplete) {
            return "Cannot fully determine eligibility - missing required information";
        }
        if (eligible) {
            return rule.explanation() != null ? rule.explanation() : "You meet the eligibility criteria for this program";
        }
        return "You do not meet the eligibility criteria for this program";
    }

    /**
     * Breakdown for rules whose logic has no variable comparisons: one entry per provided
     * required field, boolean fields are met when true.
     */
    static List<CriterionResult> criteriaFromRequiredFields(EligibilityRule rule, Map<String, Object> data) {
        List<CriterionResult> criteria = new ArrayList<>();
        for (String field : rule.requiredFields()) {
            Object value = data.get(field);
            if (value == null || "".equals(value)) {
                continue;
            }
            boolean met = !(value instanceof Boolean b) || b;
            criteria.add(CriterionResult.fromField(field, value, met));
        }
        return criteria;
    }

    private static <T> CompletableFuture<T> safely(Supplier<CompletableFuture<T>> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static double elapsedMillis(long start) {
        return (System.nanoTime() - start) / 1_000_000.0;
    }

    private record RuleOutcome(EligibilityRule rule, DetailedEvaluationResult detailed) {
    }
}
