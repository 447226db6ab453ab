package com.benefits;

import com.benefits.config.FlowConfigLoader;
import com.benefits.config.FlowDefinition;
import com.benefits.config.RuleCatalogLoader;
import com.benefits.eligibility.BatchEligibilityResult;
import com.benefits.eligibility.DefaultEligibilityEngine;
import com.benefits.eligibility.EligibilityEngine;
import com.benefits.eligibility.EligibilityEvaluationResult;
import com.benefits.eligibility.InMemoryEligibilityRepository;
import com.benefits.eligibility.UserProfile;
import com.benefits.evaluation.DetailedEvaluator;
import com.benefits.expression.RuleInterpreter;
import com.benefits.operator.BenefitOperators;
import com.benefits.operator.OperatorRegistry;
import com.benefits.progress.ProgressTracker;
import com.benefits.questionnaire.QuestionnaireSession;
import com.benefits.questionnaire.QuestionnaireSessionFactory;
import com.benefits.questionnaire.QuestionStatus;
import com.benefits.questionnaire.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests over the bundled questionnaire and rule catalog:
 * - questionnaire walk with skip logic and hidden questions
 * - SNAP income limits scaled by household size
 * - annual to monthly income conversion
 * - evaluation of every active program
 */
class BenefitsApplicationTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);

    private InMemoryEligibilityRepository repository;
    private EligibilityEngine engine;
    private QuestionnaireSessionFactory sessions;

    @BeforeEach
    void setUp() {
        OperatorRegistry registry = OperatorRegistry.standard();
        BenefitOperators.register(registry, CLOCK);
        RuleInterpreter interpreter = new RuleInterpreter(registry);

        repository = RuleCatalogLoader.load("classpath:benefit-rules.yaml")
                .populate(new InMemoryEligibilityRepository());
        engine = new DefaultEligibilityEngine(repository, new DetailedEvaluator(interpreter), CLOCK);

        FlowDefinition flow = FlowConfigLoader.load("classpath:questionnaire-flow.yaml");
        sessions = new QuestionnaireSessionFactory(flow.flow(), flow.skipRules(), interpreter,
                new ProgressTracker(interpreter), CLOCK, 10);
    }

    private QuestionnaireSession walk(Map<String, Object> answers) {
        QuestionnaireSession session = sessions.newSession();
        session.start();
        while (session.getState() == SessionState.IN_PROGRESS) {
            String field = session.currentQuestion().orElseThrow().fieldName();
            session.answer(answers.get(field));
            assertTrue(session.next().success());
        }
        return session;
    }

    private EligibilityEvaluationResult evaluate(String programId, Map<String, Object> fields) throws Exception {
        repository.saveProfile(new UserProfile("p", fields));
        return engine.evaluateEligibility("p", programId).get(5, TimeUnit.SECONDS);
    }

    // =====================================================================
    // Questionnaire
    // =====================================================================

    @Test
    @DisplayName("Family walk answers every visible question")
    void familyWalk() {
        QuestionnaireSession session = walk(Map.of(
                "age", 34, "householdSize", 3, "householdIncome", 30000, "incomePeriod", "annual",
                "hasChildren", true, "numberOfChildren", 2, "isPregnant", false, "hasDisability", false));

        assertEquals(SessionState.COMPLETED, session.getState());
        assertEquals(8, session.answers().size());
        assertEquals(100, session.progress().progressPercent());
    }

    @Test
    @DisplayName("Senior without children skips pregnancy and child count")
    void seniorWalk() {
        QuestionnaireSession session = walk(Map.of(
                "age", 70, "householdSize", 1, "householdIncome", 1200, "incomePeriod", "monthly",
                "hasChildren", false, "hasDisability", false));

        assertEquals(SessionState.COMPLETED, session.getState());
        assertFalse(session.answers().containsKey("isPregnant"));
        assertFalse(session.answers().containsKey("numberOfChildren"));
        assertEquals(QuestionStatus.SKIPPED, session.questionStates().get("q-pregnancy").status());
        assertEquals(QuestionStatus.HIDDEN, session.questionStates().get("q-children-count").status());
    }

    // =====================================================================
    // Eligibility
    // =====================================================================

    @ParameterizedTest
    @CsvSource({
            "1, 1000, monthly, true",
            "1, 1001, monthly, false",
            "4, 48000, annual, true",
            "2, 30000, annual, false"
    })
    @DisplayName("SNAP income limit scales with household size")
    void snapIncomeLimit(int householdSize, int income, String period, boolean expected) throws Exception {
        Map<String, Object> fields = new HashMap<>();
        fields.put("householdSize", householdSize);
        fields.put("householdIncome", income);
        fields.put("incomePeriod", period);

        EligibilityEvaluationResult result = evaluate("snap", fields);

        assertEquals(expected, result.eligible());
        assertFalse(result.isError());
    }

    @Test
    @DisplayName("Seniors qualify for Medicaid regardless of income")
    void medicaidSenior() throws Exception {
        EligibilityEvaluationResult result = evaluate("medicaid",
                Map.of("age", 70, "householdIncome", 5000, "incomePeriod", "monthly"));

        assertTrue(result.eligible());
        assertEquals(EligibilityEvaluationResult.CONFIDENCE_COMPLETE, result.confidence());
    }

    @Test
    @DisplayName("All active programs are evaluated from questionnaire answers")
    void allPrograms() throws Exception {
        QuestionnaireSession session = walk(Map.of(
                "age", 34, "householdSize", 3, "householdIncome", 30000, "incomePeriod", "annual",
                "hasChildren", true, "numberOfChildren", 2, "isPregnant", false, "hasDisability", false));
        repository.saveProfile(new UserProfile("family", session.answers()));

        BatchEligibilityResult batch = engine.evaluateAllPrograms("family").get(5, TimeUnit.SECONDS);

        // liheap is inactive
        assertEquals(3, batch.results().size());
        assertTrue(batch.results().get("snap").eligible());
        assertTrue(batch.results().get("wic").eligible());
        assertFalse(batch.results().get("medicaid").eligible());
        assertEquals(2, batch.summary().eligible());
    }
}
