package com.benefits;

import com.benefits.eligibility.BatchEligibilityResult;
import com.benefits.eligibility.EligibilityEngine;
import com.benefits.eligibility.EligibilityEvaluationResult;
import com.benefits.eligibility.InMemoryEligibilityRepository;
import com.benefits.eligibility.UserProfile;
import com.benefits.questionnaire.Question;
import com.benefits.questionnaire.QuestionnaireSession;
import com.benefits.questionnaire.QuestionnaireSessionFactory;
import com.benefits.questionnaire.SessionState;
import com.benefits.spring.EnableBenefits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Example Spring Boot application: walks the bundled questionnaire with scripted answers
 * and evaluates the resulting profile against every active program.
 */
@SpringBootApplication
@EnableBenefits
public class BenefitsApplication {

    private static final Logger log = LoggerFactory.getLogger(BenefitsApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(BenefitsApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(QuestionnaireSessionFactory sessions,
                                  InMemoryEligibilityRepository repository,
                                  EligibilityEngine engine) {
        return args -> {
            log.info("=== Benefits Demo Started ===");

            // Scripted answers keyed by field name
            Map<String, Object> script = Map.of(
                    "age", 34,
                    "householdSize", 3,
                    "householdIncome", 30000,
                    "incomePeriod", "annual",
                    "hasChildren", true,
                    "numberOfChildren", 2,
                    "isPregnant", false,
                    "hasDisability", false);

            QuestionnaireSession session = sessions.newSession("demo");
            session.start();
            while (session.getState() == SessionState.IN_PROGRESS) {
                Optional<Question> question = session.currentQuestion();
                if (question.isEmpty()) {
                    break;
                }
                Object answer = script.get(question.get().fieldName());
                log.info("Q: {} -> {}", question.get().text(), answer);
                session.answer(answer);
                if (!session.next().success()) {
                    break;
                }
                log.info("Progress: {}%", session.progress().progressPercent());
            }

            repository.saveProfile(new UserProfile("demo-profile", session.answers()));
            BatchEligibilityResult batch = engine.evaluateAllPrograms("demo-profile").get(10, TimeUnit.SECONDS);

            for (EligibilityEvaluationResult result : batch.results().values()) {
                log.info("{}: eligible={} confidence={} reason={}",
                        result.programId(), result.eligible(), result.confidence(), result.reason());
                result.criteriaResults().forEach(c -> log.info("    {}", c.message()));
            }
            log.info("=== Summary: {} ===", batch.summary());
        };
    }
}
