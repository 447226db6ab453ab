package com.benefits.adapter.spring;

import com.benefits.config.FlowConfigLoader;
import com.benefits.config.FlowDefinition;
import com.benefits.config.RuleCatalog;
import com.benefits.config.RuleCatalogLoader;
import com.benefits.debug.RuleDebugger;
import com.benefits.eligibility.DefaultEligibilityEngine;
import com.benefits.eligibility.EligibilityEngine;
import com.benefits.eligibility.InMemoryEligibilityRepository;
import com.benefits.evaluation.DetailedEvaluator;
import com.benefits.expression.EvaluationOptions;
import com.benefits.expression.RuleEvaluator;
import com.benefits.expression.RuleInterpreter;
import com.benefits.operator.BenefitOperators;
import com.benefits.operator.OperatorRegistry;
import com.benefits.progress.ProgressTracker;
import com.benefits.questionnaire.QuestionFlow;
import com.benefits.questionnaire.QuestionnaireSessionFactory;
import com.benefits.validation.RuleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring Boot auto-configuration for the benefits engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "benefits", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(BenefitsProperties.class)
public class BenefitsAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BenefitsAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock benefitsClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public OperatorRegistry operatorRegistry(Clock clock) {
        OperatorRegistry registry = OperatorRegistry.standard();
        BenefitOperators.register(registry, clock);
        log.info("Operator registry initialised with {} operators", registry.size());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleInterpreter ruleInterpreter(OperatorRegistry registry, BenefitsProperties properties) {
        return new RuleInterpreter(registry, properties.getMaxDepth());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleEvaluator ruleEvaluator(RuleInterpreter interpreter, BenefitsProperties properties) {
        EvaluationOptions options = properties.isStrict() ? EvaluationOptions.strictMode() : EvaluationOptions.defaults();
        return new RuleEvaluator(interpreter, options);
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleValidator ruleValidator(OperatorRegistry registry) {
        return new RuleValidator(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public DetailedEvaluator detailedEvaluator(RuleInterpreter interpreter) {
        return new DetailedEvaluator(interpreter);
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleDebugger ruleDebugger(RuleInterpreter interpreter, RuleValidator validator) {
        return new RuleDebugger(interpreter, validator);
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleCatalog ruleCatalog(BenefitsProperties properties) {
        return RuleCatalogLoader.load(properties.getRulesPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public InMemoryEligibilityRepository eligibilityRepository(RuleCatalog catalog) {
        return catalog.populate(new InMemoryEligibilityRepository());
    }

    @Bean
    @ConditionalOnMissingBean
    public EligibilityEngine eligibilityEngine(InMemoryEligibilityRepository repository,
                                               DetailedEvaluator detailedEvaluator, Clock clock) {
        log.info("Creating eligibility engine");
        return new DefaultEligibilityEngine(repository, detailedEvaluator, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public FlowDefinition flowDefinition(BenefitsProperties properties) {
        return FlowConfigLoader.load(properties.getFlowPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public QuestionFlow questionFlow(FlowDefinition definition) {
        return definition.flow();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProgressTracker progressTracker(RuleInterpreter interpreter, BenefitsProperties properties) {
        return new ProgressTracker(interpreter, properties.getAverageSecondsPerQuestion());
    }

    @Bean
    @ConditionalOnMissingBean
    public QuestionnaireSessionFactory questionnaireSessionFactory(QuestionFlow flow, FlowDefinition definition,
                                                                   RuleInterpreter interpreter,
                                                                   ProgressTracker progressTracker,
                                                                   Clock clock, BenefitsProperties properties) {
        return new QuestionnaireSessionFactory(flow, definition.skipRules(), interpreter, progressTracker,
                clock, properties.getMaxCheckpoints());
    }
}
