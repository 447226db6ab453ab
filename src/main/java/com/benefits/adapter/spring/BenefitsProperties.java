package com.benefits.adapter.spring;

import com.benefits.expression.RuleInterpreter;
import com.benefits.progress.CheckpointManager;
import com.benefits.progress.ProgressTracker;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the benefits engine.
 */
@ConfigurationProperties(prefix = "benefits")
public class BenefitsProperties {

    /**
     * Whether the engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the program and rule catalog.
     * Supports classpath: prefix for classpath resources.
     */
    private String rulesPath = "classpath:benefit-rules.yaml";

    /**
     * Path to the questionnaire flow.
     */
    private String flowPath = "classpath:questionnaire-flow.yaml";

    /**
     * Rethrow evaluation errors instead of returning failed results.
     */
    private boolean strict = false;

    /**
     * Maximum rule nesting depth during evaluation.
     */
    private int maxDepth = RuleInterpreter.DEFAULT_MAX_DEPTH;

    private int averageSecondsPerQuestion = ProgressTracker.DEFAULT_AVERAGE_SECONDS_PER_QUESTION;

    private int maxCheckpoints = CheckpointManager.DEFAULT_MAX_CHECKPOINTS;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getRulesPath() {
        return rulesPath;
    }

    public void setRulesPath(String rulesPath) {
        this.rulesPath = rulesPath;
    }

    public String getFlowPath() {
        return flowPath;
    }

    public void setFlowPath(String flowPath) {
        this.flowPath = flowPath;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getAverageSecondsPerQuestion() {
        return averageSecondsPerQuestion;
    }

    public void setAverageSecondsPerQuestion(int averageSecondsPerQuestion) {
        this.averageSecondsPerQuestion = averageSecondsPerQuestion;
    }

    public int getMaxCheckpoints() {
        return maxCheckpoints;
    }

    public void setMaxCheckpoints(int maxCheckpoints) {
        this.maxCheckpoints = maxCheckpoints;
    }
}
