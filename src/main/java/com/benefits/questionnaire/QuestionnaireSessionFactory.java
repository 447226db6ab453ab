package com.benefits.questionnaire;

import com.benefits.expression.RuleInterpreter;
import com.benefits.progress.CheckpointManager;
import com.benefits.progress.ProgressTracker;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Opens sessions over one flow. The flow engine is shared; each session gets its own
 * skip logic, navigation and checkpoints.
 */
public class QuestionnaireSessionFactory {

    private final FlowEngine engine;
    private final List<SkipRule> skipRules;
    private final ProgressTracker progressTracker;
    private final Clock clock;
    private final int maxCheckpoints;

    public QuestionnaireSessionFactory(QuestionFlow flow, List<SkipRule> skipRules, RuleInterpreter interpreter,
                                       ProgressTracker progressTracker, Clock clock, int maxCheckpoints) {
        this.engine = new FlowEngine(flow, interpreter);
        this.skipRules = List.copyOf(skipRules);
        this.progressTracker = progressTracker;
        this.clock = clock;
        this.maxCheckpoints = maxCheckpoints;
    }

    public FlowEngine getEngine() {
        return engine;
    }

    public QuestionnaireSession newSession() {
        return newSession(UUID.randomUUID().toString());
    }

    public QuestionnaireSession newSession(String sessionId) {
        SkipLogicManager skipLogic = new SkipLogicManager(engine);
        skipRules.forEach(skipLogic::addRule);
        return new QuestionnaireSession(sessionId, engine, skipLogic, progressTracker,
                new CheckpointManager(clock, maxCheckpoints), clock);
    }
}
