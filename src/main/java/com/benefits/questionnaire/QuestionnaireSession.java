package com.benefits.questionnaire;

import com.benefits.exception.InvalidAnswerException;
import com.benefits.progress.Checkpoint;
import com.benefits.progress.CheckpointManager;
import com.benefits.progress.ProgressMetrics;
import com.benefits.progress.ProgressTracker;
import com.benefits.progress.TimeTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One user's pass through a questionnaire.
 * <p>
 * State machine: {@code NOT_STARTED -> IN_PROGRESS <-> PAUSED -> COMPLETED}. Answers are
 * stored under each question's field name and double as the data context for flow
 * conditions. Calls that are illegal in the current state throw {@link IllegalStateException};
 * a navigation that fails leaves the session unchanged.
 * <p>
 * Not thread-safe; a session belongs to a single user.
 */
public class QuestionnaireSession {

    private static final Logger log = LoggerFactory.getLogger(QuestionnaireSession.class);

    private final String sessionId;
    private final FlowEngine engine;
    private final NavigationManager navigation;
    private final ProgressTracker progressTracker;
    private final CheckpointManager checkpoints;
    private final TimeTracker timeTracker;
    private final SkipLogicManager skipLogic;
    private final Clock clock;

    private final Map<String, Object> answers = new LinkedHashMap<>();
    private final Map<String, QuestionState> questionStates = new LinkedHashMap<>();
    private SessionState state = SessionState.NOT_STARTED;
    private String currentNodeId;
    private Instant questionShownAt;

    public QuestionnaireSession(String sessionId, FlowEngine engine, SkipLogicManager skipLogic,
                                ProgressTracker progressTracker, CheckpointManager checkpoints, Clock clock) {
        this.sessionId = sessionId;
        this.engine = engine;
        this.skipLogic = skipLogic;
        this.navigation = new NavigationManager(engine, skipLogic);
        this.progressTracker = progressTracker;
        this.checkpoints = checkpoints;
        this.timeTracker = new TimeTracker(clock);
        this.clock = clock;
        initQuestionStates();
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionState getState() {
        return state;
    }

    public String getCurrentNodeId() {
        return currentNodeId;
    }

    public Optional<Question> currentQuestion() {
        return engine.getFlow().node(currentNodeId).map(FlowNode::question);
    }

    public Map<String, Object> answers() {
        return Collections.unmodifiableMap(answers);
    }

    public Map<String, QuestionState> questionStates() {
        return Collections.unmodifiableMap(questionStates);
    }

    public NavigationHistory history() {
        return navigation.getHistory();
    }

    public TimeTracker timeTracker() {
        return timeTracker;
    }

    public NavigationResult start() {
        requireState(SessionState.NOT_STARTED, "start");
        NavigationResult result = navigation.start();
        if (!result.success()) {
            return result;
        }
        state = SessionState.IN_PROGRESS;
        timeTracker.start();
        enter(result.targetNodeId());
        log.info("Session {} started flow {}", sessionId, engine.getFlow().getId());
        return result;
    }

    /**
     * Record an answer to the current question.
     *
     * @throws InvalidAnswerException if the value does not fit the question; nothing is stored
     */
    public void answer(Object value) {
        requireState(SessionState.IN_PROGRESS, "answer");
        Question question = currentQuestion()
                .orElseThrow(() -> new IllegalStateException("No current question"));
        List<String> errors = AnswerValidator.validate(question, value);
        if (!errors.isEmpty()) {
            log.debug("Session {} rejected answer for {}: {}", sessionId, question.id(), errors);
            throw new InvalidAnswerException(question.id(), errors);
        }
        answers.put(question.fieldName(), value);
        questionStates.computeIfPresent(question.id(), (id, s) -> s.answered(value));
        refreshVisibility();
    }

    /**
     * Move forward. Reaching the end of the flow completes the session.
     */
    public NavigationResult next() {
        requireState(SessionState.IN_PROGRESS, "next");
        NavigationResult result = navigation.navigateForward(currentNodeId, answers);
        if (!result.success()) {
            log.warn("Session {} could not move forward from {}: {}", sessionId, currentNodeId, result.error());
            return result;
        }
        leaveCurrent();
        for (String questionId : result.questionsSkipped()) {
            questionStates.computeIfPresent(questionId, (id, s) -> s.status() == QuestionStatus.ANSWERED
                    ? s : s.withStatus(QuestionStatus.SKIPPED));
        }
        if (result.targetNodeId() == null) {
            complete();
        } else {
            enter(result.targetNodeId());
        }
        return result;
    }

    public NavigationResult previous() {
        requireState(SessionState.IN_PROGRESS, "previous");
        NavigationResult result = navigation.navigateBackward(currentNodeId);
        if (result.success()) {
            leaveCurrent();
            enter(result.targetNodeId());
        }
        return result;
    }

    public NavigationResult jumpTo(String nodeId) {
        requireState(SessionState.IN_PROGRESS, "jumpTo");
        NavigationResult result = navigation.jumpTo(nodeId, currentNodeId);
        if (result.success()) {
            leaveCurrent();
            enter(nodeId);
        }
        return result;
    }

    /**
     * Mark the current question skipped and move forward.
     */
    public NavigationResult skipQuestion() {
        requireState(SessionState.IN_PROGRESS, "skipQuestion");
        Question question = currentQuestion()
                .orElseThrow(() -> new IllegalStateException("No current question"));
        if (question.required()) {
            throw new IllegalStateException("Required question " + question.id() + " cannot be skipped");
        }
        QuestionState before = questionStates.get(question.id());
        questionStates.computeIfPresent(question.id(), (id, s) -> s.withStatus(QuestionStatus.SKIPPED));
        NavigationResult result = next();
        if (!result.success() && before != null) {
            questionStates.put(question.id(), before);
        }
        return result;
    }

    public void pause() {
        requireState(SessionState.IN_PROGRESS, "pause");
        state = SessionState.PAUSED;
        timeTracker.pause();
    }

    public void resume() {
        requireState(SessionState.PAUSED, "resume");
        state = SessionState.IN_PROGRESS;
        timeTracker.resume();
        questionShownAt = clock.instant();
    }

    public void complete() {
        if (state != SessionState.IN_PROGRESS && state != SessionState.PAUSED) {
            throw new IllegalStateException("Cannot complete session in state " + state);
        }
        leaveCurrent();
        state = SessionState.COMPLETED;
        timeTracker.pause();
        log.info("Session {} completed with {} answers", sessionId, answers.size());
    }

    /**
     * Discard all answers and return to {@link SessionState#NOT_STARTED}.
     */
    public void reset() {
        answers.clear();
        navigation.clearHistory();
        timeTracker.reset();
        currentNodeId = null;
        questionShownAt = null;
        state = SessionState.NOT_STARTED;
        initQuestionStates();
    }

    public Checkpoint createCheckpoint(String name) {
        if (state == SessionState.NOT_STARTED) {
            throw new IllegalStateException("Cannot checkpoint a session that has not started");
        }
        return checkpoints.createCheckpoint(currentNodeId, name, answers);
    }

    /**
     * Restore answers and position from a checkpoint. The history restarts at the
     * checkpoint's node.
     *
     * @return false if no such checkpoint exists
     */
    public boolean restoreCheckpoint(String checkpointId) {
        if (state == SessionState.NOT_STARTED || state == SessionState.COMPLETED) {
            throw new IllegalStateException("Cannot restore a checkpoint in state " + state);
        }
        Optional<Checkpoint> checkpoint = checkpoints.getCheckpoint(checkpointId);
        Optional<Map<String, Object>> restored = checkpoints.restoreCheckpoint(checkpointId);
        if (checkpoint.isEmpty() || restored.isEmpty()) {
            return false;
        }
        answers.clear();
        answers.putAll(restored.get());
        initQuestionStates();
        for (FlowNode node : engine.getFlow().getNodes().values()) {
            Question question = node.question();
            if (answers.containsKey(question.fieldName())) {
                questionStates.computeIfPresent(question.id(), (id, s) -> s.answered(answers.get(question.fieldName())));
            }
        }
        refreshVisibility();
        String nodeId = checkpoint.get().nodeId();
        navigation.restoreHistory(NavigationHistory.of(nodeId));
        enter(nodeId);
        return true;
    }

    public ProgressMetrics progress() {
        return progressTracker.calculateProgress(engine.getFlow(), questionStates, answers, currentNodeId, skipLogic);
    }

    private void enter(String nodeId) {
        currentNodeId = nodeId;
        questionShownAt = clock.instant();
        currentQuestion().ifPresent(question -> questionStates.computeIfPresent(question.id(),
                (id, s) -> s.status() == QuestionStatus.ANSWERED ? visitAnswered(s) : s.visit()));
    }

    private void leaveCurrent() {
        Optional<Question> question = currentQuestion();
        if (question.isEmpty() || questionShownAt == null) {
            return;
        }
        timeTracker.recordQuestionTime(question.get().id(), Duration.between(questionShownAt, clock.instant()));
        questionStates.computeIfPresent(question.get().id(),
                (id, s) -> s.status() == QuestionStatus.CURRENT ? s.withStatus(QuestionStatus.PENDING) : s);
        questionShownAt = null;
    }

    private static QuestionState visitAnswered(QuestionState s) {
        return new QuestionState(s.questionId(), QuestionStatus.ANSWERED, s.answer(), s.visible(), true, s.visitCount() + 1);
    }

    private void initQuestionStates() {
        questionStates.clear();
        for (Question question : engine.getFlow().questions()) {
            questionStates.put(question.id(), QuestionState.pending(question.id()));
        }
        refreshVisibility();
    }

    private void refreshVisibility() {
        for (Question question : engine.getFlow().questions()) {
            boolean visible = engine.shouldShowQuestion(question, answers);
            questionStates.computeIfPresent(question.id(), (id, s) -> {
                QuestionState updated = s.withVisible(visible);
                if (!visible && updated.status() == QuestionStatus.PENDING) {
                    return updated.withStatus(QuestionStatus.HIDDEN);
                }
                if (visible && updated.status() == QuestionStatus.HIDDEN) {
                    return updated.withStatus(QuestionStatus.PENDING);
                }
                return updated;
            });
        }
    }

    private void requireState(SessionState expected, String action) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + action + " session in state " + state);
        }
    }
}
