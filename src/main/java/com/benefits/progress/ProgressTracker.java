package com.benefits.progress;

import com.benefits.expression.RuleInterpreter;
import com.benefits.questionnaire.FlowEngine;
import com.benefits.questionnaire.Question;
import com.benefits.questionnaire.QuestionFlow;
import com.benefits.questionnaire.QuestionState;
import com.benefits.questionnaire.QuestionStatus;
import com.benefits.questionnaire.SkipLogicManager;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes progress over the questions currently visible in a flow.
 * <p>
 * Required questions weigh more than optional ones:
 * {@code progressPercent = round(0.7 * requiredPercent + 0.3 * overallPercent)}.
 * A ratio with a zero denominator counts as 100%.
 */
public class ProgressTracker {

    public static final int DEFAULT_AVERAGE_SECONDS_PER_QUESTION = 30;

    static final double REQUIRED_WEIGHT = 0.7;
    static final double OVERALL_WEIGHT = 0.3;

    private final RuleInterpreter interpreter;
    private final int averageSecondsPerQuestion;

    public ProgressTracker(RuleInterpreter interpreter) {
        this(interpreter, DEFAULT_AVERAGE_SECONDS_PER_QUESTION);
    }

    public ProgressTracker(RuleInterpreter interpreter, int averageSecondsPerQuestion) {
        if (averageSecondsPerQuestion < 0) {
            throw new IllegalArgumentException("averageSecondsPerQuestion must not be negative");
        }
        this.interpreter = interpreter;
        this.averageSecondsPerQuestion = averageSecondsPerQuestion;
    }

    public int getAverageSecondsPerQuestion() {
        return averageSecondsPerQuestion;
    }

    public ProgressMetrics calculateProgress(QuestionFlow flow, Map<String, QuestionState> states,
                                             Map<String, Object> context, String currentNodeId) {
        return calculateProgress(flow, states, context, currentNodeId, null);
    }

    /**
     * @param states    Question states keyed by question id; absent entries count as pending
     * @param skipLogic Optional skip rules; questions they skip are excluded like hidden ones
     */
    public ProgressMetrics calculateProgress(QuestionFlow flow, Map<String, QuestionState> states,
                                             Map<String, Object> context, String currentNodeId,
                                             SkipLogicManager skipLogic) {
        FlowEngine engine = new FlowEngine(flow, interpreter);
        List<Question> visible = visibleQuestions(engine, context, skipLogic);

        int total = visible.size();
        int required = 0;
        int answered = 0;
        int answeredRequired = 0;
        int skipped = 0;
        for (Question question : visible) {
            QuestionStatus status = statusOf(states, question.id());
            if (question.required()) {
                required++;
            }
            if (status == QuestionStatus.ANSWERED) {
                answered++;
                if (question.required()) {
                    answeredRequired++;
                }
            } else if (status == QuestionStatus.SKIPPED) {
                skipped++;
            }
        }
        int remaining = Math.max(0, total - answered - skipped);

        double overallPercent = percent(answered, total);
        double requiredPercent = percent(answeredRequired, required);
        int progress = (int) Math.round(REQUIRED_WEIGHT * requiredPercent + OVERALL_WEIGHT * overallPercent);

        return new ProgressMetrics(
                total,
                required,
                answered,
                skipped,
                remaining,
                currentPosition(engine, flow, visible, context, currentNodeId),
                progress,
                (int) Math.round(requiredPercent),
                (long) remaining * averageSecondsPerQuestion
        );
    }

    /**
     * Every visible required question has been answered.
     */
    public boolean isFlowComplete(QuestionFlow flow, Map<String, QuestionState> states,
                                  Map<String, Object> context) {
        return incompleteRequiredQuestions(flow, states, context).isEmpty();
    }

    public List<Question> incompleteRequiredQuestions(QuestionFlow flow, Map<String, QuestionState> states,
                                                      Map<String, Object> context) {
        FlowEngine engine = new FlowEngine(flow, interpreter);
        List<Question> incomplete = new ArrayList<>();
        for (Question question : engine.visibleQuestions(context)) {
            if (question.required() && statusOf(states, question.id()) != QuestionStatus.ANSWERED) {
                incomplete.add(question);
            }
        }
        return incomplete;
    }

    /**
     * Plain answered share of the visible questions, ignoring the required weighting.
     */
    public int calculateCompletionPercentage(QuestionFlow flow, Map<String, QuestionState> states,
                                             Map<String, Object> context) {
        List<Question> visible = new FlowEngine(flow, interpreter).visibleQuestions(context);
        int answered = 0;
        for (Question question : visible) {
            if (statusOf(states, question.id()) == QuestionStatus.ANSWERED) {
                answered++;
            }
        }
        return (int) Math.round(percent(answered, visible.size()));
    }

    public SectionProgress calculateSectionProgress(FlowSection section, Map<String, QuestionState> states) {
        int total = section.questionIds().size();
        int answered = 0;
        for (String questionId : section.questionIds()) {
            if (statusOf(states, questionId) == QuestionStatus.ANSWERED) {
                answered++;
            }
        }
        return new SectionProgress(section.id(), section.name(), total, answered,
                (int) Math.round(percent(answered, total)), answered == total);
    }

    /**
     * Progress of every section, in section order.
     */
    public List<SectionProgress> calculateAllSectionsProgress(List<FlowSection> sections,
                                                             Map<String, QuestionState> states) {
        List<FlowSection> ordered = new ArrayList<>(sections);
        ordered.sort(Comparator.comparingInt(FlowSection::order));
        List<SectionProgress> progress = new ArrayList<>(ordered.size());
        for (FlowSection section : ordered) {
            progress.add(calculateSectionProgress(section, states));
        }
        return progress;
    }

    private static List<Question> visibleQuestions(FlowEngine engine, Map<String, Object> context,
                                                   SkipLogicManager skipLogic) {
        List<Question> visible = engine.visibleQuestions(context);
        if (skipLogic == null) {
            return visible;
        }
        Set<String> skipped = skipLogic.questionsToSkip(context);
        visible.removeIf(question -> skipped.contains(question.id()));
        return visible;
    }

    // position along the flow path among visible questions
    private static int currentPosition(FlowEngine engine, QuestionFlow flow, List<Question> visible,
                                       Map<String, Object> context, String currentNodeId) {
        if (currentNodeId == null) {
            return 0;
        }
        Map<String, Question> visibleById = new HashMap<>();
        for (Question question : visible) {
            visibleById.put(question.id(), question);
        }
        int position = 0;
        for (String nodeId : engine.findFlowPath(context)) {
            Question question = flow.node(nodeId).map(node -> node.question()).orElse(null);
            if (question == null || !visibleById.containsKey(question.id())) {
                continue;
            }
            position++;
            if (nodeId.equals(currentNodeId)) {
                return position;
            }
        }
        return 0;
    }

    private static QuestionStatus statusOf(Map<String, QuestionState> states, String questionId) {
        QuestionState state = states == null ? null : states.get(questionId);
        return state == null ? QuestionStatus.PENDING : state.status();
    }

    private static double percent(int part, int whole) {
        return whole == 0 ? 100.0 : part * 100.0 / whole;
    }
}
