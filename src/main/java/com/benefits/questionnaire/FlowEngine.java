package com.benefits.questionnaire;

import com.benefits.exception.RuleEvaluationException;
import com.benefits.expression.RuleInterpreter;
import com.benefits.operator.Values;
import com.benefits.rule.RuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates conditions and transitions over a {@link QuestionFlow}.
 * <p>
 * Holds no session state: every call takes the answer context it should be evaluated
 * against, so one engine can serve any number of concurrent sessions of the same flow.
 */
public class FlowEngine {

    private static final Logger log = LoggerFactory.getLogger(FlowEngine.class);

    static final int MAX_PATH_STEPS = 1000;

    private static final Comparator<FlowBranch> BY_PRIORITY_DESC =
            Comparator.comparingInt(FlowBranch::priority).reversed();

    private final QuestionFlow flow;
    private final RuleInterpreter interpreter;

    public FlowEngine(QuestionFlow flow, RuleInterpreter interpreter) {
        this.flow = flow;
        this.interpreter = interpreter;
    }

    public QuestionFlow getFlow() {
        return flow;
    }

    /**
     * Evaluate a condition against the answers. Evaluation failures count as not met.
     */
    public ConditionResult evaluateCondition(RuleNode condition, Map<String, Object> context) {
        long start = System.nanoTime();
        try {
            Object value = interpreter.evaluate(condition, context);
            return new ConditionResult(Values.truthy(value), null, elapsedMillis(start));
        } catch (RuleEvaluationException e) {
            log.warn("Flow condition failed in flow {}: {}", flow.getId(), e.getMessage());
            return new ConditionResult(false, e.getMessage(), elapsedMillis(start));
        }
    }

    public boolean shouldShowQuestion(Question question, Map<String, Object> context) {
        if (question.showIf() == null) {
            return true;
        }
        return evaluateCondition(question.showIf(), context).met();
    }

    /**
     * Resolve the successor of a node: the highest-priority true branch, else the default next.
     * A terminal node succeeds with no target.
     */
    public NavigationResult findNextNode(String currentNodeId, Map<String, Object> context) {
        Optional<FlowNode> current = flow.node(currentNodeId);
        if (current.isEmpty()) {
            return NavigationResult.failed("Node " + currentNodeId + " not found", currentNodeId);
        }
        FlowNode node = current.get();
        if (node.terminal()) {
            return NavigationResult.end(currentNodeId);
        }
        // List.sort is stable, so equal priorities keep declaration order
        List<FlowBranch> branches = new ArrayList<>(node.branches());
        branches.sort(BY_PRIORITY_DESC);
        for (FlowBranch branch : branches) {
            if (evaluateCondition(branch.condition(), context).met()) {
                log.debug("Branch {} taken from {} to {}", branch.id(), currentNodeId, branch.targetId());
                return NavigationResult.branched(branch.targetId(), currentNodeId, branch.id());
            }
        }
        if (node.nextId() != null) {
            return NavigationResult.moved(node.nextId(), currentNodeId);
        }
        return NavigationResult.failed("No next node found and not a terminal node", currentNodeId);
    }

    public NavigationResult jumpToNode(String targetNodeId, String currentNodeId) {
        if (flow.node(targetNodeId).isEmpty()) {
            return NavigationResult.failed("Target node " + targetNodeId + " not found", currentNodeId);
        }
        return NavigationResult.moved(targetNodeId, currentNodeId);
    }

    public List<Question> visibleQuestions(Map<String, Object> context) {
        List<Question> visible = new ArrayList<>();
        for (Question question : flow.questions()) {
            if (shouldShowQuestion(question, context)) {
                visible.add(question);
            }
        }
        return visible;
    }

    public List<Question> hiddenQuestions(Map<String, Object> context) {
        List<Question> hidden = new ArrayList<>();
        for (Question question : flow.questions()) {
            if (!shouldShowQuestion(question, context)) {
                hidden.add(question);
            }
        }
        return hidden;
    }

    /**
     * Follow transitions from the start node under the given answers. Stops at a terminal
     * node, a dead end, a revisited node or after {@value #MAX_PATH_STEPS} steps.
     */
    public List<String> findFlowPath(Map<String, Object> context) {
        List<String> path = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        String currentId = flow.getStartNodeId();
        int steps = 0;
        while (currentId != null && visited.add(currentId) && steps++ < MAX_PATH_STEPS) {
            if (flow.node(currentId).isEmpty()) {
                break;
            }
            path.add(currentId);
            NavigationResult next = findNextNode(currentId, context);
            currentId = next.success() ? next.targetNodeId() : null;
        }
        return path;
    }

    public FlowValidationResult validateFlow() {
        List<FlowIssue> errors = new ArrayList<>();
        List<FlowIssue> warnings = new ArrayList<>();
        List<String> missingTargets = new ArrayList<>();
        Map<String, FlowNode> nodes = flow.getNodes();

        if (flow.startNode().isEmpty()) {
            errors.add(new FlowIssue(flow.getStartNodeId(), "Start node not found in flow"));
        }
        for (FlowNode node : nodes.values()) {
            if (node.nextId() != null && !nodes.containsKey(node.nextId())) {
                errors.add(new FlowIssue(node.id(), "Next node " + node.nextId() + " not found"));
                missingTargets.add(node.nextId());
            }
            for (FlowBranch branch : node.branches()) {
                if (!nodes.containsKey(branch.targetId())) {
                    errors.add(new FlowIssue(node.id(), "Branch target " + branch.targetId() + " not found"));
                    missingTargets.add(branch.targetId());
                }
            }
            String fieldName = node.question().fieldName();
            if (fieldName == null || fieldName.isBlank()) {
                errors.add(new FlowIssue(node.id(), "Question missing fieldName"));
            }
        }

        Set<String> reachable = reachableFromStart();
        List<String> orphaned = new ArrayList<>();
        for (String nodeId : nodes.keySet()) {
            if (!reachable.contains(nodeId)) {
                orphaned.add(nodeId);
                warnings.add(new FlowIssue(nodeId, "Node is not reachable from start"));
            }
        }

        List<String> cycles = findCycles();
        for (String cycle : cycles) {
            errors.add(new FlowIssue(null, "Circular reference detected: " + cycle));
        }

        return new FlowValidationResult(errors.isEmpty(), errors, warnings, orphaned, cycles, missingTargets);
    }

    private Set<String> reachableFromStart() {
        Set<String> reachable = new LinkedHashSet<>();
        List<String> pending = new ArrayList<>();
        if (flow.startNode().isPresent()) {
            pending.add(flow.getStartNodeId());
        }
        while (!pending.isEmpty()) {
            String nodeId = pending.remove(pending.size() - 1);
            Optional<FlowNode> node = flow.node(nodeId);
            if (node.isEmpty() || !reachable.add(nodeId)) {
                continue;
            }
            pending.addAll(successors(node.get()));
        }
        return reachable;
    }

    // iterative depth-first search; a successor already on the current path closes a cycle
    private List<String> findCycles() {
        List<String> cycles = new ArrayList<>();
        Map<String, FlowNode> nodes = flow.getNodes();
        Set<String> explored = new HashSet<>();
        for (String root : nodes.keySet()) {
            if (explored.contains(root)) {
                continue;
            }
            List<String> path = new ArrayList<>();
            Set<String> onPath = new HashSet<>();
            Deque<Iterator<String>> pending = new ArrayDeque<>();
            path.add(root);
            onPath.add(root);
            pending.push(successors(nodes.get(root)).iterator());
            while (!pending.isEmpty()) {
                Iterator<String> next = pending.peek();
                if (!next.hasNext()) {
                    pending.pop();
                    String done = path.remove(path.size() - 1);
                    onPath.remove(done);
                    explored.add(done);
                    continue;
                }
                String target = next.next();
                if (!nodes.containsKey(target) || explored.contains(target)) {
                    continue;
                }
                if (onPath.contains(target)) {
                    List<String> loop = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                    loop.add(target);
                    cycles.add(String.join(" -> ", loop));
                    continue;
                }
                path.add(target);
                onPath.add(target);
                pending.push(successors(nodes.get(target)).iterator());
            }
        }
        return cycles;
    }

    private static List<String> successors(FlowNode node) {
        List<String> next = new ArrayList<>();
        for (FlowBranch branch : node.branches()) {
            next.add(branch.targetId());
        }
        if (node.nextId() != null) {
            next.add(node.nextId());
        }
        return next;
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
