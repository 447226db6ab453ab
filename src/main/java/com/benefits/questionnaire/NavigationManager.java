package com.benefits.questionnaire;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Moves through a flow while keeping a back-navigation history.
 * <p>
 * Forward navigation passes over nodes whose question is hidden or skipped by a skip rule.
 * A failed navigation leaves the history untouched. The history is replaced as a whole on
 * each successful move, so readers always observe a consistent snapshot.
 */
public class NavigationManager {

    private static final Logger log = LoggerFactory.getLogger(NavigationManager.class);

    private final FlowEngine engine;
    private final SkipLogicManager skipLogic;
    private volatile NavigationHistory history = NavigationHistory.empty();

    public NavigationManager(FlowEngine engine, SkipLogicManager skipLogic) {
        this.engine = engine;
        this.skipLogic = skipLogic;
    }

    /**
     * Reset the history to the flow's start node.
     */
    public NavigationResult start() {
        return start(engine.getFlow().getStartNodeId());
    }

    /**
     * Reset the history to the given node.
     */
    public NavigationResult start(String startId) {
        if (engine.getFlow().node(startId).isEmpty()) {
            return NavigationResult.failed("Node " + startId + " not found", null);
        }
        history = NavigationHistory.of(startId);
        return NavigationResult.moved(startId, null);
    }

    public NavigationResult navigateForward(String fromNodeId, Map<String, Object> context) {
        NavigationResult first = engine.findNextNode(fromNodeId, context);
        if (!first.success() || first.targetNodeId() == null) {
            return first;
        }

        Set<String> toSkip = skipLogic.questionsToSkip(context);
        List<String> passedOver = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(fromNodeId);
        String targetId = first.targetNodeId();

        while (targetId != null) {
            if (!visited.add(targetId)) {
                return NavigationResult.failed("Circular reference detected at node " + targetId, fromNodeId);
            }
            Optional<FlowNode> target = engine.getFlow().node(targetId);
            if (target.isEmpty()) {
                return NavigationResult.failed("Node " + targetId + " not found", fromNodeId);
            }
            Question question = target.get().question();
            if (!toSkip.contains(question.id()) && engine.shouldShowQuestion(question, context)) {
                break;
            }
            passedOver.add(question.id());
            if (target.get().terminal()) {
                // nothing visible remains
                targetId = null;
                break;
            }
            NavigationResult hop = engine.findNextNode(targetId, context);
            if (!hop.success()) {
                return NavigationResult.failed(hop.error(), fromNodeId);
            }
            targetId = hop.targetNodeId();
        }

        NavigationResult result = first.withTarget(targetId, passedOver);
        if (targetId != null) {
            NavigationHistory next = history;
            if (!next.peek().map(fromNodeId::equals).orElse(false)) {
                next = next.push(fromNodeId);
            }
            history = next.push(targetId);
        }
        if (!passedOver.isEmpty()) {
            log.debug("Passed over questions {} moving from {} to {}", passedOver, fromNodeId, targetId);
        }
        return result;
    }

    /**
     * Return to the node visited before {@code fromNodeId}.
     */
    public NavigationResult navigateBackward(String fromNodeId) {
        NavigationHistory next = history;
        while (next.peek().map(fromNodeId::equals).orElse(false)) {
            next = next.pop();
        }
        Optional<String> previous = next.peek();
        if (previous.isEmpty()) {
            return NavigationResult.failed("No previous node available", fromNodeId);
        }
        history = next;
        return NavigationResult.moved(previous.get(), fromNodeId);
    }

    public NavigationResult jumpTo(String targetNodeId, String fromNodeId) {
        NavigationResult result = engine.jumpToNode(targetNodeId, fromNodeId);
        if (result.success()) {
            history = history.push(targetNodeId);
        }
        return result;
    }

    public boolean canGoBack() {
        return history.size() > 1;
    }

    public boolean canGoForward(String fromNodeId, Map<String, Object> context) {
        NavigationResult next = engine.findNextNode(fromNodeId, context);
        return next.success() && next.targetNodeId() != null;
    }

    public NavigationHistory getHistory() {
        return history;
    }

    void restoreHistory(NavigationHistory restored) {
        this.history = restored;
    }

    public void clearHistory() {
        history = NavigationHistory.empty();
    }
}
