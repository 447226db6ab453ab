package com.benefits.questionnaire;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Directed graph of question nodes. Nodes keep their declaration order.
 */
public final class QuestionFlow {

    private final String id;
    private final String name;
    private final String version;
    private final String startNodeId;
    private final Map<String, FlowNode> nodes;

    private QuestionFlow(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.version = builder.version;
        this.startNodeId = builder.startNodeId;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getStartNodeId() {
        return startNodeId;
    }

    public Map<String, FlowNode> getNodes() {
        return nodes;
    }

    public Optional<FlowNode> node(String nodeId) {
        return Optional.ofNullable(nodeId == null ? null : nodes.get(nodeId));
    }

    public Optional<FlowNode> startNode() {
        return node(startNodeId);
    }

    /**
     * Questions of all nodes in declaration order.
     */
    public List<Question> questions() {
        List<Question> questions = new ArrayList<>(nodes.size());
        for (FlowNode node : nodes.values()) {
            questions.add(node.question());
        }
        return questions;
    }

    public Optional<FlowNode> nodeForQuestion(String questionId) {
        return nodes.values().stream()
                .filter(node -> node.question().id().equals(questionId))
                .findFirst();
    }

    public int size() {
        return nodes.size();
    }

    public static final class Builder {

        private final String id;
        private String name;
        private String version = "1.0.0";
        private String startNodeId;
        private final Map<String, FlowNode> nodes = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
            this.name = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        /**
         * Start node; defaults to the first node added.
         */
        public Builder startNodeId(String startNodeId) {
            this.startNodeId = startNodeId;
            return this;
        }

        public Builder node(FlowNode node) {
            if (nodes.containsKey(node.id())) {
                throw new IllegalArgumentException("Duplicate flow node id: " + node.id());
            }
            nodes.put(node.id(), node);
            if (startNodeId == null) {
                startNodeId = node.id();
            }
            return this;
        }

        public QuestionFlow build() {
            return new QuestionFlow(this);
        }
    }
}
