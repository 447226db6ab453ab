package com.benefits.config;

import com.benefits.exception.ConfigurationException;
import com.benefits.exception.RuleParseException;
import com.benefits.progress.FlowSection;
import com.benefits.questionnaire.FlowBranch;
import com.benefits.questionnaire.FlowNode;
import com.benefits.questionnaire.InputType;
import com.benefits.questionnaire.Question;
import com.benefits.questionnaire.QuestionFlow;
import com.benefits.questionnaire.SkipRule;
import com.benefits.rule.RuleNode;
import com.benefits.rule.RuleTreeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.benefits.config.YamlSource.getBoolean;
import static com.benefits.config.YamlSource.getDouble;
import static com.benefits.config.YamlSource.getInt;
import static com.benefits.config.YamlSource.getString;
import static com.benefits.config.YamlSource.list;
import static com.benefits.config.YamlSource.requireString;
import static com.benefits.config.YamlSource.section;
import static com.benefits.config.YamlSource.strings;

/**
 * Loads a questionnaire flow from YAML.
 * <pre>
 * flow:
 *   id: household
 *   start: node1
 *   nodes:
 *     - id: node1
 *       next: node2
 *       question: { id: q1, text: "...", field: age, type: number, required: true }
 *       branches:
 *         - { id: b1, condition: {"&lt;": [{"var": "age"}, 18]}, target: node9, priority: 1 }
 *   skip-rules: [...]
 *   sections: [...]
 * </pre>
 */
public class FlowConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(FlowConfigLoader.class);

    public static FlowDefinition load(String path) {
        log.info("Loading questionnaire flow from: {}", path);
        return parse(YamlSource.read(path));
    }

    static FlowDefinition parse(Map<String, Object> root) {
        Map<String, Object> flowMap = root.containsKey("flow") ? section(root, "flow") : root;

        String id = requireString(flowMap, "id", "Flow");
        QuestionFlow.Builder builder = QuestionFlow.builder(id)
                .name(getString(flowMap, "name", id))
                .version(getString(flowMap, "version", "1.0.0"));
        String start = getString(flowMap, "start", null);
        if (start != null) {
            builder.startNodeId(start);
        }

        List<Map<String, Object>> nodes = list(flowMap, "nodes");
        if (nodes.isEmpty()) {
            log.warn("Flow {} declares no nodes", id);
        }
        for (int i = 0; i < nodes.size(); i++) {
            try {
                builder.node(parseNode(nodes.get(i), i));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid node " + i + " in flow " + id + ": " + e.getMessage(), e);
            }
        }

        List<SkipRule> skipRules = new ArrayList<>();
        for (Map<String, Object> map : list(flowMap, "skip-rules")) {
            String ruleId = requireString(map, "id", "Skip rule");
            skipRules.add(new SkipRule(
                    ruleId,
                    condition(map.get("condition"), "skip rule " + ruleId),
                    strings(map, "questions"),
                    getString(map, "description", null),
                    getInt(map, "priority", 0)));
        }

        List<FlowSection> sections = new ArrayList<>();
        List<Map<String, Object>> sectionList = list(flowMap, "sections");
        for (int i = 0; i < sectionList.size(); i++) {
            Map<String, Object> map = sectionList.get(i);
            String sectionId = requireString(map, "id", "Section");
            sections.add(new FlowSection(
                    sectionId,
                    getString(map, "name", sectionId),
                    strings(map, "questions"),
                    getInt(map, "order", i),
                    getBoolean(map, "required", false)));
        }

        QuestionFlow flow = builder.build();
        log.info("Loaded flow {} v{} with {} nodes, {} skip rules, {} sections",
                flow.getId(), flow.getVersion(), flow.size(), skipRules.size(), sections.size());
        return new FlowDefinition(flow, skipRules, sections);
    }

    private static FlowNode parseNode(Map<String, Object> map, int index) {
        String nodeId = getString(map, "id", "node-" + index);
        Map<String, Object> questionMap = section(map, "question");
        if (questionMap == null) {
            throw new ConfigurationException("Flow node " + nodeId + " has no question");
        }
        String questionId = getString(questionMap, "id", nodeId);
        Object showIf = questionMap.get("show-if");
        Question question = new Question(
                questionId,
                getString(questionMap, "text", ""),
                getString(questionMap, "field", null),
                InputType.fromString(getString(questionMap, "type", null)),
                getBoolean(questionMap, "required", false),
                showIf == null ? null : condition(showIf, "question " + questionId),
                strings(questionMap, "options"),
                getDouble(questionMap, "min"),
                getDouble(questionMap, "max"));

        List<FlowBranch> branches = new ArrayList<>();
        List<Map<String, Object>> branchList = list(map, "branches");
        for (int i = 0; i < branchList.size(); i++) {
            Map<String, Object> branch = branchList.get(i);
            String branchId = getString(branch, "id", nodeId + "-branch-" + i);
            branches.add(new FlowBranch(
                    branchId,
                    condition(branch.get("condition"), "branch " + branchId),
                    requireString(branch, "target", "Branch " + branchId),
                    getInt(branch, "priority", 0),
                    getString(branch, "description", null)));
        }

        return new FlowNode(nodeId, question, getString(map, "next", null), branches,
                getBoolean(map, "terminal", false));
    }

    private static RuleNode condition(Object plain, String owner) {
        if (plain == null) {
            throw new ConfigurationException("Missing condition for " + owner);
        }
        try {
            return RuleTreeParser.fromObject(plain);
        } catch (RuleParseException e) {
            throw new ConfigurationException("Invalid condition for " + owner + ": " + e.getMessage(), e);
        }
    }
}
