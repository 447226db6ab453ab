package com.benefits.config;

import com.benefits.eligibility.BenefitProgram;
import com.benefits.eligibility.EligibilityRule;
import com.benefits.exception.ConfigurationException;
import com.benefits.exception.RuleParseException;
import com.benefits.rule.RuleNode;
import com.benefits.rule.RuleTreeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.benefits.config.YamlSource.getBoolean;
import static com.benefits.config.YamlSource.getInt;
import static com.benefits.config.YamlSource.getString;
import static com.benefits.config.YamlSource.list;
import static com.benefits.config.YamlSource.requireString;
import static com.benefits.config.YamlSource.section;
import static com.benefits.config.YamlSource.strings;

/**
 * Loads benefit programs and their eligibility rules from YAML.
 * Rule logic is written as JSON-logic maps directly in the YAML.
 */
public class RuleCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleCatalogLoader.class);

    public static RuleCatalog load(String path) {
        log.info("Loading rule catalog from: {}", path);
        return parse(YamlSource.read(path));
    }

    static RuleCatalog parse(Map<String, Object> root) {
        Map<String, Object> catalog = root.containsKey("catalog") ? section(root, "catalog") : root;

        List<BenefitProgram> programs = new ArrayList<>();
        Set<String> programIds = new HashSet<>();
        for (Map<String, Object> map : list(catalog, "programs")) {
            String id = requireString(map, "id", "Program");
            if (!programIds.add(id)) {
                throw new ConfigurationException("Duplicate program id: " + id);
            }
            programs.add(new BenefitProgram(
                    id,
                    getString(map, "name", id),
                    getString(map, "category", "general"),
                    getString(map, "description", null),
                    getBoolean(map, "active", true)));
        }

        List<EligibilityRule> rules = new ArrayList<>();
        for (Map<String, Object> map : list(catalog, "rules")) {
            String id = requireString(map, "id", "Rule");
            String programId = requireString(map, "program", "Rule " + id);
            if (!programIds.contains(programId)) {
                throw new ConfigurationException("Rule " + id + " references unknown program '" + programId + "'");
            }
            rules.add(new EligibilityRule(
                    id,
                    programId,
                    getString(map, "name", id),
                    logic(map.get("logic"), id),
                    getInt(map, "priority", 0),
                    getBoolean(map, "active", true),
                    strings(map, "required-fields"),
                    getString(map, "explanation", null),
                    strings(map, "required-documents"),
                    getString(map, "version", EligibilityRule.INITIAL_VERSION)));
        }

        log.info("Loaded rule catalog with {} programs and {} rules", programs.size(), rules.size());
        return new RuleCatalog(programs, rules);
    }

    private static RuleNode logic(Object plain, String ruleId) {
        if (plain == null) {
            throw new ConfigurationException("Rule " + ruleId + " has no logic");
        }
        try {
            return RuleTreeParser.fromObject(plain);
        } catch (RuleParseException e) {
            throw new ConfigurationException("Invalid logic for rule " + ruleId + ": " + e.getMessage(), e);
        }
    }
}
