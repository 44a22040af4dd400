package com.eainde.patientqa.redflag;

import com.eainde.patientqa.config.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads a {@link RedFlagRuleSet} from JSON.
 *
 * <pre>
 * {
 *   "version": "2025-01",
 *   "advisoryPatterns": ["\\bif\\b"],
 *   "rules": [
 *     { "id": "black-stool", "label": "Black or tarry stool", "severity": "HIGH",
 *       "appliesTo": "BOTH",
 *       "allOf": ["\\b(black|tarry)\\b.*\\bstools?\\b"],
 *       "escalation": "..." }
 *   ]
 * }
 * </pre>
 */
public class RedFlagRuleLoader {

    private static final Logger log = LoggerFactory.getLogger(RedFlagRuleLoader.class);

    private final ObjectMapper objectMapper;

    public RedFlagRuleLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RedFlagRuleSet load(InputStream in, String origin) {
        RuleFile file;
        try {
            file = objectMapper.readValue(in, RuleFile.class);
        } catch (IOException e) {
            throw new ConfigurationException("Unreadable red-flag rule file: " + origin, e);
        }
        if (file.rules() == null || file.rules().isEmpty()) {
            throw new ConfigurationException("Red-flag rule file has no rules: " + origin);
        }

        List<RedFlagRule> rules = new ArrayList<>();
        for (RuleEntry entry : file.rules()) {
            rules.add(toRule(entry, origin));
        }

        List<Pattern> advisory;
        try {
            advisory = file.advisoryPatterns() == null ? List.of()
                    : file.advisoryPatterns().stream().map(RedFlagRule::compile).toList();
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid advisory pattern in " + origin, e);
        }

        RedFlagRuleSet ruleSet;
        try {
            ruleSet = new RedFlagRuleSet(file.version(), rules, advisory);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage() + " (" + origin + ")", e);
        }
        log.info("Loaded {} red-flag rules and {} advisory patterns (version {}) from {}",
                ruleSet.size(), advisory.size(), ruleSet.getVersion(), origin);
        return ruleSet;
    }

    private static RedFlagRule toRule(RuleEntry entry, String origin) {
        if (entry.id() == null || entry.id().isBlank()) {
            throw new ConfigurationException("Red-flag rule without id in " + origin);
        }
        if (entry.severity() == null || entry.escalation() == null
                || entry.allOf() == null || entry.allOf().isEmpty()) {
            throw new ConfigurationException("Red-flag rule '" + entry.id()
                    + "' needs severity, escalation and at least one pattern (" + origin + ")");
        }
        try {
            List<Pattern> patterns = entry.allOf().stream().map(RedFlagRule::compile).toList();
            return new RedFlagRule(entry.id(), entry.label(), patterns, entry.severity(), entry.escalation(),
                    entry.appliesTo());
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid pattern in red-flag rule '" + entry.id() + "'", e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleFile(
            @JsonProperty("version")          String version,
            @JsonProperty("advisoryPatterns") List<String> advisoryPatterns,
            @JsonProperty("rules")            List<RuleEntry> rules
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleEntry(
            @JsonProperty("id")         String id,
            @JsonProperty("label")      String label,
            @JsonProperty("severity")   Severity severity,
            @JsonProperty("allOf")      List<String> allOf,
            @JsonProperty("escalation") String escalation,
            @JsonProperty("appliesTo")  RuleScope appliesTo
    ) {}
}
