package com.eainde.patientqa.redflag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Pure classifier that flags emergency symptom patterns in free text.
 *
 * <p>Deterministic: the result depends only on the text and the rule set, so
 * replaying an evaluation case always yields the same classification. Overlapping
 * matches resolve to the highest severity; ties go to the rule declared first.</p>
 *
 * <p>No side effects. Callers decide what to do with a match.</p>
 */
public class RedFlagDetector {

    private static final Logger log = LoggerFactory.getLogger(RedFlagDetector.class);

    private static final String MATCHED_PLACEHOLDER = "{matched}";
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+|\\n+");

    private final RedFlagRuleSet ruleSet;

    public RedFlagDetector(RedFlagRuleSet ruleSet) {
        this.ruleSet = ruleSet;
    }

    /**
     * Returns the highest-severity match on a user message, or empty when no rule fires.
     */
    public Optional<RedFlagMatch> detect(String text) {
        return strongest(text, RuleScope::coversUser);
    }

    /**
     * Checks a drafted answer. Only answer-scoped rules run, and sentences that
     * merely list warning signs to watch for are skipped, so ordinary safety advice
     * is not mistaken for an urgent finding.
     */
    public Optional<RedFlagMatch> detectInAnswer(String text) {
        return strongest(assertedText(text), RuleScope::coversAnswer);
    }

    /**
     * Every rule that fires on a user message, in declaration order. Used for summaries and audit.
     */
    public List<RedFlagMatch> detectAll(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        List<RedFlagMatch> matches = new ArrayList<>();
        for (RedFlagRule rule : ruleSet.getRules()) {
            if (!rule.scope().coversUser()) continue;
            String fragment = rule.evaluate(text);
            if (fragment != null) {
                matches.add(toMatch(rule, fragment));
            }
        }
        return matches;
    }

    private Optional<RedFlagMatch> strongest(String text, Predicate<RuleScope> applies) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        RedFlagMatch best = null;
        for (RedFlagRule rule : ruleSet.getRules()) {
            if (!applies.test(rule.scope())) continue;
            String fragment = rule.evaluate(text);
            if (fragment == null) continue;
            // strictly above: equal severity keeps the earlier rule
            if (best == null || rule.severity().isAbove(best.severity())) {
                best = toMatch(rule, fragment);
            }
        }

        if (best != null) {
            log.debug("Red flag detected: rule={} severity={}", best.ruleId(), best.severity());
        }
        return Optional.ofNullable(best);
    }

    /**
     * The answer with advisory sentences removed.
     */
    String assertedText(String text) {
        if (text == null) {
            return null;
        }
        StringBuilder kept = new StringBuilder();
        for (String sentence : SENTENCE_BREAK.split(text)) {
            if (!sentence.isBlank() && !ruleSet.isAdvisory(sentence)) {
                kept.append(sentence.strip()).append('\n');
            }
        }
        return kept.toString();
    }

    public RedFlagRuleSet getRuleSet() {
        return ruleSet;
    }

    private static RedFlagMatch toMatch(RedFlagRule rule, String fragment) {
        String escalation = rule.escalationTemplate().replace(MATCHED_PLACEHOLDER, fragment);
        return new RedFlagMatch(rule.id(), rule.label(), rule.severity(), fragment, escalation);
    }
}
