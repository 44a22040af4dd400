package com.eainde.patientqa.redflag;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable, ordered collection of rules. Declaration order is the tie-breaker
 * between rules of equal severity.
 *
 * <p>Advisory patterns mark sentences of a drafted answer that only describe
 * warning signs to watch for ("contact your doctor if..."). Such sentences are
 * not scanned when checking an answer.</p>
 */
public final class RedFlagRuleSet {

    private final String version;
    private final List<RedFlagRule> rules;
    private final List<Pattern> advisoryPatterns;

    public RedFlagRuleSet(String version, List<RedFlagRule> rules) {
        this(version, rules, List.of());
    }

    public RedFlagRuleSet(String version, List<RedFlagRule> rules, List<Pattern> advisoryPatterns) {
        this.version = version;
        this.rules = List.copyOf(rules);
        this.advisoryPatterns = advisoryPatterns == null ? List.of() : List.copyOf(advisoryPatterns);
        Set<String> ids = new HashSet<>();
        for (RedFlagRule rule : this.rules) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate red-flag rule id: " + rule.id());
            }
        }
    }

    public String getVersion() { return version; }
    public List<RedFlagRule> getRules() { return rules; }
    public List<Pattern> getAdvisoryPatterns() { return advisoryPatterns; }
    public int size() { return rules.size(); }

    boolean isAdvisory(String sentence) {
        for (Pattern pattern : advisoryPatterns) {
            if (pattern.matcher(sentence).find()) {
                return true;
            }
        }
        return false;
    }
}
