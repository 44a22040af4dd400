package com.eainde.patientqa.redflag;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single emergency symptom pattern.
 *
 * <p>The rule fires when <b>every</b> pattern in {@code allOf} finds a match in the
 * text (case-insensitive). The escalation template may contain {@code {matched}},
 * replaced with the text matched by the first pattern.</p>
 *
 * <p>{@code scope} limits the rule to user messages, drafted answers or both.
 * Symptoms a patient reports about themselves (fever, weight loss, worsening) are
 * user-only, since an answer naturally mentions them as warning signs.</p>
 *
 * @param id                 stable identifier, e.g. {@code heavy-bleeding-dizziness}
 * @param label              short human-readable symptom description
 * @param allOf              regex patterns that must all match
 * @param severity           urgency of the rule
 * @param escalationTemplate escalation notice shown to the patient
 * @param scope              which side of the turn the rule applies to, {@link RuleScope#BOTH} when null
 */
public record RedFlagRule(
        String id,
        String label,
        List<Pattern> allOf,
        Severity severity,
        String escalationTemplate,
        RuleScope scope
) {

    public RedFlagRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(severity, "severity for rule " + id);
        Objects.requireNonNull(escalationTemplate, "escalationTemplate for rule " + id);
        if (allOf == null || allOf.isEmpty()) {
            throw new IllegalArgumentException("Rule " + id + " needs at least one pattern");
        }
        allOf = List.copyOf(allOf);
        scope = scope == null ? RuleScope.BOTH : scope;
    }

    public static RedFlagRule of(String id, String label, Severity severity,
                                 String escalationTemplate, String... regexes) {
        return of(id, label, severity, RuleScope.BOTH, escalationTemplate, regexes);
    }

    public static RedFlagRule of(String id, String label, Severity severity, RuleScope scope,
                                 String escalationTemplate, String... regexes) {
        List<Pattern> compiled = Arrays.stream(regexes)
                .map(RedFlagRule::compile)
                .toList();
        return new RedFlagRule(id, label, compiled, severity, escalationTemplate, scope);
    }

    static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /**
     * Evaluates this rule against the text.
     *
     * @return the matched fragment of the first pattern, or {@code null} when the rule does not fire
     */
    String evaluate(String text) {
        String firstFragment = null;
        for (Pattern pattern : allOf) {
            Matcher m = pattern.matcher(text);
            if (!m.find()) {
                return null;
            }
            if (firstFragment == null) {
                firstFragment = m.group();
            }
        }
        return firstFragment;
    }
}
