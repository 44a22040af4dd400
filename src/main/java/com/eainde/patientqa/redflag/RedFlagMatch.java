package com.eainde.patientqa.redflag;

/**
 * Result of a positive red-flag classification.
 *
 * @param ruleId         id of the winning rule
 * @param label          symptom label of the winning rule
 * @param severity       severity of the winning rule
 * @param matchedText    fragment of the input that triggered the rule
 * @param escalationText rendered escalation notice
 */
public record RedFlagMatch(
        String ruleId,
        String label,
        Severity severity,
        String matchedText,
        String escalationText
) {}
