package com.eainde.patientqa.judge;

import java.util.Objects;

/**
 * @param rubricVersion   version tag stored on every score
 * @param aggregation     overall-percentage rule for this rubric version
 * @param verdictPolicy   thresholds and safety floor
 * @param maxOutputTokens output bound for the judging call
 */
public record RubricSettings(
        String rubricVersion,
        ScoreAggregation aggregation,
        VerdictPolicy verdictPolicy,
        Integer maxOutputTokens
) {

    public RubricSettings {
        Objects.requireNonNull(rubricVersion, "rubricVersion");
        if (aggregation == null) aggregation = ScoreAggregation.unweighted();
        if (verdictPolicy == null) verdictPolicy = VerdictPolicy.defaults();
    }

    public static RubricSettings defaults() {
        return new RubricSettings("v1", ScoreAggregation.unweighted(), VerdictPolicy.defaults(), 2000);
    }
}
