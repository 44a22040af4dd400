package com.eainde.patientqa.judge;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Automated rubric score for one (case, configuration) pair.
 * An {@link Verdict#UNSCORED} score has no dimension scores and no overall.
 *
 * @param caseId            case id
 * @param configId          model configuration id
 * @param scores            per-dimension scores in [0,100]
 * @param overallPercentage aggregate of {@code scores}, null when unscored
 * @param verdict           derived verdict
 * @param rationale         judge rationale, or the reason the output was rejected
 * @param rubricVersion     rubric version used
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JudgeScore(
        @JsonProperty("caseId")            String caseId,
        @JsonProperty("configId")          String configId,
        @JsonProperty("scores")            Map<RubricDimension, Double> scores,
        @JsonProperty("overallPercentage") Double overallPercentage,
        @JsonProperty("verdict")           Verdict verdict,
        @JsonProperty("rationale")         String rationale,
        @JsonProperty("rubricVersion")     String rubricVersion
) {

    public JudgeScore {
        EnumMap<RubricDimension, Double> copy = new EnumMap<>(RubricDimension.class);
        if (scores != null) copy.putAll(scores);
        scores = Collections.unmodifiableMap(copy);
    }

    public static JudgeScore unscored(String caseId, String configId, String reason, String rubricVersion) {
        return new JudgeScore(caseId, configId, Map.of(), null, Verdict.UNSCORED, reason, rubricVersion);
    }

    @JsonIgnore
    public boolean isScored() {
        return verdict != Verdict.UNSCORED;
    }
}
