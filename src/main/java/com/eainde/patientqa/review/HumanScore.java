package com.eainde.patientqa.review;

import com.eainde.patientqa.judge.RubricDimension;
import com.eainde.patientqa.judge.Verdict;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Manual review of one (case, configuration) pair. Authoritative over the judge.
 *
 * @param caseId      case id
 * @param configId    model configuration id
 * @param reviewerId  who reviewed
 * @param scores      per-dimension scores in [0,100], may be partial
 * @param notes       free-text notes
 * @param verdict     PASS, REVISE or FAIL
 * @param submittedAt submission time
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HumanScore(
        @JsonProperty("caseId")      String caseId,
        @JsonProperty("configId")    String configId,
        @JsonProperty("reviewerId")  String reviewerId,
        @JsonProperty("scores")      Map<RubricDimension, Double> scores,
        @JsonProperty("notes")       String notes,
        @JsonProperty("verdict")     Verdict verdict,
        @JsonProperty("submittedAt") Instant submittedAt
) {

    public HumanScore {
        EnumMap<RubricDimension, Double> copy = new EnumMap<>(RubricDimension.class);
        if (scores != null) copy.putAll(scores);
        scores = Collections.unmodifiableMap(copy);
    }
}
