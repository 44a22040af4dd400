package com.eainde.patientqa.review;

import com.eainde.patientqa.evaluation.PairKey;
import com.eainde.patientqa.judge.Verdict;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Judge and human disagree on a pair.
 *
 * @param judgeOverestimated the judge's verdict was more favourable than the human's
 */
public record VerdictDiscrepancy(
        @JsonProperty("pair")               PairKey pair,
        @JsonProperty("judgeVerdict")       Verdict judgeVerdict,
        @JsonProperty("humanVerdict")       Verdict humanVerdict,
        @JsonProperty("judgeOverall")       Double judgeOverall,
        @JsonProperty("reviewerId")         String reviewerId,
        @JsonProperty("judgeOverestimated") boolean judgeOverestimated
) {}
