package com.eainde.patientqa.evaluation;

import com.eainde.patientqa.review.VerdictDiscrepancy;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate report for a {@link TestRun}. Failed, unscored and skipped pairs are
 * itemized and kept out of pass-rate denominators.
 */
public record RunReport(
        @JsonProperty("runId")                 String runId,
        @JsonProperty("status")                RunStatus status,
        @JsonProperty("startedAt")             Instant startedAt,
        @JsonProperty("completedAt")           Instant completedAt,
        @JsonProperty("totalPairs")            int totalPairs,
        @JsonProperty("configs")               Map<String, ConfigSummary> configs,
        @JsonProperty("byCategory")            Map<String, CategoryStat> byCategory,
        @JsonProperty("redFlagsMissed")        List<PairKey> redFlagsMissed,
        @JsonProperty("unscored")              List<PairKey> unscored,
        @JsonProperty("failures")              List<Failure> failures,
        @JsonProperty("skipped")               List<PairKey> skipped,
        @JsonProperty("humanOverrides")        int humanOverrides,
        @JsonProperty("discrepancies")         List<VerdictDiscrepancy> discrepancies,
        @JsonProperty("judgeOverestimateRate") double judgeOverestimateRate
) {

    public record Failure(
            @JsonProperty("pair")   PairKey pair,
            @JsonProperty("reason") String reason
    ) {}
}
