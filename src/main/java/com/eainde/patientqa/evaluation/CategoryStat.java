package com.eainde.patientqa.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pass count over pairs that received a verdict. {@code passRate} is null when nothing was scored.
 */
public record CategoryStat(
        @JsonProperty("passed")   int passed,
        @JsonProperty("scored")   int scored,
        @JsonProperty("passRate") Double passRate
) {

    static CategoryStat of(int passed, int scored) {
        return new CategoryStat(passed, scored, scored == 0 ? null : (double) passed / scored);
    }
}
