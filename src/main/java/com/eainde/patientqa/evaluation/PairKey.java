package com.eainde.patientqa.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identifies one (case, model configuration) pair within a run.
 */
public record PairKey(
        @JsonProperty("caseId")   String caseId,
        @JsonProperty("configId") String configId
) {

    @Override
    public String toString() {
        return caseId + "/" + configId;
    }
}
