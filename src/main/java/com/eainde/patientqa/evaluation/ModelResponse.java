package com.eainde.patientqa.evaluation;

import com.eainde.patientqa.redflag.Severity;
import com.eainde.patientqa.retrieval.RetrievedChunk;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of one (case, configuration) pair. A non-null {@code failure} marks the
 * pair as failed; such entries are reported but never judged.
 *
 * @param caseId        case id
 * @param configId      model configuration id
 * @param text          answer to the evaluated question, may be a fallback or empty on failure
 * @param chunks        retrieved chunks used for the evaluated answer
 * @param latencyMs     wall time for the whole case, all turns included
 * @param redFlag       whether any turn of the case was flagged, on the question or the answer
 * @param questionRedFlag whether the detector flagged one of the case's questions
 * @param severity      highest severity raised, null when not flagged
 * @param redFlagRuleId rule behind {@code severity}
 * @param failure       failure marker, null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelResponse(
        @JsonProperty("caseId")        String caseId,
        @JsonProperty("configId")      String configId,
        @JsonProperty("text")          String text,
        @JsonProperty("chunks")        List<RetrievedChunk> chunks,
        @JsonProperty("latencyMs")     long latencyMs,
        @JsonProperty("redFlag")       boolean redFlag,
        @JsonProperty("questionRedFlag") boolean questionRedFlag,
        @JsonProperty("severity")      Severity severity,
        @JsonProperty("redFlagRuleId") String redFlagRuleId,
        @JsonProperty("failure")       String failure
) {

    public ModelResponse {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public static ModelResponse failed(String caseId, String configId, String text, long latencyMs, String failure) {
        return new ModelResponse(caseId, configId, text, List.of(), latencyMs, false, false, null, null, failure);
    }

    @JsonIgnore
    public boolean isFailed() {
        return failure != null;
    }

    @JsonIgnore
    public PairKey key() {
        return new PairKey(caseId, configId);
    }
}
