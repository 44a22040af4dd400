package com.eainde.patientqa.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A span of curated source text surfaced by similarity search.
 * Lives for one generation call only; never persisted with a message.
 *
 * @param sourceId source document id
 * @param text     the chunk text
 * @param score    relevance score, higher is more relevant
 */
public record RetrievedChunk(
        @JsonProperty("sourceId") String sourceId,
        @JsonProperty("text")     String text,
        @JsonProperty("score")    double score
) {

    /** Key used to collapse duplicate spans of the same source. */
    public String spanKey() {
        return sourceId + '\u0000' + (text == null ? "" : text.strip());
    }
}
