package com.eainde.patientqa.pipeline;

import com.eainde.patientqa.redflag.RedFlagMatch;
import com.eainde.patientqa.redflag.Severity;
import com.eainde.patientqa.retrieval.RetrievedChunk;

import java.util.List;

/**
 * Outcome of one user turn.
 *
 * @param sessionId         session the turn belongs to
 * @param answer            final answer shown to the user, escalations included
 * @param preCheck          red flag raised on the user message, or null
 * @param postCheck         red flag raised on the drafted answer, or null
 * @param escalations       escalation notices appended to the answer, in order
 * @param chunks            retrieved chunks that made it into the prompt
 * @param retrievalDegraded retrieval failed and the turn ran without reference material
 * @param fallback          generation failed and {@code answer} is the safe fallback
 * @param failureReason     why generation failed, null on success
 * @param persisted         both messages were written to durable storage
 * @param states            visited states in order
 * @param latencyMs         wall time of the whole turn
 */
public record TurnResult(
        String sessionId,
        String answer,
        RedFlagMatch preCheck,
        RedFlagMatch postCheck,
        List<String> escalations,
        List<RetrievedChunk> chunks,
        boolean retrievalDegraded,
        boolean fallback,
        String failureReason,
        boolean persisted,
        List<TurnState> states,
        long latencyMs
) {

    public TurnResult {
        escalations = List.copyOf(escalations);
        chunks = List.copyOf(chunks);
        states = List.copyOf(states);
    }

    public boolean redFlag() {
        return preCheck != null || postCheck != null;
    }

    /** Highest severity across both checkpoints; the pre-check wins ties. */
    public RedFlagMatch strongestMatch() {
        if (preCheck == null) return postCheck;
        if (postCheck == null) return preCheck;
        return postCheck.severity().isAbove(preCheck.severity()) ? postCheck : preCheck;
    }

    public Severity severity() {
        RedFlagMatch strongest = strongestMatch();
        return strongest == null ? null : strongest.severity();
    }
}
