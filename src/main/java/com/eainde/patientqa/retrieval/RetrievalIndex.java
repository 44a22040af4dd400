package com.eainde.patientqa.retrieval;

import java.util.List;

/**
 * Capability that returns the most relevant document chunks for a query.
 * The core does not care how the index is built or searched.
 */
public interface RetrievalIndex {

    /**
     * @param query free-text query, usually the patient's message
     * @param k     maximum number of chunks
     * @return chunks ordered by descending relevance, possibly empty
     * @throws RetrievalException when the index is unavailable
     */
    List<RetrievedChunk> search(String query, int k);
}
