package com.eainde.patientqa.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link RetrievalIndex} backed by a LangChain4j {@link EmbeddingStore}.
 *
 * <p>The query is embedded with the same model used at ingestion time and the
 * top-k matches above {@code minScore} are returned. The source id is read from
 * segment metadata ({@code source}, then {@code file_name}).</p>
 */
public class EmbeddingStoreRetrievalIndex implements RetrievalIndex {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingStoreRetrievalIndex.class);

    static final String UNKNOWN_SOURCE = "unknown";

    private final EmbeddingStore<TextSegment> embeddingStore;
    private final EmbeddingModel embeddingModel;
    private final double minScore;

    public EmbeddingStoreRetrievalIndex(EmbeddingStore<TextSegment> embeddingStore,
                                        EmbeddingModel embeddingModel,
                                        double minScore) {
        this.embeddingStore = embeddingStore;
        this.embeddingModel = embeddingModel;
        this.minScore = minScore;
    }

    @Override
    public List<RetrievedChunk> search(String query, int k) {
        if (query == null || query.isBlank() || k <= 0) {
            return List.of();
        }
        try {
            Embedding queryEmbedding = embeddingModel.embed(query).content();
            EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                    .queryEmbedding(queryEmbedding)
                    .maxResults(k)
                    .minScore(minScore)
                    .build();

            List<RetrievedChunk> chunks = embeddingStore.search(request).matches().stream()
                    .filter(match -> match.embedded() != null)
                    .map(EmbeddingStoreRetrievalIndex::toChunk)
                    .toList();

            log.debug("Retrieved {} chunks (k={}, minScore={})", chunks.size(), k, minScore);
            return chunks;
        } catch (RuntimeException e) {
            throw new RetrievalException("Embedding store search failed", e);
        }
    }

    private static RetrievedChunk toChunk(EmbeddingMatch<TextSegment> match) {
        TextSegment segment = match.embedded();
        String source = segment.metadata().getString("source");
        if (source == null) {
            source = segment.metadata().getString("file_name");
        }
        return new RetrievedChunk(source != null ? source : UNKNOWN_SOURCE, segment.text(), match.score());
    }
}
