package com.eainde.patientqa.evaluation;

import com.eainde.patientqa.memory.ConversationMemoryStore;
import com.eainde.patientqa.pipeline.ResponseGenerator;
import com.eainde.patientqa.provider.ModelConfig;

/**
 * Builds the response pipeline for one candidate configuration, bound to a
 * memory store owned by a single (case, configuration) pair.
 */
@FunctionalInterface
public interface GeneratorFactory {

    ResponseGenerator create(ModelConfig config, ConversationMemoryStore memory);

    /**
     * Builds whatever {@code config} needs up front, before any pair runs.
     *
     * @throws com.eainde.patientqa.config.ConfigurationException when the configuration cannot be used
     */
    default void prepare(ModelConfig config) {
    }
}
