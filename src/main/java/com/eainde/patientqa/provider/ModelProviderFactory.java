package com.eainde.patientqa.provider;

import com.eainde.patientqa.config.ConfigurationException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Builds a {@link LanguageModelProvider} for a {@link ModelConfig}.
 *
 * <p>The underlying clients run with retries disabled; retry and backoff are
 * owned by the response generator so every provider behaves the same.</p>
 */
@Slf4j
public class ModelProviderFactory {

    private final Duration callTimeout;

    public ModelProviderFactory(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public LanguageModelProvider create(ModelConfig config) {
        validate(config);
        log.info("Building {} provider '{}' (model={})", config.provider(), config.id(), config.modelName());
        return new ChatModelProvider(config.id(), buildChatModel(config));
    }

    /**
     * Ollama embedding model for the retrieval index, bound by the same per-call timeout as chat models.
     */
    public EmbeddingModel createEmbeddingModel(String baseUrl, String modelName) {
        if (baseUrl == null || baseUrl.isBlank() || modelName == null || modelName.isBlank()) {
            throw new ConfigurationException("Embedding model needs a baseUrl and a model name");
        }
        log.info("Building Ollama embedding model {} at {} (timeout={})", modelName, baseUrl, callTimeout);
        return OllamaEmbeddingModel.builder()
                .baseUrl(baseUrl)
                .modelName(modelName)
                .timeout(callTimeout)
                .build();
    }

    ChatModel buildChatModel(ModelConfig config) {
        List<ChatModelListener> listeners = List.of(new LoggingChatModelListener(config.id()));

        return switch (config.provider()) {
            case ANTHROPIC -> {
                var builder = AnthropicChatModel.builder()
                        .apiKey(config.apiKey())
                        .modelName(config.modelName())
                        .temperature(config.temperature())
                        .maxTokens(config.maxOutputTokens())
                        .timeout(callTimeout)
                        .maxRetries(0)
                        .listeners(listeners);
                if (config.baseUrl() != null) {
                    builder.baseUrl(config.baseUrl());
                }
                yield builder.build();
            }
            case OLLAMA -> OllamaChatModel.builder()
                    .baseUrl(config.baseUrl())
                    .modelName(config.modelName())
                    .temperature(config.temperature())
                    .numPredict(config.maxOutputTokens())
                    .timeout(callTimeout)
                    .maxRetries(0)
                    .listeners(listeners)
                    .build();
        };
    }

    static void validate(ModelConfig config) {
        if (config.id() == null || config.id().isBlank()) {
            throw new ConfigurationException("Model configuration without id");
        }
        if (config.provider() == null) {
            throw new ConfigurationException("Model '" + config.id() + "' has no provider");
        }
        if (config.modelName() == null || config.modelName().isBlank()) {
            throw new ConfigurationException("Model '" + config.id() + "' has no modelName");
        }
        if (config.provider() == ProviderType.ANTHROPIC && (config.apiKey() == null || config.apiKey().isBlank())) {
            throw new ConfigurationException("Model '" + config.id() + "' needs an Anthropic API key");
        }
        if (config.provider() == ProviderType.OLLAMA && (config.baseUrl() == null || config.baseUrl().isBlank())) {
            throw new ConfigurationException("Model '" + config.id() + "' needs an Ollama baseUrl");
        }
    }
}
