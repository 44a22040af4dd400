package com.eainde.patientqa.provider;

import com.eainde.patientqa.prompt.PromptPayload;

/**
 * Capability to turn a composed prompt into text. Each backend (hosted Claude,
 * local Ollama model, test double) is a separate implementation chosen by
 * configuration.
 */
public interface LanguageModelProvider {

    /** Identifier of the model configuration behind this provider. */
    String id();

    /**
     * @return non-blank generated text
     * @throws ProviderException on network, auth, rate-limit or empty-output failures
     */
    String generate(PromptPayload prompt, GenerationOptions options);
}
