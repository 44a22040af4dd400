package com.eainde.patientqa.provider;

/**
 * One candidate model configuration.
 *
 * @param id              stable id used in reports, e.g. {@code claude-sonnet}
 * @param provider        backend variant
 * @param modelName       provider-specific model name
 * @param temperature     default sampling temperature
 * @param maxOutputTokens default output bound
 * @param baseUrl         endpoint override (required for Ollama)
 * @param apiKey          credential (required for Anthropic)
 */
public record ModelConfig(
        String id,
        ProviderType provider,
        String modelName,
        Double temperature,
        Integer maxOutputTokens,
        String baseUrl,
        String apiKey
) {

    public GenerationOptions options() {
        return new GenerationOptions(temperature, maxOutputTokens);
    }

    @Override
    public String toString() {
        return "ModelConfig[id=" + id + ", provider=" + provider + ", modelName=" + modelName
                + ", temperature=" + temperature + ", maxOutputTokens=" + maxOutputTokens
                + ", baseUrl=" + baseUrl + ", apiKey=" + (apiKey == null ? "null" : "****") + "]";
    }
}
