package com.eainde.patientqa.provider;

/**
 * Per-call sampling options. Null fields fall back to the model's defaults.
 *
 * @param temperature     sampling temperature
 * @param maxOutputTokens upper bound on generated tokens
 */
public record GenerationOptions(Double temperature, Integer maxOutputTokens) {

    public static GenerationOptions defaults() {
        return new GenerationOptions(null, null);
    }

    /** Temperature 0 for reproducible judging. */
    public static GenerationOptions deterministic(Integer maxOutputTokens) {
        return new GenerationOptions(0.0, maxOutputTokens);
    }
}
