package com.eainde.patientqa.provider;

public enum ProviderType {
    /** Hosted Claude models through the Anthropic API. */
    ANTHROPIC,
    /** Local models served by Ollama. */
    OLLAMA
}
