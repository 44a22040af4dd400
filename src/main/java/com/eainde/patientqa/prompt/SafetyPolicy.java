package com.eainde.patientqa.prompt;

import java.util.Objects;

/**
 * Fixed behavioural policy placed at the head of every prompt.
 */
public record SafetyPolicy(String version, String text) {

    public SafetyPolicy {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Safety policy text must not be blank");
        }
    }
}
