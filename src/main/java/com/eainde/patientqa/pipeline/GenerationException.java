package com.eainde.patientqa.pipeline;

import com.eainde.patientqa.PatientQaException;

/**
 * Generation failed after the retry budget was spent, or on a non-retryable
 * provider error.
 */
public class GenerationException extends PatientQaException {

    private final int attempts;

    public GenerationException(String message, Throwable cause, int attempts) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
