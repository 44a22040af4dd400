package com.eainde.patientqa.provider;

import com.eainde.patientqa.PatientQaException;

/**
 * Failure reported by a language-model provider: network, auth, rate limit, timeout.
 * {@link #isRetryable()} tells the caller whether another attempt may succeed.
 */
public class ProviderException extends PatientQaException {

    private final boolean retryable;

    public ProviderException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ProviderException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static ProviderException retryable(String message, Throwable cause) {
        return new ProviderException(message, cause, true);
    }

    public static ProviderException fatal(String message, Throwable cause) {
        return new ProviderException(message, cause, false);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
