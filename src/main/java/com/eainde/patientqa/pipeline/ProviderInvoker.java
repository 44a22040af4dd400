package com.eainde.patientqa.pipeline;

import com.eainde.patientqa.prompt.PromptPayload;
import com.eainde.patientqa.provider.GenerationOptions;
import com.eainde.patientqa.provider.LanguageModelProvider;
import com.eainde.patientqa.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls a provider with a per-call timeout and retries retryable failures with
 * exponential backoff. Non-retryable failures stop immediately.
 */
public class ProviderInvoker {

    private static final Logger log = LoggerFactory.getLogger(ProviderInvoker.class);

    private final RetryPolicy policy;
    private final Executor callExecutor;

    /**
     * @param callExecutor runs calls when a call timeout is configured; may be null otherwise
     */
    public ProviderInvoker(RetryPolicy policy, Executor callExecutor) {
        this.policy = policy;
        this.callExecutor = callExecutor;
        if (policy.hasCallTimeout() && callExecutor == null) {
            throw new IllegalArgumentException("A call executor is required when a call timeout is set");
        }
    }

    /**
     * @throws GenerationException when attempts are exhausted or the error is not retryable
     */
    public String invoke(LanguageModelProvider provider, PromptPayload prompt, GenerationOptions options) {
        ProviderException last = null;
        int attempt = 0;
        while (attempt < policy.maxAttempts()) {
            attempt++;
            try {
                return call(provider, prompt, options);
            } catch (ProviderException e) {
                last = e;
                log.warn("Attempt {}/{} on {} failed: {}", attempt, policy.maxAttempts(), provider.id(), e.getMessage());
                if (!e.isRetryable()) {
                    break;
                }
                if (attempt < policy.maxAttempts()) {
                    sleep(policy.backoffAfter(attempt), attempt, last);
                }
            }
        }
        throw new GenerationException("Provider " + provider.id() + " failed after " + attempt + " attempt(s)",
                last, attempt);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private String call(LanguageModelProvider provider, PromptPayload prompt, GenerationOptions options) {
        if (!policy.hasCallTimeout()) {
            return provider.generate(prompt, options);
        }
        CompletableFuture<String> future =
                CompletableFuture.supplyAsync(() -> provider.generate(prompt, options), callExecutor);
        try {
            return future.get(policy.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw ProviderException.retryable("Call to " + provider.id() + " timed out after "
                    + policy.callTimeout().toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException pe) {
                throw pe;
            }
            throw ProviderException.retryable("Call to " + provider.id() + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw ProviderException.fatal("Interrupted while waiting for " + provider.id(), e);
        }
    }

    private static void sleep(Duration backoff, int attempt, ProviderException last) {
        if (backoff.isZero()) return;
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted during retry backoff", last, attempt);
        }
    }
}
