package com.eainde.patientqa.evaluation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-level cancellation signal. Once cancelled, no new pairs are scheduled;
 * pairs already in flight finish on their own.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
