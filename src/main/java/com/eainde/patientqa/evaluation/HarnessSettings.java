package com.eainde.patientqa.evaluation;

import com.eainde.patientqa.config.ConfigurationException;

import java.time.Duration;

/**
 * @param concurrency            maximum (case, configuration) pairs in flight
 * @param runTimeout             total-run budget; unscheduled pairs are skipped once it elapses
 * @param weakDimensionThreshold a dimension scoring below this counts as weak in reports
 */
public record HarnessSettings(int concurrency, Duration runTimeout, double weakDimensionThreshold) {

    public HarnessSettings {
        if (concurrency < 1) {
            throw new ConfigurationException("Harness concurrency must be at least 1 but was " + concurrency);
        }
        if (runTimeout == null || runTimeout.isNegative() || runTimeout.isZero()) {
            throw new ConfigurationException("Harness run timeout must be positive");
        }
    }

    public static HarnessSettings defaults() {
        return new HarnessSettings(2, Duration.ofMinutes(30), 60);
    }
}
