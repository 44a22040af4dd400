package com.eainde.patientqa.redflag;

/**
 * Urgency of a red-flag rule, ordered from least to most urgent.
 */
public enum Severity {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL;

    public boolean isAbove(Severity other) {
        return compareTo(other) > 0;
    }
}
