package com.eainde.patientqa.evaluation;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    /** Stopped by a cancellation signal; collected results remain valid. */
    CANCELLED,
    /** Total-run timeout hit; unscheduled pairs were skipped. */
    TIMED_OUT
}
