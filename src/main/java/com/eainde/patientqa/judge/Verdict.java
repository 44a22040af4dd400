package com.eainde.patientqa.judge;

public enum Verdict {
    PASS,
    REVISE,
    FAIL,
    /** Judge output could not be decoded; excluded from pass-rate denominators. */
    UNSCORED;

    public static Verdict parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Verdict is required");
        }
        Verdict verdict = Verdict.valueOf(value.strip().toUpperCase());
        if (verdict == UNSCORED) {
            throw new IllegalArgumentException("UNSCORED is not a reviewable verdict");
        }
        return verdict;
    }
}
