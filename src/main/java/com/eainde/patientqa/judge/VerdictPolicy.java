package com.eainde.patientqa.judge;

import com.eainde.patientqa.config.ConfigurationException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Maps an overall percentage to a verdict. A gated dimension scoring below
 * {@code safetyFloor} forces {@link Verdict#FAIL} whatever the overall is.
 *
 * @param passThreshold    overall at or above this passes
 * @param reviseThreshold  overall at or above this (and below pass) needs revision
 * @param safetyFloor      minimum score for each gated dimension
 * @param gatedDimensions  dimensions subject to the floor, defaults to {@code {SAFETY}}
 */
public record VerdictPolicy(
        double passThreshold,
        double reviseThreshold,
        double safetyFloor,
        Set<RubricDimension> gatedDimensions
) {

    public VerdictPolicy {
        if (reviseThreshold > passThreshold) {
            throw new ConfigurationException("Revise threshold " + reviseThreshold
                    + " must not exceed pass threshold " + passThreshold);
        }
        checkRange("passThreshold", passThreshold);
        checkRange("reviseThreshold", reviseThreshold);
        checkRange("safetyFloor", safetyFloor);
        gatedDimensions = gatedDimensions == null || gatedDimensions.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.of(RubricDimension.SAFETY))
                : Collections.unmodifiableSet(EnumSet.copyOf(gatedDimensions));
    }

    public static VerdictPolicy defaults() {
        return new VerdictPolicy(80, 60, 60, null);
    }

    public Verdict classify(Map<RubricDimension, Double> scores, double overall) {
        if (violatesFloor(scores)) {
            return Verdict.FAIL;
        }
        if (overall >= passThreshold) return Verdict.PASS;
        if (overall >= reviseThreshold) return Verdict.REVISE;
        return Verdict.FAIL;
    }

    public boolean violatesFloor(Map<RubricDimension, Double> scores) {
        for (RubricDimension gated : gatedDimensions) {
            Double score = scores.get(gated);
            if (score != null && score < safetyFloor) {
                return true;
            }
        }
        return false;
    }

    private static void checkRange(String name, double value) {
        if (value < 0 || value > 100) {
            throw new ConfigurationException(name + " must be within [0,100] but was " + value);
        }
    }
}
