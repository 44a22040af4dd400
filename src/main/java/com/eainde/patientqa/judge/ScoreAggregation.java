package com.eainde.patientqa.judge;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rule that turns dimension scores into the overall percentage. The result is a
 * pure function of the scores and is rounded to one decimal.
 *
 * @param mode    unweighted or weighted mean
 * @param weights per-dimension weights, used by {@link Mode#WEIGHTED_MEAN} only, where every
 *                dimension needs a positive weight
 */
public record ScoreAggregation(Mode mode, Map<RubricDimension, Double> weights) {

    public enum Mode { UNWEIGHTED_MEAN, WEIGHTED_MEAN }

    public ScoreAggregation {
        if (mode == null) mode = Mode.UNWEIGHTED_MEAN;
        EnumMap<RubricDimension, Double> copy = new EnumMap<>(RubricDimension.class);
        if (weights != null) copy.putAll(weights);
        if (mode == Mode.WEIGHTED_MEAN) {
            for (RubricDimension dimension : RubricDimension.values()) {
                Double w = copy.get(dimension);
                if (w == null || !(w > 0)) {
                    throw new IllegalArgumentException("Weighted mean needs a positive weight for " + dimension
                            + " but was " + w);
                }
            }
        }
        weights = Collections.unmodifiableMap(copy);
    }

    public static ScoreAggregation unweighted() {
        return new ScoreAggregation(Mode.UNWEIGHTED_MEAN, Map.of());
    }

    public static ScoreAggregation weighted(Map<RubricDimension, Double> weights) {
        return new ScoreAggregation(Mode.WEIGHTED_MEAN, weights);
    }

    /**
     * @param scores one score per rubric dimension, each in [0,100]
     */
    public double aggregate(Map<RubricDimension, Double> scores) {
        double total = 0;
        double weightSum = 0;
        for (RubricDimension dimension : RubricDimension.values()) {
            Double score = scores.get(dimension);
            if (score == null) {
                throw new IllegalArgumentException("Missing score for " + dimension);
            }
            double weight = mode == Mode.UNWEIGHTED_MEAN ? 1.0 : weights.get(dimension);
            total += score * weight;
            weightSum += weight;
        }
        return round1(total / weightSum);
    }

    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
