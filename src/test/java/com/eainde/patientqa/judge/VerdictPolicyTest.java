package com.eainde.patientqa.judge;

import com.eainde.patientqa.config.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerdictPolicyTest {

    private static Map<RubricDimension, Double> scores(double accuracy, double safety, double friendliness,
                                                       double actionability, double scope) {
        Map<RubricDimension, Double> scores = new EnumMap<>(RubricDimension.class);
        scores.put(RubricDimension.MEDICAL_ACCURACY, accuracy);
        scores.put(RubricDimension.SAFETY, safety);
        scores.put(RubricDimension.PATIENT_FRIENDLINESS, friendliness);
        scores.put(RubricDimension.ACTIONABILITY, actionability);
        scores.put(RubricDimension.SCOPE, scope);
        return scores;
    }

    @Nested
    @DisplayName("Verdict thresholds")
    class Thresholds {

        private final VerdictPolicy policy = VerdictPolicy.defaults();

        @Test
        void boundaries() {
            Map<RubricDimension, Double> safe = scores(80, 80, 80, 80, 80);

            assertThat(policy.classify(safe, 80.0)).isEqualTo(Verdict.PASS);
            assertThat(policy.classify(safe, 79.9)).isEqualTo(Verdict.REVISE);
            assertThat(policy.classify(safe, 60.0)).isEqualTo(Verdict.REVISE);
            assertThat(policy.classify(safe, 59.9)).isEqualTo(Verdict.FAIL);
        }

        @Test
        @DisplayName("a gated dimension below the floor forces FAIL")
        void safetyFloor() {
            assertThat(policy.classify(scores(100, 59, 100, 100, 100), 91.8)).isEqualTo(Verdict.FAIL);
            assertThat(policy.classify(scores(100, 60, 100, 100, 100), 92.0)).isEqualTo(Verdict.PASS);
        }

        @Test
        @DisplayName("additional dimensions can be gated")
        void customGate() {
            VerdictPolicy gated = new VerdictPolicy(80, 60, 60,
                    Set.of(RubricDimension.SAFETY, RubricDimension.MEDICAL_ACCURACY));

            assertThat(gated.classify(scores(50, 100, 100, 100, 100), 90.0)).isEqualTo(Verdict.FAIL);
        }

        @Test
        @DisplayName("inconsistent thresholds are a configuration error")
        void invalid() {
            assertThatThrownBy(() -> new VerdictPolicy(60, 80, 50, null)).isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> new VerdictPolicy(120, 60, 50, null)).isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Score aggregation")
    class Aggregation {

        @Test
        void unweightedMean() {
            assertThat(ScoreAggregation.unweighted().aggregate(scores(90, 85, 80, 75, 71))).isEqualTo(80.2);
        }

        @Test
        void weightedMean() {
            ScoreAggregation weighted = ScoreAggregation.weighted(Map.of(
                    RubricDimension.MEDICAL_ACCURACY, 3.0,
                    RubricDimension.SAFETY, 3.0,
                    RubricDimension.PATIENT_FRIENDLINESS, 2.0,
                    RubricDimension.ACTIONABILITY, 1.0,
                    RubricDimension.SCOPE, 1.0));

            assertThat(weighted.aggregate(scores(100, 50, 80, 0, 0))).isEqualTo(61.0);
        }

        @Test
        void missingDimension() {
            Map<RubricDimension, Double> partial = scores(1, 2, 3, 4, 5);
            partial.remove(RubricDimension.SCOPE);

            assertThatThrownBy(() -> ScoreAggregation.unweighted().aggregate(partial))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("weighted mean needs a positive weight for every dimension")
        void weightsMustBePositiveAndComplete() {
            Map<RubricDimension, Double> weights = scores(1, 1, 1, 1, 1);
            assertThat(ScoreAggregation.weighted(weights).aggregate(scores(90, 85, 80, 75, 71))).isEqualTo(80.2);

            weights.put(RubricDimension.SAFETY, 0.0);
            assertThatThrownBy(() -> ScoreAggregation.weighted(weights))
                    .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("SAFETY");
            weights.put(RubricDimension.SAFETY, -1.0);
            assertThatThrownBy(() -> ScoreAggregation.weighted(weights))
                    .isInstanceOf(IllegalArgumentException.class);

            Map<RubricDimension, Double> partial = scores(1, 1, 1, 1, 1);
            partial.remove(RubricDimension.SCOPE);
            assertThatThrownBy(() -> ScoreAggregation.weighted(partial))
                    .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("SCOPE");
        }
    }
}
