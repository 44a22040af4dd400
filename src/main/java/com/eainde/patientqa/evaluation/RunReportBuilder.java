package com.eainde.patientqa.evaluation;

import com.eainde.patientqa.judge.JudgeScore;
import com.eainde.patientqa.judge.RubricDimension;
import com.eainde.patientqa.judge.Verdict;
import com.eainde.patientqa.review.HumanReviewService;
import com.eainde.patientqa.review.ReconciledVerdict;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Computes a {@link RunReport} from a run. Verdicts are reconciled first, so a
 * human review replaces the judge's verdict in every pass rate. Red flags missed
 * are counted over completed responses regardless of verdict, and only the check
 * on the patient's questions counts as detection.
 */
public class RunReportBuilder {

    static final List<String> BUCKETS = List.of("90-100", "80-89", "70-79", "60-69", "<60");

    private final double weakDimensionThreshold;

    public RunReportBuilder(double weakDimensionThreshold) {
        this.weakDimensionThreshold = weakDimensionThreshold;
    }

    public RunReport build(TestRun run) {
        HumanReviewService review = new HumanReviewService(run);

        Map<String, ConfigAccumulator> perConfig = new LinkedHashMap<>();
        for (String configId : run.getConfigIds()) {
            perConfig.put(configId, new ConfigAccumulator(configId));
        }
        Map<String, int[]> byCategory = new TreeMap<>();
        List<PairKey> redFlagsMissed = new ArrayList<>();
        List<PairKey> unscored = new ArrayList<>();
        List<RunReport.Failure> failures = new ArrayList<>();
        int humanOverrides = 0;

        for (ModelResponse response : run.getResponses()) {
            ConfigAccumulator acc = perConfig.computeIfAbsent(response.configId(), ConfigAccumulator::new);
            Optional<EvaluationCase> evaluationCase = run.findCase(response.caseId());
            String category = evaluationCase.map(c -> c.category().getLabel()).orElse("unknown");

            if (response.isFailed()) {
                failures.add(new RunReport.Failure(response.key(), response.failure()));
                acc.failures++;
                continue;
            }
            acc.latencies.add(response.latencyMs());

            if (evaluationCase.isPresent() && evaluationCase.get().expectsRedFlag() && !response.questionRedFlag()) {
                redFlagsMissed.add(response.key());
                acc.redFlagsMissed++;
            }

            ReconciledVerdict reconciled = review.reconcile(response.caseId(), response.configId());
            if (reconciled.humanOverride()) {
                humanOverrides++;
            }
            Verdict verdict = reconciled.finalVerdict();
            if (verdict == null || verdict == Verdict.UNSCORED) {
                unscored.add(response.key());
                acc.verdicts.merge(Verdict.UNSCORED, 1, Integer::sum);
            } else {
                acc.verdicts.merge(verdict, 1, Integer::sum);
                boolean passed = verdict == Verdict.PASS;
                count(acc.byCategory, category, passed);
                count(acc.overall, "overall", passed);
                count(byCategory, category, passed);
            }

            run.findJudgeScore(response.caseId(), response.configId())
                    .filter(JudgeScore::isScored)
                    .ifPresent(acc::addJudgeScore);
        }

        Map<String, ConfigSummary> configs = new LinkedHashMap<>();
        perConfig.forEach((id, acc) -> configs.put(id, acc.summarize(weakDimensionThreshold)));

        int totalPairs = run.getCases().size() * run.getConfigIds().size();
        return new RunReport(run.getId(), run.getStatus(), run.getStartedAt(), run.getCompletedAt(), totalPairs,
                configs, toStats(byCategory), redFlagsMissed, unscored, failures, run.getSkipped(),
                humanOverrides, review.discrepancies(), review.judgeOverestimateRate());
    }

    static String bucketOf(double percentage) {
        if (percentage >= 90) return "90-100";
        if (percentage >= 80) return "80-89";
        if (percentage >= 70) return "70-79";
        if (percentage >= 60) return "60-69";
        return "<60";
    }

    private static void count(Map<String, int[]> counts, String key, boolean passed) {
        int[] c = counts.computeIfAbsent(key, k -> new int[2]);
        if (passed) c[0]++;
        c[1]++;
    }

    private static Map<String, CategoryStat> toStats(Map<String, int[]> counts) {
        Map<String, CategoryStat> stats = new TreeMap<>();
        counts.forEach((k, c) -> stats.put(k, CategoryStat.of(c[0], c[1])));
        return stats;
    }

    private static Double mean(List<? extends Number> values) {
        if (values.isEmpty()) return null;
        double sum = 0;
        for (Number v : values) sum += v.doubleValue();
        return Math.round(sum / values.size() * 10.0) / 10.0;
    }

    private static final class ConfigAccumulator {
        private final String configId;
        private final Map<String, int[]> overall = new TreeMap<>();
        private final Map<String, int[]> byCategory = new TreeMap<>();
        private final Map<Verdict, Integer> verdicts = new EnumMap<>(Verdict.class);
        private final List<Double> overallScores = new ArrayList<>();
        private final Map<RubricDimension, List<Double>> dimensionScores = new EnumMap<>(RubricDimension.class);
        private final List<Long> latencies = new ArrayList<>();
        private int redFlagsMissed;
        private int failures;

        ConfigAccumulator(String configId) {
            this.configId = configId;
        }

        void addJudgeScore(JudgeScore score) {
            overallScores.add(score.overallPercentage());
            score.scores().forEach((dimension, value) ->
                    dimensionScores.computeIfAbsent(dimension, d -> new ArrayList<>()).add(value));
        }

        ConfigSummary summarize(double weakThreshold) {
            Map<RubricDimension, Double> dimensionAverages = new EnumMap<>(RubricDimension.class);
            Map<RubricDimension, Integer> weak = new EnumMap<>(RubricDimension.class);
            dimensionScores.forEach((dimension, values) -> {
                dimensionAverages.put(dimension, mean(values));
                weak.put(dimension, (int) values.stream().filter(v -> v < weakThreshold).count());
            });

            Map<String, Integer> distribution = new LinkedHashMap<>();
            BUCKETS.forEach(b -> distribution.put(b, 0));
            overallScores.forEach(s -> distribution.merge(bucketOf(s), 1, Integer::sum));

            int[] o = overall.getOrDefault("overall", new int[2]);
            return new ConfigSummary(configId, CategoryStat.of(o[0], o[1]), toStats(byCategory),
                    mean(overallScores), dimensionAverages, distribution, verdicts, weak,
                    redFlagsMissed, failures, mean(latencies));
        }
    }
}
