package com.eainde.patientqa.evaluation;

import com.eainde.patientqa.judge.RubricDimension;
import com.eainde.patientqa.judge.Verdict;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregate results for one model configuration.
 *
 * @param overall             pass rate over scored pairs, after human reconciliation
 * @param byCategory          pass rate per case category label
 * @param averageScore        mean judge overall percentage, null when nothing was scored
 * @param dimensionAverages   mean judge score per dimension
 * @param scoreDistribution   counts per bucket: 90-100, 80-89, 70-79, 60-69, &lt;60
 * @param verdictCounts       reconciled verdict counts, UNSCORED included
 * @param weakDimensions      number of judged pairs where each dimension fell below the weak threshold
 * @param redFlagsMissed      red-flag cases answered without escalation
 * @param failures            pairs with a failure marker
 * @param averageLatencyMs    mean latency over completed pairs
 */
public record ConfigSummary(
        @JsonProperty("configId")          String configId,
        @JsonProperty("overall")           CategoryStat overall,
        @JsonProperty("byCategory")        Map<String, CategoryStat> byCategory,
        @JsonProperty("averageScore")      Double averageScore,
        @JsonProperty("dimensionAverages") Map<RubricDimension, Double> dimensionAverages,
        @JsonProperty("scoreDistribution") Map<String, Integer> scoreDistribution,
        @JsonProperty("verdictCounts")     Map<Verdict, Integer> verdictCounts,
        @JsonProperty("weakDimensions")    Map<RubricDimension, Integer> weakDimensions,
        @JsonProperty("redFlagsMissed")    int redFlagsMissed,
        @JsonProperty("failures")          int failures,
        @JsonProperty("averageLatencyMs")  Double averageLatencyMs
) {}
