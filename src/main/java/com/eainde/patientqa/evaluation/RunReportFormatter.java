package com.eainde.patientqa.evaluation;

import com.eainde.patientqa.judge.RubricDimension;
import com.eainde.patientqa.review.VerdictDiscrepancy;

import java.util.Locale;
import java.util.Map;

/**
 * Plain-text rendering of a {@link RunReport} for the console.
 */
public final class RunReportFormatter {

    private static final String RULE = "=".repeat(72);

    private RunReportFormatter() {
    }

    public static String format(RunReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n')
                .append("EVALUATION RUN ").append(report.runId()).append("  [").append(report.status()).append("]\n")
                .append(RULE).append('\n');
        line(sb, "Pairs: %d planned, %d failed, %d unscored, %d skipped",
                report.totalPairs(), report.failures().size(), report.unscored().size(), report.skipped().size());
        line(sb, "Red flags missed: %d", report.redFlagsMissed().size());
        report.redFlagsMissed().forEach(p -> line(sb, "  ! %s", p));

        for (ConfigSummary summary : report.configs().values()) {
            sb.append('\n');
            line(sb, "Configuration %s", summary.configId());
            line(sb, "  Pass rate: %s (%d/%d)", percent(summary.overall().passRate()),
                    summary.overall().passed(), summary.overall().scored());
            line(sb, "  Average score: %s", summary.averageScore() == null ? "n/a" : summary.averageScore() + "%");
            line(sb, "  Average latency: %s", summary.averageLatencyMs() == null ? "n/a" : summary.averageLatencyMs() + " ms");
            line(sb, "  Verdicts: %s", summary.verdictCounts());
            line(sb, "  Red flags missed: %d, failures: %d", summary.redFlagsMissed(), summary.failures());
            for (Map.Entry<String, CategoryStat> entry : summary.byCategory().entrySet()) {
                line(sb, "    %-18s %s (%d/%d)", entry.getKey(), percent(entry.getValue().passRate()),
                        entry.getValue().passed(), entry.getValue().scored());
            }
            for (Map.Entry<RubricDimension, Double> entry : summary.dimensionAverages().entrySet()) {
                line(sb, "    %-22s avg %5.1f  weak %d", entry.getKey().getDisplayName(), entry.getValue(),
                        summary.weakDimensions().getOrDefault(entry.getKey(), 0));
            }
            line(sb, "  Distribution: %s", summary.scoreDistribution());
        }

        if (!report.failures().isEmpty()) {
            sb.append('\n');
            line(sb, "Failures:");
            report.failures().forEach(f -> line(sb, "  %s: %s", f.pair(), f.reason()));
        }
        if (!report.discrepancies().isEmpty() || report.humanOverrides() > 0) {
            sb.append('\n');
            line(sb, "Human overrides: %d, judge overestimate rate: %s",
                    report.humanOverrides(), percent(report.judgeOverestimateRate()));
            for (VerdictDiscrepancy d : report.discrepancies()) {
                line(sb, "  %s judge=%s human=%s (%s)", d.pair(), d.judgeVerdict(), d.humanVerdict(), d.reviewerId());
            }
        }
        return sb.toString();
    }

    private static String percent(Double rate) {
        return rate == null ? "n/a" : String.format(Locale.ROOT, "%.1f%%", rate * 100);
    }

    private static void line(StringBuilder sb, String format, Object... args) {
        sb.append(String.format(Locale.ROOT, format, args)).append('\n');
    }
}
