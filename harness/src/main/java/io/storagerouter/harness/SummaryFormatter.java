package io.storagerouter.harness;

import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link ValidationReport} as a plain-text summary for terminals and
 * CI logs.
 */
public final class SummaryFormatter {

    private static final int MAX_LISTED_FAILURES = 20;

    private SummaryFormatter() {
        // utility class
    }

    /** Summary with a gate verdict against {@code threshold}. */
    public static String format(ValidationReport report, double threshold) {
        return format(report, threshold, null);
    }

    /**
     * Summary with a gate verdict and, if {@code comparison} is non-null, a
     * baseline section.
     */
    public static String format(ValidationReport report, double threshold, ReportComparison comparison) {
        StringBuilder out = new StringBuilder();
        out.append("Validation summary (").append(report.phase().wireName()).append(")\n");
        line(out, "Corpus", orDash(report.corpusKey()));
        if (report.ruleSetKey() != null) {
            line(out, "Rule set", report.ruleSetKey());
        }
        if (report.extractorName() != null) {
            line(out, "Extractor", report.extractorName());
        }
        line(out, "Match", report.matchMode().wireName() + ", " + report.repetitions() + " repetition(s)");
        out.append('\n');

        line(out,
                "Accuracy",
                String.format(
                        Locale.ROOT,
                        "%s (%d/%d) %s",
                        percent(report.accuracy()),
                        report.passedCases(),
                        report.totalCases(),
                        report.grade().label()));
        line(out,
                "Hard failures",
                String.format(
                        Locale.ROOT,
                        "%s (%d)",
                        percent(report.hardFailureRate()),
                        report.count(CaseStatus.HARD_FAILURE)));
        if (report.phase().usesExtractor()) {
            line(out,
                    "Extraction failures",
                    String.format(
                            Locale.ROOT,
                            "%s (%d)",
                            percent(report.extractionFailureRate()),
                            report.count(CaseStatus.EXTRACTION_FAILURE)));
        }
        line(out, "Consistency", percent(report.consistency()));

        Map<String, Double> fields = report.fieldAccuracy();
        if (!fields.isEmpty()) {
            out.append("\nField accuracy\n");
            fields.forEach((field, accuracy) -> line(out, "  " + field, percent(accuracy)));
        }

        out.append("\nCategories\n");
        report.categoryStats().forEach((category, stats) -> line(out, "  " + category, stats(stats)));
        CategoryStats fixNeeded = report.fixNeededStats();
        if (fixNeeded.total() > 0) {
            line(out, "  fix-needed", stats(fixNeeded));
        }

        LatencyStats latency = report.latency();
        if (latency.count() > 0) {
            out.append('\n');
            line(out,
                    "Latency",
                    String.format(
                            Locale.ROOT,
                            "p50 %s  p90 %s  p95 %s  p99 %s  max %s",
                            micros(latency.p50()),
                            micros(latency.p90()),
                            micros(latency.p95()),
                            micros(latency.p99()),
                            micros(latency.max())));
        }

        int listed = 0;
        int failed = report.totalCases() - report.passedCases();
        if (failed > 0) {
            out.append("\nFailures\n");
            for (CaseOutcome outcome : report.outcomes()) {
                if (outcome.passed()) {
                    continue;
                }
                if (listed == MAX_LISTED_FAILURES) {
                    out.append("  ... ").append(failed - listed).append(" more\n");
                    break;
                }
                out.append("  ").append(failureLine(outcome)).append('\n');
                listed++;
            }
        }

        if (comparison != null) {
            out.append("\nBaseline\n");
            line(out,
                    "  accuracy",
                    String.format(
                            Locale.ROOT,
                            "%s -> %s (%+.1f pts)",
                            percent(comparison.baselineAccuracy()),
                            percent(comparison.currentAccuracy()),
                            comparison.accuracyDelta() * 100));
            comparison.categoryDeltas().forEach((category, delta) -> {
                if (delta != 0.0) {
                    line(out, "  " + category, String.format(Locale.ROOT, "%+.1f pts", delta * 100));
                }
            });
            if (!comparison.newlyFailing().isEmpty()) {
                line(out, "  newly failing", String.join(", ", comparison.newlyFailing()));
            }
            if (!comparison.newlyPassing().isEmpty()) {
                line(out, "  newly passing", String.join(", ", comparison.newlyPassing()));
            }
        }

        out.append('\n');
        boolean passed = report.passes(threshold);
        out.append(String.format(
                Locale.ROOT,
                "Gate: %s (accuracy %s, threshold %s)\n",
                passed ? "PASSED" : "FAILED",
                percent(report.accuracy()),
                percent(threshold)));
        return out.toString();
    }

    private static String failureLine(CaseOutcome outcome) {
        StringBuilder line = new StringBuilder();
        line.append(outcome.status()).append(' ').append(outcome.caseId());
        if (outcome.fixNeeded()) {
            line.append(" [fix-needed]");
        }
        if (outcome.status() == CaseStatus.MISS && !outcome.expectedTargets().isEmpty()) {
            line.append(": expected ")
                    .append(outcome.expectedTargets())
                    .append(", got ")
                    .append(outcome.predictedTargets());
            if (outcome.matchedRuleId() != null) {
                line.append(" via ").append(outcome.matchedRuleId());
            }
        } else if (outcome.status() == CaseStatus.MISS) {
            outcome.fieldMatches().forEach((field, match) -> {
                if (!match) {
                    line.append(" ").append(field).append('=').append(outcome.extractedCriteria().get(field));
                }
            });
        } else if (outcome.error() != null) {
            line.append(": ").append(outcome.error());
        }
        if (!outcome.consistent()) {
            line.append(" (inconsistent)");
        }
        return line.toString();
    }

    private static void line(StringBuilder out, String label, String value) {
        out.append(String.format(Locale.ROOT, "%-22s %s\n", label + ":", value));
    }

    private static String stats(CategoryStats stats) {
        return String.format(Locale.ROOT, "%s (%d/%d)", percent(stats.accuracy()), stats.passed(), stats.total());
    }

    private static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.1f%%", fraction * 100);
    }

    private static String micros(long nanos) {
        return String.format(Locale.ROOT, "%.1fus", nanos / 1000.0);
    }

    private static String orDash(String value) {
        return value != null ? value : "-";
    }
}
