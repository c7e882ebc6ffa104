package io.storagerouter.harness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Difference between a baseline report and a current one, for tracking accuracy
 * across iterations of a rule set or extractor.
 *
 * @param baselineAccuracy overall accuracy of the baseline
 * @param currentAccuracy  overall accuracy of the current run
 * @param categoryDeltas   current minus baseline accuracy per category; a
 *                         category missing on one side counts as 0 there
 * @param newlyFailing     ids that passed in the baseline and fail now
 * @param newlyPassing     ids that failed in the baseline and pass now
 */
public record ReportComparison(
        double baselineAccuracy,
        double currentAccuracy,
        Map<String, Double> categoryDeltas,
        List<String> newlyFailing,
        List<String> newlyPassing) {

    public ReportComparison {
        categoryDeltas = Collections.unmodifiableMap(new LinkedHashMap<>(categoryDeltas));
        newlyFailing = List.copyOf(newlyFailing);
        newlyPassing = List.copyOf(newlyPassing);
    }

    /**
     * Compares two reports case by case. Cases present in only one report are
     * ignored for the newly failing and newly passing lists.
     */
    public static ReportComparison compare(ValidationReport baseline, ValidationReport current) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        Objects.requireNonNull(current, "current must not be null");

        Map<String, CategoryStats> before = baseline.categoryStats();
        Map<String, CategoryStats> after = current.categoryStats();
        Map<String, Double> deltas = new LinkedHashMap<>();
        for (Map.Entry<String, CategoryStats> entry : after.entrySet()) {
            CategoryStats old = before.get(entry.getKey());
            deltas.put(entry.getKey(), entry.getValue().accuracy() - (old != null ? old.accuracy() : 0.0));
        }
        for (Map.Entry<String, CategoryStats> entry : before.entrySet()) {
            if (!after.containsKey(entry.getKey())) {
                deltas.put(entry.getKey(), -entry.getValue().accuracy());
            }
        }

        List<String> newlyFailing = new ArrayList<>();
        List<String> newlyPassing = new ArrayList<>();
        for (CaseOutcome now : current.outcomes()) {
            CaseOutcome then = baseline.outcome(now.caseId());
            if (then == null) {
                continue;
            }
            if (then.passed() && !now.passed()) {
                newlyFailing.add(now.caseId());
            } else if (!then.passed() && now.passed()) {
                newlyPassing.add(now.caseId());
            }
        }
        return new ReportComparison(baseline.accuracy(), current.accuracy(), deltas, newlyFailing, newlyPassing);
    }

    /** Current minus baseline accuracy. */
    public double accuracyDelta() {
        return currentAccuracy - baselineAccuracy;
    }

    /** True if any case that passed before now fails. */
    public boolean hasRegressions() {
        return !newlyFailing.isEmpty();
    }
}
