package io.storagerouter.harness;

import io.storagerouter.core.model.CriteriaField;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one validation run. Holds the per-case outcomes and latency summary;
 * every aggregate is derived from them, so a report read back from JSON yields the
 * same figures as the original.
 *
 * @param phase         what was measured
 * @param ruleSetKey    {@code id@version} of the rule set, or null for extractor-only
 * @param extractorName extractor name, or null for engine-only
 * @param corpusKey     {@code id@version} of the corpus
 * @param matchMode     target comparison used
 * @param repetitions   runs per case
 * @param outcomes      per-case outcomes in corpus order
 * @param latency       per-invocation latency summary
 * @param generatedAt   when the run finished
 */
public record ValidationReport(
        ValidationPhase phase,
        String ruleSetKey,
        String extractorName,
        String corpusKey,
        TargetMatchMode matchMode,
        int repetitions,
        List<CaseOutcome> outcomes,
        LatencyStats latency,
        Instant generatedAt) {

    public ValidationReport {
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(matchMode, "matchMode must not be null");
        outcomes = List.copyOf(outcomes);
        latency = latency != null ? latency : LatencyStats.EMPTY;
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
    }

    public int totalCases() {
        return outcomes.size();
    }

    public int passedCases() {
        return count(CaseStatus.PASS);
    }

    /** Number of outcomes with {@code status}. */
    public int count(CaseStatus status) {
        int n = 0;
        for (CaseOutcome outcome : outcomes) {
            if (outcome.status() == status) {
                n++;
            }
        }
        return n;
    }

    /** Passed over total; failures count against accuracy. Zero for an empty run. */
    public double accuracy() {
        return outcomes.isEmpty() ? 0.0 : (double) passedCases() / outcomes.size();
    }

    public double hardFailureRate() {
        return rate(count(CaseStatus.HARD_FAILURE));
    }

    public double extractionFailureRate() {
        return rate(count(CaseStatus.EXTRACTION_FAILURE));
    }

    /** Fraction of cases whose repetitions all produced the same output. */
    public double consistency() {
        int consistent = 0;
        for (CaseOutcome outcome : outcomes) {
            if (outcome.consistent()) {
                consistent++;
            }
        }
        return rate(consistent);
    }

    /** Per-category pass counts, categories in first-seen order. */
    public Map<String, CategoryStats> categoryStats() {
        Map<String, int[]> counts = new LinkedHashMap<>();
        for (CaseOutcome outcome : outcomes) {
            int[] c = counts.computeIfAbsent(outcome.category(), k -> new int[2]);
            c[1]++;
            if (outcome.passed()) {
                c[0]++;
            }
        }
        Map<String, CategoryStats> stats = new LinkedHashMap<>();
        counts.forEach((category, c) -> stats.put(category, new CategoryStats(c[0], c[1])));
        return Collections.unmodifiableMap(stats);
    }

    /** Pass count over cases flagged fix-needed. */
    public CategoryStats fixNeededStats() {
        int passed = 0;
        int total = 0;
        for (CaseOutcome outcome : outcomes) {
            if (outcome.fixNeeded()) {
                total++;
                if (outcome.passed()) {
                    passed++;
                }
            }
        }
        return new CategoryStats(passed, total);
    }

    /**
     * Per-field extractor accuracy over cases where extraction succeeded. Empty for
     * engine-only runs.
     */
    public Map<String, Double> fieldAccuracy() {
        Map<String, Double> accuracy = new LinkedHashMap<>();
        for (CriteriaField field : CriteriaField.values()) {
            int matched = 0;
            int total = 0;
            for (CaseOutcome outcome : outcomes) {
                Boolean match = outcome.fieldMatches().get(field.wireName());
                if (match != null) {
                    total++;
                    if (match) {
                        matched++;
                    }
                }
            }
            if (total > 0) {
                accuracy.put(field.wireName(), (double) matched / total);
            }
        }
        return Collections.unmodifiableMap(accuracy);
    }

    public AccuracyGrade grade() {
        return AccuracyGrade.of(accuracy());
    }

    /** Gate verdict: accuracy at or above {@code threshold}. */
    public boolean passes(double threshold) {
        return accuracy() >= threshold;
    }

    /** Outcome for a case id, or null. */
    public CaseOutcome outcome(String caseId) {
        for (CaseOutcome outcome : outcomes) {
            if (outcome.caseId().equals(caseId)) {
                return outcome;
            }
        }
        return null;
    }

    private double rate(int n) {
        return outcomes.isEmpty() ? 0.0 : (double) n / outcomes.size();
    }
}
