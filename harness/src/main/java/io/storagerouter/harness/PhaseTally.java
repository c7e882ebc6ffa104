package io.storagerouter.harness;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Per-worker accumulator. Each worker owns one tally and never shares it; tallies
 * are merged only after every worker has finished.
 */
final class PhaseTally {

    private final List<IndexedOutcome> outcomes = new ArrayList<>();
    private long[] latencies = new long[64];
    private int latencyCount;

    /** Outcome tagged with the case's position in the input, to restore order on merge. */
    record IndexedOutcome(int index, CaseOutcome outcome) {}

    void record(int caseIndex, CaseOutcome outcome) {
        outcomes.add(new IndexedOutcome(caseIndex, outcome));
    }

    void recordLatency(long nanos) {
        if (latencyCount == latencies.length) {
            latencies = Arrays.copyOf(latencies, latencies.length * 2);
        }
        latencies[latencyCount++] = nanos;
    }

    List<IndexedOutcome> outcomes() {
        return outcomes;
    }

    long[] latencies() {
        return Arrays.copyOf(latencies, latencyCount);
    }

    /** Combines finished tallies; outcomes come back in input order. */
    static PhaseTally merge(List<PhaseTally> tallies) {
        PhaseTally merged = new PhaseTally();
        for (PhaseTally tally : tallies) {
            merged.outcomes.addAll(tally.outcomes);
            for (int i = 0; i < tally.latencyCount; i++) {
                merged.recordLatency(tally.latencies[i]);
            }
        }
        merged.outcomes.sort((a, b) -> Integer.compare(a.index(), b.index()));
        return merged;
    }

    List<CaseOutcome> orderedOutcomes() {
        List<CaseOutcome> ordered = new ArrayList<>(outcomes.size());
        outcomes.forEach(o -> ordered.add(o.outcome()));
        return ordered;
    }
}
