package io.storagerouter.harness;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Hand-built outcomes and reports for tests that do not need a real run. */
final class Reports {

    static final Instant GENERATED_AT = Instant.parse("2026-03-01T12:00:00Z");

    private Reports() {}

    static CaseOutcome pass(String id, String category) {
        return new CaseOutcome(
                id, category, false, CaseStatus.PASS, List.of("memory"), List.of("memory"), "memory-facts", null,
                Map.of(), true, null);
    }

    static CaseOutcome miss(String id, String category) {
        return new CaseOutcome(
                id, category, false, CaseStatus.MISS, List.of("relational_store"), List.of("analytical_store"),
                "analytical-query", null, Map.of(), true, null);
    }

    static CaseOutcome hardFailure(String id, String category) {
        return new CaseOutcome(
                id, category, false, CaseStatus.HARD_FAILURE, List.of("memory"), List.of(), null, null, Map.of(),
                true, "Undeclared value 'spreadsheet' for criteria field 'data_type'");
    }

    static CaseOutcome fixNeeded(CaseOutcome outcome) {
        return new CaseOutcome(
                outcome.caseId(),
                outcome.category(),
                true,
                outcome.status(),
                outcome.expectedTargets(),
                outcome.predictedTargets(),
                outcome.matchedRuleId(),
                outcome.extractedCriteria(),
                outcome.fieldMatches(),
                outcome.consistent(),
                outcome.error());
    }

    static ValidationReport engineReport(CaseOutcome... outcomes) {
        return new ValidationReport(
                ValidationPhase.ENGINE_ONLY,
                "storage-routing@1.0.0",
                null,
                "pinned-50@1.0.0",
                TargetMatchMode.EXACT,
                3,
                List.of(outcomes),
                new LatencyStats(outcomes.length * 3L, 2_000, 4_000, 5_000, 9_000, 12_000),
                GENERATED_AT);
    }
}
