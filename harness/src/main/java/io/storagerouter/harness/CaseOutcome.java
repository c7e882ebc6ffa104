package io.storagerouter.harness;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of running one case {@code repetitions} times.
 *
 * @param caseId            case id
 * @param category          case category
 * @param fixNeeded         carried over from the case
 * @param status            verdict of the first repetition
 * @param expectedTargets   expected target wire names, empty in extractor-only runs
 * @param predictedTargets  predicted target wire names, empty if no decision was made
 * @param matchedRuleId     rule that decided, or null
 * @param extractedCriteria extractor output as wire values, or null
 * @param fieldMatches      per-field agreement with the labeled criteria, empty when
 *                          no extractor ran or extraction failed
 * @param consistent        true if every repetition produced the same output
 * @param error             error message for the two failure statuses, else null
 */
public record CaseOutcome(
        String caseId,
        String category,
        boolean fixNeeded,
        CaseStatus status,
        List<String> expectedTargets,
        List<String> predictedTargets,
        String matchedRuleId,
        Map<String, String> extractedCriteria,
        Map<String, Boolean> fieldMatches,
        boolean consistent,
        String error) {

    public CaseOutcome {
        Objects.requireNonNull(caseId, "caseId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        expectedTargets = expectedTargets != null ? List.copyOf(expectedTargets) : List.of();
        predictedTargets = predictedTargets != null ? List.copyOf(predictedTargets) : List.of();
        extractedCriteria = extractedCriteria != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(extractedCriteria))
                : null;
        fieldMatches = fieldMatches != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(fieldMatches))
                : Map.of();
    }

    public boolean passed() {
        return status == CaseStatus.PASS;
    }
}
