package io.storagerouter.harness;

import io.storagerouter.core.model.StorageTarget;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One labeled example.
 *
 * <p>
 * Criteria are kept as wire-named strings rather than a bound
 * {@link io.storagerouter.core.model.Criteria} so that a mislabeled case surfaces
 * as a hard failure of that case during the run instead of failing the whole
 * corpus load.
 *
 * @param id               unique within the corpus
 * @param category         grouping for per-category accuracy
 * @param request          free-text request, or null for engine-only cases
 * @param criteria         labeled criteria (engine input), or null
 * @param expectedTargets  expected storage targets, empty if the case only checks
 *                         extraction
 * @param expectedCriteria expected extractor output, or null to reuse {@code criteria}
 * @param notes            free-form annotation, may be null
 * @param fixNeeded        marks a case known to fail, tracked separately
 */
public record ValidationCase(
        String id,
        String category,
        String request,
        Map<String, String> criteria,
        Set<StorageTarget> expectedTargets,
        Map<String, String> expectedCriteria,
        String notes,
        boolean fixNeeded) {

    public ValidationCase {
        Objects.requireNonNull(id, "case id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        criteria = criteria != null ? Collections.unmodifiableMap(new LinkedHashMap<>(criteria)) : null;
        expectedCriteria =
                expectedCriteria != null ? Collections.unmodifiableMap(new LinkedHashMap<>(expectedCriteria)) : null;
        expectedTargets = expectedTargets == null || expectedTargets.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(expectedTargets));
    }

    /** Criteria the extractor is expected to produce. */
    public Map<String, String> criteriaToExtract() {
        return expectedCriteria != null ? expectedCriteria : criteria;
    }

    /** True if the case can run in {@code phase}. */
    public boolean appliesTo(ValidationPhase phase) {
        return switch (phase) {
            case ENGINE_ONLY -> criteria != null && !expectedTargets.isEmpty();
            case EXTRACTOR_ONLY -> request != null && criteriaToExtract() != null;
            case END_TO_END -> request != null && !expectedTargets.isEmpty();
        };
    }
}
