package io.storagerouter.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of one evaluation. Ephemeral; not persisted by the engine.
 *
 * <p>
 * Under {@link HitPolicy#FIRST} {@code matchedRulePriority} and
 * {@code matchedRuleId} cite the deciding rule. Under {@link HitPolicy#COLLECT_ALL}
 * both are null and {@code matchedPriorities} lists every contributing rule.
 *
 * @param storageTargets      chosen backends, canonical order
 * @param operationHints      hints for the dispatching layer
 * @param rationale           rendered explanation
 * @param matchedRulePriority priority of the deciding rule, or null under collect-all
 * @param matchedRuleId       id of the deciding rule, or null under collect-all
 * @param matchedPriorities   priorities of every rule that contributed
 * @param hitPolicy           policy the result was produced under
 * @param ruleSetKey          {@code id@version} of the rule set snapshot used
 */
public record DecisionResult(
        Set<StorageTarget> storageTargets,
        List<String> operationHints,
        String rationale,
        Integer matchedRulePriority,
        String matchedRuleId,
        List<Integer> matchedPriorities,
        HitPolicy hitPolicy,
        String ruleSetKey) {

    /** Canonical constructor: freezes collections. */
    public DecisionResult {
        if (storageTargets == null || storageTargets.isEmpty()) {
            throw new IllegalArgumentException("decision must name at least one storage target");
        }
        storageTargets = Collections.unmodifiableSet(EnumSet.copyOf(storageTargets));
        operationHints = operationHints != null ? List.copyOf(operationHints) : List.of();
        matchedPriorities = matchedPriorities != null ? List.copyOf(matchedPriorities) : List.of();
        Objects.requireNonNull(hitPolicy, "hitPolicy must not be null");
    }

    /** Wire names of the targets, canonical order. */
    public List<String> targetNames() {
        return storageTargets.stream().map(StorageTarget::wireName).toList();
    }
}
