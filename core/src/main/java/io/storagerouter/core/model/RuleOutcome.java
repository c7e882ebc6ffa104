package io.storagerouter.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Right-hand side of a rule.
 *
 * @param storageTargets non-empty set of backends, held in canonical enum order
 * @param operationHints ordered, opaque hints for the dispatching layer (e.g.
 *                       {@code upsert_key}, {@code create_table})
 * @param rationale      compiled rationale template
 */
public record RuleOutcome(Set<StorageTarget> storageTargets, List<String> operationHints, RationaleTemplate rationale) {

    /** Canonical constructor: validates and freezes. */
    public RuleOutcome {
        if (storageTargets == null || storageTargets.isEmpty()) {
            throw new IllegalArgumentException("storage targets must not be empty");
        }
        storageTargets = Collections.unmodifiableSet(EnumSet.copyOf(storageTargets));
        operationHints = operationHints != null ? List.copyOf(operationHints) : List.of();
        Objects.requireNonNull(rationale, "rationale must not be null");
    }

    /** Convenience factory compiling the rationale from text. */
    public static RuleOutcome of(Set<StorageTarget> targets, List<String> hints, String rationale) {
        return new RuleOutcome(targets, hints, RationaleTemplate.compile(rationale));
    }
}
