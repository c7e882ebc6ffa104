package io.storagerouter.core.engine;

import io.storagerouter.core.model.RuleSet;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable unit that the engine swaps on reload: a validated rule set together
 * with its analysis and where it came from. Evaluations read one snapshot and use
 * it throughout, so a concurrent reload is never observed half-applied.
 *
 * @param ruleSet  the validated rule set
 * @param analysis shadow and overlap findings computed at load
 * @param source   artifact path, resource or {@code "programmatic"}
 * @param loadedAt when the snapshot was published
 */
public record RuleSetSnapshot(RuleSet ruleSet, RuleSetAnalysis analysis, String source, Instant loadedAt) {

    public RuleSetSnapshot {
        Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        Objects.requireNonNull(analysis, "analysis must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(loadedAt, "loadedAt must not be null");
    }
}
