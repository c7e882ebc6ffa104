package io.storagerouter.core.spi;

import io.storagerouter.core.model.HitPolicy;
import java.util.List;
import java.util.Set;

/**
 * Observability hooks for the decision engine.
 *
 * <p>
 * Bridges to a metrics or tracing system are supplied by the embedding
 * application; the core carries no telemetry dependency of its own.
 *
 * <p>
 * Events are immutable. Implementations MUST be thread-safe and non-blocking.
 * Exceptions thrown by a listener are caught and logged by the engine and never
 * change a decision or a load outcome.
 *
 * <p>
 * Suggested metrics vocabulary:
 * <ul>
 * <li>{@code router_decisions_total}: counter, labelled by rule id</li>
 * <li>{@code router_decision_duration_seconds}: histogram</li>
 * <li>{@code router_ruleset_load_errors_total}: counter</li>
 * </ul>
 */
public interface DecisionListener {

    /**
     * Called after a rule set snapshot is published.
     *
     * @param event rule set id, version, source, rule count, shadow warning count
     */
    default void onRuleSetLoaded(RuleSetLoadedEvent event) {}

    /**
     * Called when a load is refused; the previous snapshot stays active.
     *
     * @param event source and error detail
     */
    default void onRuleSetRejected(RuleSetRejectedEvent event) {}

    /**
     * Called after every successful evaluation.
     *
     * @param event rule set key, matched priorities, targets and duration
     */
    default void onDecision(DecisionEvent event) {}

    // --- Event records ---

    /** Emitted when a rule set becomes the active snapshot. */
    record RuleSetLoadedEvent(String ruleSetId, String version, String source, int ruleCount, int warningCount) {}

    /** Emitted when a rule set is refused at load time. */
    record RuleSetRejectedEvent(String source, String errorDetail) {}

    /** Emitted for each decision. */
    record DecisionEvent(
            String ruleSetKey,
            HitPolicy hitPolicy,
            List<Integer> matchedPriorities,
            Set<String> targets,
            long durationNanos) {}
}
