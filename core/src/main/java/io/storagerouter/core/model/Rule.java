package io.storagerouter.core.model;

import java.util.Objects;

/**
 * One row of the decision table.
 *
 * @param priority  position in the rule set; lower is evaluated first
 * @param id        author-assigned identifier, unique within the rule set
 * @param condition fields the rule constrains
 * @param outcome   what the rule decides when it matches
 */
public record Rule(int priority, String id, Condition condition, RuleOutcome outcome) {

    /** Canonical constructor: validates required fields. */
    public Rule {
        if (priority < 0) {
            throw new IllegalArgumentException("priority must not be negative, got: " + priority);
        }
        Objects.requireNonNull(id, "rule id must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    /** True for the all-wildcard default rule. */
    public boolean isDefault() {
        return condition.isWildcard();
    }

    /** True if this rule's condition matches {@code criteria}. */
    public boolean matches(Criteria criteria) {
        return condition.matches(criteria);
    }

    /** {@code #priority id} label used in logs and findings. */
    public String label() {
        return "#" + priority + " " + id;
    }
}
