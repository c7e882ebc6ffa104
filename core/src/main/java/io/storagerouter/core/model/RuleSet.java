package io.storagerouter.core.model;

import io.storagerouter.core.error.RuleSetIntegrityException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, versioned decision table.
 *
 * <p>
 * Construction enforces totality: the list is non-empty, priorities equal list
 * positions, rule ids are unique, and exactly one rule has an all-wildcard
 * condition: the last one. Any instance that exists is therefore guaranteed to
 * produce a decision for every valid {@link Criteria}.
 *
 * <p>
 * Immutable, thread-safe. A reload produces a new instance; instances are never
 * edited in place.
 *
 * @param id          rule set identifier (e.g. "storage-routing")
 * @param version     rule set version (semver string)
 * @param createdAt   authoring timestamp, or null if the artifact does not carry one
 * @param description human-readable description, may be null
 * @param rules       rules in priority order, default rule last
 */
public record RuleSet(String id, String version, Instant createdAt, String description, List<Rule> rules) {

    /** Canonical constructor: validates structure. */
    public RuleSet {
        Objects.requireNonNull(id, "rule set id must not be null");
        Objects.requireNonNull(version, "rule set version must not be null");
        rules = rules != null ? List.copyOf(rules) : List.of();
        if (rules.isEmpty()) {
            throw RuleSetIntegrityException.atLoad("Rule set '" + id + "' contains no rules", id, null, null);
        }
        Set<String> ids = new HashSet<>();
        int defaults = 0;
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            if (rule.priority() != i) {
                throw RuleSetIntegrityException.atLoad(
                        String.format("Rule '%s' at position %d declares priority %d", rule.id(), i, rule.priority()),
                        id,
                        i,
                        null);
            }
            if (!ids.add(rule.id())) {
                throw RuleSetIntegrityException.atLoad("Duplicate rule id '" + rule.id() + "'", id, i, null);
            }
            if (rule.isDefault()) {
                defaults++;
                if (i != rules.size() - 1) {
                    throw misplacedDefault(id, rules, i);
                }
            }
        }
        if (defaults == 0) {
            throw RuleSetIntegrityException.atLoad(
                    "Rule set '" + id + "' has no trailing all-wildcard default rule", id, rules.size() - 1, null);
        }
    }

    /**
     * Every rule after an all-wildcard rule is unreachable; the error lists them so
     * the author sees the shadowing, not just the misplaced default.
     */
    private static RuleSetIntegrityException misplacedDefault(String id, List<Rule> rules, int wildcardIndex) {
        List<String> findings = new ArrayList<>();
        for (int j = wildcardIndex + 1; j < rules.size(); j++) {
            Rule shadowed = rules.get(j);
            findings.add(new ShadowedRuleWarning(
                            j, shadowed.id(), ShadowedRuleWarning.Kind.SUBSUMED, List.of(wildcardIndex))
                    .message());
        }
        return RuleSetIntegrityException.withFindings(
                String.format(
                        "All-wildcard rule '%s' must be the last rule but is at position %d of %d; %d later rule(s)"
                                + " are unreachable",
                        rules.get(wildcardIndex).id(), wildcardIndex, rules.size(), findings.size()),
                id,
                wildcardIndex,
                null,
                findings);
    }

    /** {@code id@version}, the key used in logs and reports. */
    public String key() {
        return id + "@" + version;
    }

    /** The trailing all-wildcard rule. */
    public Rule defaultRule() {
        return rules.get(rules.size() - 1);
    }

    /** Number of rules, default included. */
    public int size() {
        return rules.size();
    }

    /** Rule at {@code priority}. */
    public Rule rule(int priority) {
        return rules.get(priority);
    }

    /**
     * Returns a builder that assigns priorities in insertion order.
     *
     * @param id      rule set id
     * @param version rule set version
     */
    public static Builder builder(String id, String version) {
        return new Builder(id, version);
    }

    /** Incremental construction for tests and programmatic rule sets. */
    public static final class Builder {

        private final String id;
        private final String version;
        private final List<Rule> rules = new ArrayList<>();
        private Instant createdAt;
        private String description;

        Builder(String id, String version) {
            this.id = id;
            this.version = version;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /** Appends a rule at the next priority. */
        public Builder rule(String ruleId, Condition condition, RuleOutcome outcome) {
            rules.add(new Rule(rules.size(), ruleId, condition, outcome));
            return this;
        }

        /** Appends the all-wildcard default rule. */
        public Builder defaultRule(String ruleId, RuleOutcome outcome) {
            return rule(ruleId, Condition.any(), outcome);
        }

        /**
         * Builds the rule set.
         *
         * @throws RuleSetIntegrityException if the rules do not form a total table
         */
        public RuleSet build() {
            return new RuleSet(id, version, createdAt, description, rules);
        }
    }
}
