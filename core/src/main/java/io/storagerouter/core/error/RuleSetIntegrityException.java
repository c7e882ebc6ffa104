package io.storagerouter.core.error;

import java.util.List;

/**
 * The rule set is structurally defective: a condition names an undeclared field or
 * value, the default rule is missing, duplicated or not last, an outcome is empty,
 * or (in strict mode) a rule is shadowed.
 *
 * <p>
 * Raised at {@link Phase#LOAD} in all expected cases. Raised at
 * {@link Phase#EVALUATION} only when no rule set is loaded or evaluation falls
 * through every rule, which a validated rule set makes impossible. Either way it
 * is fatal and never retried.
 */
public final class RuleSetIntegrityException extends RouterException {

    private static final long serialVersionUID = 1L;

    private final Integer ruleIndex;
    private final String source;
    private final List<String> findings;

    private RuleSetIntegrityException(
            String message, String ruleSetId, Phase phase, Integer ruleIndex, String source, List<String> findings) {
        super(message, ruleSetId, phase);
        this.ruleIndex = ruleIndex;
        this.source = source;
        this.findings = findings != null ? List.copyOf(findings) : List.of();
    }

    /**
     * Creates a load-time integrity error.
     *
     * @param message   description of the defect
     * @param ruleSetId rule set id, or null if not yet known
     * @param ruleIndex offending rule index, or null if the defect is not tied to one rule
     * @param source    artifact path or resource, or null for programmatic rule sets
     */
    public static RuleSetIntegrityException atLoad(String message, String ruleSetId, Integer ruleIndex, String source) {
        return new RuleSetIntegrityException(message, ruleSetId, Phase.LOAD, ruleIndex, source, null);
    }

    /**
     * Creates a load-time integrity error that carries the shadowing findings which
     * caused it, one message per unreachable rule.
     */
    public static RuleSetIntegrityException withFindings(
            String message, String ruleSetId, Integer ruleIndex, String source, List<String> findings) {
        return new RuleSetIntegrityException(message, ruleSetId, Phase.LOAD, ruleIndex, source, findings);
    }

    /** Creates an evaluation-time integrity error. */
    public static RuleSetIntegrityException atEvaluation(String message, String ruleSetId) {
        return new RuleSetIntegrityException(message, ruleSetId, Phase.EVALUATION, null, null, null);
    }

    /** The offending rule index, or {@code null} if the defect concerns the whole rule set. */
    public Integer ruleIndex() {
        return ruleIndex;
    }

    /** Artifact path or resource, or {@code null}. */
    public String source() {
        return source;
    }

    /** Messages for each unreachable rule behind this failure; empty if none apply. */
    public List<String> findings() {
        return findings;
    }
}
