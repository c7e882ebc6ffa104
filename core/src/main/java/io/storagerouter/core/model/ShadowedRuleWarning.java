package io.storagerouter.core.model;

import java.util.List;

/**
 * A rule that can never decide anything because earlier rules claim every criteria
 * value it matches.
 *
 * @param priority   priority of the unreachable rule
 * @param ruleId     id of the unreachable rule
 * @param kind       how it is shadowed
 * @param shadowedBy priorities of the earlier rule(s) responsible, ascending
 */
public record ShadowedRuleWarning(int priority, String ruleId, Kind kind, List<Integer> shadowedBy) {

    /** How a rule came to be unreachable. */
    public enum Kind {
        /** A single earlier rule's condition is at least as general. */
        SUBSUMED,
        /** No single earlier rule subsumes it, but together they cover it. */
        COVERED
    }

    public ShadowedRuleWarning {
        shadowedBy = List.copyOf(shadowedBy);
    }

    /** Actionable one-line description. */
    public String message() {
        return switch (kind) {
            case SUBSUMED -> String.format(
                    "Rule #%d '%s' is unreachable: subsumed by earlier rule(s) %s", priority, ruleId, shadowedBy);
            case COVERED -> String.format(
                    "Rule #%d '%s' is unreachable: every criteria it matches is claimed by earlier rules %s",
                    priority, ruleId, shadowedBy);
        };
    }
}
