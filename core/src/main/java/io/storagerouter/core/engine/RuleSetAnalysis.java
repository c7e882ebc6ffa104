package io.storagerouter.core.engine;

import io.storagerouter.core.model.ShadowedRuleWarning;
import java.util.List;

/**
 * Load-time findings for one rule set.
 *
 * @param shadowed  unreachable rules, in priority order
 * @param overlaps  contested rule pairs, in (earlier, later) order
 * @param coverage  number of criteria values each rule decides under the first-match
 *                  policy, indexed by priority
 */
public record RuleSetAnalysis(List<ShadowedRuleWarning> shadowed, List<RuleOverlap> overlaps, List<Integer> coverage) {

    public RuleSetAnalysis {
        shadowed = List.copyOf(shadowed);
        overlaps = List.copyOf(overlaps);
        coverage = List.copyOf(coverage);
    }

    /** True if no rule is shadowed. */
    public boolean isClean() {
        return shadowed.isEmpty();
    }
}
