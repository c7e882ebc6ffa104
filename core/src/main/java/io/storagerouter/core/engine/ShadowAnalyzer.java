package io.storagerouter.core.engine;

import io.storagerouter.core.model.Criteria;
import io.storagerouter.core.model.Rule;
import io.storagerouter.core.model.RuleSet;
import io.storagerouter.core.model.ShadowedRuleWarning;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Finds unreachable and contested rules.
 *
 * <p>
 * Pairwise subsumption is checked first: an earlier rule whose literals are all
 * repeated by a later rule makes the later one unreachable. Rules that survive that
 * check are then tested against every point of the finite criteria space; a rule
 * whose every matching point is first-matched by earlier rules is reported as
 * covered. The default rule is never reported: it exists for totality, not to be
 * reached.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class ShadowAnalyzer {

    private ShadowAnalyzer() {}

    /**
     * Analyzes a rule set.
     *
     * @param ruleSet validated rule set
     * @return shadowed rules, overlaps and per-rule coverage
     */
    public static RuleSetAnalysis analyze(RuleSet ruleSet) {
        List<Rule> rules = ruleSet.rules();
        List<Criteria> space = Criteria.allCombinations();

        // first-match owner of every point in the criteria space
        int[] owner = new int[space.size()];
        int[] coverage = new int[rules.size()];
        for (int p = 0; p < space.size(); p++) {
            owner[p] = firstMatch(rules, space.get(p));
            coverage[owner[p]]++;
        }

        List<ShadowedRuleWarning> shadowed = new ArrayList<>();
        boolean[] unreachable = new boolean[rules.size()];
        for (int i = 0; i < rules.size(); i++) {
            Rule later = rules.get(i);
            if (later.isDefault()) {
                continue;
            }
            List<Integer> subsumers = new ArrayList<>();
            for (int j = 0; j < i; j++) {
                if (rules.get(j).condition().subsumes(later.condition())) {
                    subsumers.add(j);
                }
            }
            if (!subsumers.isEmpty()) {
                shadowed.add(new ShadowedRuleWarning(i, later.id(), ShadowedRuleWarning.Kind.SUBSUMED, subsumers));
                unreachable[i] = true;
            } else if (coverage[i] == 0) {
                TreeSet<Integer> owners = new TreeSet<>();
                for (int p = 0; p < space.size(); p++) {
                    if (later.matches(space.get(p))) {
                        owners.add(owner[p]);
                    }
                }
                shadowed.add(new ShadowedRuleWarning(
                        i, later.id(), ShadowedRuleWarning.Kind.COVERED, new ArrayList<>(owners)));
                unreachable[i] = true;
            }
        }

        List<RuleOverlap> overlaps = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            Rule later = rules.get(i);
            if (later.isDefault() || unreachable[i]) {
                continue;
            }
            for (int j = 0; j < i; j++) {
                Rule earlier = rules.get(j);
                if (unreachable[j]
                        || earlier.outcome().storageTargets().equals(later.outcome().storageTargets())
                        || !earlier.condition().intersects(later.condition())) {
                    continue;
                }
                // points a third, even earlier rule wins are not contested by this pair
                int contested = 0;
                for (int p = 0; p < space.size(); p++) {
                    if (owner[p] == j && later.matches(space.get(p))) {
                        contested++;
                    }
                }
                if (contested > 0) {
                    overlaps.add(new RuleOverlap(j, earlier.id(), i, later.id(), contested));
                }
            }
        }

        List<Integer> coverageList = new ArrayList<>(coverage.length);
        for (int count : coverage) {
            coverageList.add(count);
        }
        return new RuleSetAnalysis(shadowed, overlaps, coverageList);
    }

    private static int firstMatch(List<Rule> rules, Criteria criteria) {
        for (Rule rule : rules) {
            if (rule.matches(criteria)) {
                return rule.priority();
            }
        }
        // unreachable for a constructed RuleSet: the default rule matches everything
        return rules.size() - 1;
    }
}
