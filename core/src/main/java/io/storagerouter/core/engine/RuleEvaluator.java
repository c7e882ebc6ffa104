package io.storagerouter.core.engine;

import io.storagerouter.core.error.RuleSetIntegrityException;
import io.storagerouter.core.model.Criteria;
import io.storagerouter.core.model.DecisionResult;
import io.storagerouter.core.model.HitPolicy;
import io.storagerouter.core.model.Rule;
import io.storagerouter.core.model.RuleSet;
import io.storagerouter.core.model.StorageTarget;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pure evaluation of one rule set against one criteria value. No I/O, no shared
 * state; the result depends only on the two arguments and the hit policy.
 */
final class RuleEvaluator {

    private RuleEvaluator() {}

    static DecisionResult evaluate(RuleSet ruleSet, Criteria criteria, HitPolicy hitPolicy) {
        return switch (hitPolicy) {
            case FIRST -> first(ruleSet, criteria);
            case COLLECT_ALL -> collectAll(ruleSet, criteria);
        };
    }

    private static DecisionResult first(RuleSet ruleSet, Criteria criteria) {
        for (Rule rule : ruleSet.rules()) {
            if (rule.matches(criteria)) {
                return new DecisionResult(
                        rule.outcome().storageTargets(),
                        rule.outcome().operationHints(),
                        rule.outcome().rationale().render(criteria, rule),
                        rule.priority(),
                        rule.id(),
                        List.of(rule.priority()),
                        HitPolicy.FIRST,
                        ruleSet.key());
            }
        }
        throw noMatch(ruleSet, criteria);
    }

    private static DecisionResult collectAll(RuleSet ruleSet, Criteria criteria) {
        Set<StorageTarget> targets = EnumSet.noneOf(StorageTarget.class);
        Set<String> hints = new LinkedHashSet<>();
        List<String> rationales = new ArrayList<>();
        List<Integer> priorities = new ArrayList<>();
        for (Rule rule : ruleSet.rules()) {
            if (rule.matches(criteria)) {
                targets.addAll(rule.outcome().storageTargets());
                hints.addAll(rule.outcome().operationHints());
                rationales.add(rule.outcome().rationale().render(criteria, rule));
                priorities.add(rule.priority());
            }
        }
        if (priorities.isEmpty()) {
            throw noMatch(ruleSet, criteria);
        }
        return new DecisionResult(
                targets,
                new ArrayList<>(hints),
                String.join("; ", rationales),
                null,
                null,
                priorities,
                HitPolicy.COLLECT_ALL,
                ruleSet.key());
    }

    private static RuleSetIntegrityException noMatch(RuleSet ruleSet, Criteria criteria) {
        return RuleSetIntegrityException.atEvaluation(
                "No rule in " + ruleSet.key() + " matched criteria " + criteria.toWireMap(), ruleSet.id());
    }
}
