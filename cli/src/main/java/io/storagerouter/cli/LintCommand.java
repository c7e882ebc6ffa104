package io.storagerouter.cli;

import io.storagerouter.cli.config.ConfigLoader;
import io.storagerouter.cli.config.RouterConfig;
import io.storagerouter.core.engine.DecisionEngine;
import io.storagerouter.core.engine.RuleOverlap;
import io.storagerouter.core.engine.RuleSetAnalysis;
import io.storagerouter.core.engine.ShadowPolicy;
import io.storagerouter.core.model.HitPolicy;
import io.storagerouter.core.model.Rule;
import io.storagerouter.core.model.RuleSet;
import io.storagerouter.core.model.ShadowedRuleWarning;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Loads a rule set and reports shadowed rules, overlaps and coverage. */
@Command(name = "lint", mixinStandardHelpOptions = true, description = "Check a rule set for unreachable rules")
class LintCommand extends RouterSubcommand {

    @Option(names = "--rules", paramLabel = "<location>", description = "Rule set file or classpath:name")
    String rules;

    @Option(names = "--strict", description = "Fail when any rule is shadowed")
    boolean strict;

    @Option(names = "--overlaps", description = "List contested rule pairs")
    boolean overlaps;

    @Option(names = "--coverage", description = "List how many criteria values each rule decides")
    boolean coverage;

    @Override
    public Integer call() {
        RouterConfig config = config();
        ShadowPolicy shadowPolicy = strict ? ShadowPolicy.STRICT : ConfigLoader.shadowPolicy(config);
        DecisionEngine engine = loadEngine(rules != null ? rules : config.rules(), shadowPolicy, HitPolicy.FIRST);
        RuleSet ruleSet = engine.ruleSet();
        RuleSetAnalysis analysis = engine.analysis();

        out().printf(
                "%s: %d rules, %d shadowed, %d overlaps%n",
                ruleSet.key(), ruleSet.size(), analysis.shadowed().size(), analysis.overlaps().size());
        for (ShadowedRuleWarning warning : analysis.shadowed()) {
            ConsoleOutput.warn(out(), warning.message());
        }
        if (overlaps) {
            out().println("Overlaps:");
            for (RuleOverlap overlap : analysis.overlaps()) {
                out().printf(
                        "  #%d %s wins %d value(s) over #%d %s%n",
                        overlap.earlierPriority(),
                        overlap.earlierRuleId(),
                        overlap.contestedCriteria(),
                        overlap.laterPriority(),
                        overlap.laterRuleId());
            }
        }
        if (coverage) {
            out().println("Coverage:");
            for (Rule rule : ruleSet.rules()) {
                out().printf("  %-4s %-28s %d%n", "#" + rule.priority(), rule.id(), analysis.coverage().get(rule.priority()));
            }
        }
        if (analysis.isClean()) {
            ConsoleOutput.success(out(), "No shadowed rules");
        }
        out().flush();
        return RouterCommand.EXIT_OK;
    }
}
