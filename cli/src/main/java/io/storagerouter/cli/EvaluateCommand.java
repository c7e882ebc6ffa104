package io.storagerouter.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.storagerouter.cli.config.ConfigLoader;
import io.storagerouter.cli.config.RouterConfig;
import io.storagerouter.core.engine.DecisionEngine;
import io.storagerouter.core.extract.KeywordCriteriaExtractor;
import io.storagerouter.core.model.Criteria;
import io.storagerouter.core.model.DecisionResult;
import io.storagerouter.core.model.HitPolicy;
import io.storagerouter.core.model.WireEnum;
import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;

/**
 * Evaluates one criteria record, given as {@code field=value} pairs or as request
 * text classified by the keyword extractor.
 *
 * <pre>
 * storage-router evaluate storage_intent=database access_pattern=query \
 *     analytic_intent=true data_type=numeric search_intensity=none
 * storage-router evaluate --request "Track my daily expenses"
 * </pre>
 */
@Command(
        name = "evaluate",
        mixinStandardHelpOptions = true,
        description = "Decide storage targets for one criteria record")
class EvaluateCommand extends RouterSubcommand {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Option(names = "--rules", paramLabel = "<location>", description = "Rule set file or classpath:name")
    String rules;

    @Option(
            names = "--policy",
            paramLabel = "<policy>",
            defaultValue = "first",
            description = "first or collect-all (default: ${DEFAULT-VALUE})")
    String policy;

    @Option(names = "--request", paramLabel = "<text>", description = "Classify this request text instead")
    String request;

    @Option(names = "--json", description = "Print the decision as JSON")
    boolean json;

    @Parameters(paramLabel = "<field=value>", arity = "0..*", description = "Criteria fields")
    Map<String, String> fields = new LinkedHashMap<>();

    @Override
    public Integer call() throws Exception {
        RouterConfig config = config();
        HitPolicy hitPolicy = WireEnum.lookup(HitPolicy.class, policy);
        if (hitPolicy == null) {
            throw new ParameterException(
                    spec.commandLine(),
                    "--policy must be one of " + WireEnum.wireNames(HitPolicy.class) + ", got: " + policy);
        }
        if (request != null && !fields.isEmpty()) {
            throw new ParameterException(spec.commandLine(), "Give either --request or field=value pairs, not both");
        }
        if (request == null && fields.isEmpty()) {
            throw new ParameterException(spec.commandLine(), "Missing criteria: give field=value pairs or --request");
        }

        Criteria criteria =
                request != null ? KeywordCriteriaExtractor.withDefaultTable().extract(request) : Criteria.fromWire(fields);
        DecisionEngine engine =
                loadEngine(rules != null ? rules : config.rules(), ConfigLoader.shadowPolicy(config), hitPolicy);
        DecisionResult result = engine.evaluate(criteria);

        if (json) {
            out().println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(criteria, result)));
        } else {
            print(criteria, result);
        }
        out().flush();
        return RouterCommand.EXIT_OK;
    }

    private void print(Criteria criteria, DecisionResult result) {
        out().printf("criteria:  %s%n", criteria.toWireMap());
        out().printf("targets:   %s%n", String.join(", ", result.targetNames()));
        if (!result.operationHints().isEmpty()) {
            out().printf("hints:     %s%n", String.join(", ", result.operationHints()));
        }
        if (result.matchedRuleId() != null) {
            out().printf("rule:      #%d %s%n", result.matchedRulePriority(), result.matchedRuleId());
        } else {
            out().printf("rules:     %s (%s)%n", result.matchedPriorities(), result.hitPolicy().wireName());
        }
        out().printf("rationale: %s%n", result.rationale());
        out().printf("ruleset:   %s%n", result.ruleSetKey());
    }

    private static ObjectNode toJson(Criteria criteria, DecisionResult result) {
        ObjectNode root = JSON.createObjectNode();
        ObjectNode criteriaNode = root.putObject("criteria");
        criteria.toWireMap().forEach(criteriaNode::put);
        result.targetNames().forEach(root.putArray("storage_targets")::add);
        result.operationHints().forEach(root.putArray("operation_hints")::add);
        root.put("rationale", result.rationale());
        if (result.matchedRuleId() != null) {
            root.put("matched_rule_priority", result.matchedRulePriority());
            root.put("matched_rule_id", result.matchedRuleId());
        }
        result.matchedPriorities().forEach(root.putArray("matched_priorities")::add);
        root.put("hit_policy", result.hitPolicy().wireName());
        root.put("ruleset", result.ruleSetKey());
        return root;
    }
}
