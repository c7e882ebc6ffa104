package io.storagerouter.cli;

import io.storagerouter.cli.config.ConfigLoadException;
import io.storagerouter.cli.config.ConfigLoader;
import io.storagerouter.cli.config.RouterConfig;
import io.storagerouter.core.extract.KeywordCriteriaExtractor;
import io.storagerouter.core.model.HitPolicy;
import io.storagerouter.core.model.RuleSet;
import io.storagerouter.core.model.WireEnum;
import io.storagerouter.core.spi.CriteriaExtractor;
import io.storagerouter.harness.Corpus;
import io.storagerouter.harness.CorpusLoader;
import io.storagerouter.harness.HarnessOptions;
import io.storagerouter.harness.JsonReportCodec;
import io.storagerouter.harness.ReportComparison;
import io.storagerouter.harness.SummaryFormatter;
import io.storagerouter.harness.TargetMatchMode;
import io.storagerouter.harness.ValidationHarness;
import io.storagerouter.harness.ValidationPhase;
import io.storagerouter.harness.ValidationReport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

/**
 * Runs the validation harness over a labeled corpus and applies the accuracy
 * gate. Exits {@value RouterCommand#EXIT_GATE_FAILED} when accuracy falls below
 * the threshold.
 */
@Command(
        name = "validate",
        mixinStandardHelpOptions = true,
        description = "Score a rule set (and optionally an extractor) against a labeled corpus")
class ValidateCommand extends RouterSubcommand {

    private static final Logger LOG = LoggerFactory.getLogger(ValidateCommand.class);

    @Option(names = "--rules", paramLabel = "<location>", description = "Rule set file or classpath:name")
    String rules;

    @Option(names = "--corpus", paramLabel = "<location>", description = "Corpus file or classpath:name")
    String corpus;

    @Option(
            names = "--phase",
            paramLabel = "<phase>",
            defaultValue = "engine",
            description = "engine, extractor or end-to-end (default: ${DEFAULT-VALUE})")
    String phase;

    @Option(names = "--threshold", paramLabel = "<ratio>", description = "Minimum accuracy in [0, 1]")
    Double threshold;

    @Option(names = "--repetitions", paramLabel = "<n>", description = "Runs per case")
    Integer repetitions;

    @Option(names = "--workers", paramLabel = "<n>", description = "Worker threads")
    Integer workers;

    @Option(names = "--match", paramLabel = "<mode>", description = "exact or superset")
    String match;

    @Option(names = "--report", paramLabel = "<file>", description = "Write the JSON report here")
    Path report;

    @Option(names = "--baseline", paramLabel = "<file>", description = "Earlier JSON report to compare against")
    Path baseline;

    @Option(
            names = "--keywords",
            paramLabel = "<file>",
            description = "Keyword table for the extractor (default: bundled table)")
    Path keywords;

    @Override
    public Integer call() throws Exception {
        RouterConfig config = overrides(config());
        ValidationPhase validationPhase = WireEnum.lookup(ValidationPhase.class, phase);
        if (validationPhase == null) {
            throw new ParameterException(
                    spec.commandLine(),
                    "--phase must be one of " + WireEnum.wireNames(ValidationPhase.class) + ", got: " + phase);
        }
        TargetMatchMode matchMode = ConfigLoader.matchMode(config);

        Corpus loaded = CorpusLoader.loadLocation(config.corpus());
        RuleSet ruleSet = validationPhase.judgesTargets()
                ? loadEngine(config.rules(), ConfigLoader.shadowPolicy(config), HitPolicy.FIRST)
                        .ruleSet()
                : null;
        CriteriaExtractor extractor = validationPhase.usesExtractor() ? extractor() : null;

        ValidationHarness harness =
                new ValidationHarness(new HarnessOptions(config.repetitions(), config.workers(), matchMode));
        ValidationReport result =
                switch (validationPhase) {
                    case ENGINE_ONLY -> harness.runEngineOnly(loaded, ruleSet);
                    case EXTRACTOR_ONLY -> harness.runExtractorOnly(loaded, extractor);
                    case END_TO_END -> harness.runEndToEnd(loaded, extractor, ruleSet);
                };

        ReportComparison comparison = null;
        if (baseline != null) {
            comparison = ReportComparison.compare(JsonReportCodec.read(baseline), result);
        }
        out().print(SummaryFormatter.format(result, config.threshold(), comparison));
        out().flush();

        if (report != null) {
            JsonReportCodec.write(result, report);
            ConsoleOutput.info(err(), "Report written to " + report);
        }

        boolean passed = result.passes(config.threshold());
        LOG.info(
                "validate.gate phase={} accuracy={} threshold={} passed={}",
                validationPhase.wireName(),
                result.accuracy(),
                config.threshold(),
                passed);
        return passed ? RouterCommand.EXIT_OK : RouterCommand.EXIT_GATE_FAILED;
    }

    /** Applies command-line options over the file and environment settings. */
    private RouterConfig overrides(RouterConfig config) {
        RouterConfig merged = new RouterConfig(
                rules != null ? rules : config.rules(),
                corpus != null ? corpus : config.corpus(),
                threshold != null ? threshold : config.threshold(),
                repetitions != null ? repetitions : config.repetitions(),
                workers != null ? workers : config.workers(),
                match != null ? match : config.match(),
                config.shadowPolicy(),
                config.loggingFormat(),
                config.loggingLevel());
        try {
            return ConfigLoader.validate(merged);
        } catch (ConfigLoadException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private CriteriaExtractor extractor() throws IOException {
        if (keywords == null) {
            return KeywordCriteriaExtractor.withDefaultTable();
        }
        return KeywordCriteriaExtractor.fromYaml(Files.readString(keywords, StandardCharsets.UTF_8));
    }
}
