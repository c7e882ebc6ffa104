package io.storagerouter.cli;

import io.storagerouter.cli.config.ConfigLoadException;
import io.storagerouter.core.error.CriteriaParseException;
import io.storagerouter.core.error.CriteriaSchemaException;
import io.storagerouter.core.error.RouterException;
import io.storagerouter.core.error.RuleSetIntegrityException;
import io.storagerouter.harness.CorpusLoadException;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;

/**
 * Top-level command. Routes to {@code validate}, {@code evaluate} and
 * {@code lint}.
 *
 * <p>
 * Exit codes: {@value #EXIT_OK} success, {@value #EXIT_GATE_FAILED} accuracy
 * below the threshold, {@value #EXIT_USAGE} usage or input error,
 * {@value #EXIT_LOAD_ERROR} configuration, rule set or corpus could not be
 * loaded.
 */
@Command(
        name = "storage-router",
        mixinStandardHelpOptions = true,
        version = "storage-router 0.1.0",
        description = "Decision-table storage routing: validate rule sets against labeled corpora",
        subcommands = {ValidateCommand.class, EvaluateCommand.class, LintCommand.class, CommandLine.HelpCommand.class})
public class RouterCommand implements Runnable {

    public static final int EXIT_OK = 0;
    public static final int EXIT_GATE_FAILED = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_LOAD_ERROR = 3;

    private static final Logger LOG = LoggerFactory.getLogger(RouterCommand.class);

    private final Function<String, String> envLookup;

    @Spec
    private CommandSpec spec;

    public RouterCommand() {
        this(System::getenv);
    }

    /**
     * @param envLookup environment variable lookup used for configuration overrides
     */
    public RouterCommand(Function<String, String> envLookup) {
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
    }

    Function<String, String> envLookup() {
        return envLookup;
    }

    @Override
    public void run() {
        // no subcommand given
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /** A command line with the exit code mapping installed. */
    public static CommandLine newCommandLine(RouterCommand root) {
        CommandLine commandLine = new CommandLine(root);
        commandLine.setExecutionExceptionHandler(RouterCommand::handleExecutionException);
        return commandLine;
    }

    private static int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        PrintWriter err = commandLine.getErr();
        ConsoleOutput.error(err, ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        if (ex instanceof RuleSetIntegrityException integrity) {
            for (String finding : integrity.findings()) {
                ConsoleOutput.detail(err, finding);
            }
        }
        int exitCode = exitCodeFor(ex);
        if (exitCode == EXIT_LOAD_ERROR && !isExpected(ex)) {
            LOG.error("Command failed: {}", ex.getMessage(), ex);
        }
        return exitCode;
    }

    static int exitCodeFor(Exception ex) {
        if (ex instanceof CriteriaSchemaException || ex instanceof CriteriaParseException) {
            return EXIT_USAGE;
        }
        return EXIT_LOAD_ERROR;
    }

    private static boolean isExpected(Exception ex) {
        return ex instanceof RouterException
                || ex instanceof CorpusLoadException
                || ex instanceof ConfigLoadException
                || ex instanceof IOException;
    }
}
