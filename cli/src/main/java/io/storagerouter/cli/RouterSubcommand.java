package io.storagerouter.cli;

import io.storagerouter.cli.config.ConfigLoader;
import io.storagerouter.cli.config.RouterConfig;
import io.storagerouter.core.engine.DecisionEngine;
import io.storagerouter.core.engine.ShadowPolicy;
import io.storagerouter.core.model.HitPolicy;
import io.storagerouter.core.spec.RuleSetParser;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Shared plumbing for subcommands: configuration resolution, logging setup, and
 * rule set loading from a location string.
 */
abstract class RouterSubcommand implements Callable<Integer> {

    static final String CLASSPATH_PREFIX = "classpath:";

    @ParentCommand
    RouterCommand root;

    @Spec
    CommandSpec spec;

    @Option(
            names = {"-c", "--config"},
            paramLabel = "<file>",
            description = "Configuration file (default: ./storage-router.yaml, then the bundled defaults)")
    Path configPath;

    /** Resolves configuration and applies its logging settings. */
    RouterConfig config() {
        RouterConfig config = ConfigLoader.resolve(configPath, root.envLookup());
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        return config;
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /**
     * Loads a rule set into a fresh engine.
     *
     * @param location {@code classpath:name} or a file path
     */
    static DecisionEngine loadEngine(String location, ShadowPolicy shadowPolicy, HitPolicy hitPolicy) {
        DecisionEngine engine = new DecisionEngine(new RuleSetParser(), shadowPolicy, hitPolicy);
        if (location.startsWith(CLASSPATH_PREFIX)) {
            engine.loadResource(location.substring(CLASSPATH_PREFIX.length()));
        } else {
            engine.load(Path.of(location));
        }
        return engine;
    }
}
