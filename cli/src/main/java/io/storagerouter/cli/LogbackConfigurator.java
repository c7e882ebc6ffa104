package io.storagerouter.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.slf4j.LoggerFactory;

/**
 * Points Logback at standard error in the format and level the router
 * configuration asks for.
 *
 * <p>
 * {@code validate} prints its summary and {@code evaluate --json} prints a decision
 * on standard output, where CI scripts parse them. Engine and harness logs
 * ({@code ruleset.loaded}, {@code harness.completed}, per-case DEBUG lines) must
 * never interleave with that output, so the single console appender always
 * targets {@code System.err}. {@code logging.format: json} switches to Logback's
 * {@link JsonEncoder} for log collectors. Called once per command, after
 * {@code --config} and the environment overlay are resolved.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";
    static final String APPENDER_NAME = "STDERR";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Reconfigures the root logger.
     *
     * @param format "json" for structured output, anything else for text
     * @param level  root level name; unknown names fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(Level.toLevel(level, Level.INFO));
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");

        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            appender.setEncoder(encoder);
        } else {
            PatternLayoutEncoder encoder = new PatternLayoutEncoder();
            encoder.setContext(context);
            encoder.setPattern(TEXT_PATTERN);
            encoder.start();
            appender.setEncoder(encoder);
        }

        appender.start();
        rootLogger.addAppender(appender);

        // schema validator internals are chatty at DEBUG
        context.getLogger("com.networknt").setLevel(Level.WARN);
    }
}
