package io.storagerouter.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.storagerouter.core.error.RuleSetParseException;
import io.storagerouter.core.model.AccessPattern;
import io.storagerouter.core.model.Criteria;
import io.storagerouter.core.model.DataType;
import io.storagerouter.core.model.SearchIntensity;
import io.storagerouter.core.model.StorageIntent;
import io.storagerouter.core.spec.RuleSetParser;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Log entries emitted by the engine: one INFO line per published rule set, one WARN
 * per shadowed rule, one DEBUG line per decision.
 */
@DisplayName("StructuredLoggingTest")
class StructuredLoggingTest {

    private DecisionEngine engine;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger engineLogger;
    private Level previousLevel;

    @BeforeEach
    void setUp() {
        engine = new DecisionEngine(new RuleSetParser());

        // Attach a log capture appender to DecisionEngine's logger
        engineLogger = (Logger) LoggerFactory.getLogger(DecisionEngine.class);
        previousLevel = engineLogger.getLevel();
        engineLogger.setLevel(Level.DEBUG);
        logAppender = new ListAppender<>();
        logAppender.start();
        engineLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        engineLogger.detachAppender(logAppender);
        engineLogger.setLevel(previousLevel);
        logAppender.stop();
    }

    private List<ILoggingEvent> entries(String marker) {
        return logAppender.list.stream()
                .filter(e -> e.getFormattedMessage().contains(marker))
                .toList();
    }

    @Test
    @DisplayName("Load → ruleset.loaded entry with id, version and rule count")
    void loadEmitsSummary() {
        engine.loadResource("rulesets/reference.yaml");

        List<ILoggingEvent> loaded = entries("ruleset.loaded");
        assertThat(loaded).hasSize(1);
        assertThat(loaded.get(0).getLevel()).isEqualTo(Level.INFO);
        assertThat(loaded.get(0).getFormattedMessage())
                .contains("ruleset_id=storage-routing", "version=1.0.0", "rules=11", "warnings=0", "previous=none");
    }

    @Test
    @DisplayName("Reload → previous snapshot key logged")
    void reloadNamesPreviousSnapshot() {
        engine.loadResource("rulesets/reference.yaml");
        engine.loadResource("rulesets/reference.yaml");

        assertThat(entries("ruleset.loaded").get(1).getFormattedMessage())
                .contains("previous=storage-routing@1.0.0");
    }

    @Test
    @DisplayName("Shadowed rule → WARN entry per rule")
    void shadowedRuleWarns() {
        engine.load("""
                ruleset: shadowed
                version: "1"
                rules:
                  - id: memory
                    when: { storage_intent: memory }
                    then: { targets: [memory], rationale: m }
                  - id: memory-text
                    when: { storage_intent: memory, data_type: text }
                    then: { targets: [vector_store], rationale: v }
                  - id: default
                    when: "*"
                    then: { targets: [file_store], rationale: f }
                """, "inline");

        List<ILoggingEvent> warnings = entries("ruleset.shadowed");
        assertThat(warnings).singleElement().satisfies(e -> {
            assertThat(e.getLevel()).isEqualTo(Level.WARN);
            assertThat(e.getFormattedMessage()).contains("'memory-text'");
        });
    }

    @Test
    @DisplayName("Rejected load → WARN entry with source")
    void rejectedLoadWarns() {
        assertThatThrownBy(() -> engine.load("ruleset: x", "bad.yaml")).isInstanceOf(RuleSetParseException.class);

        assertThat(entries("ruleset.rejected"))
                .singleElement()
                .extracting(ILoggingEvent::getFormattedMessage)
                .asString()
                .contains("source=bad.yaml");
    }

    @Test
    @DisplayName("Decision → DEBUG entry with rule and targets")
    void decisionLogged() {
        engine.loadResource("rulesets/reference.yaml");

        engine.evaluate(
                new Criteria(StorageIntent.VECTOR, AccessPattern.SEARCH, false, DataType.TEXT, SearchIntensity.HIGH));

        assertThat(entries("decision.matched")).singleElement().satisfies(e -> {
            assertThat(e.getLevel()).isEqualTo(Level.DEBUG);
            assertThat(e.getFormattedMessage())
                    .contains("ruleset=storage-routing@1.0.0", "rule_id=vector-explicit", "targets=[vector_store]");
        });
    }
}
