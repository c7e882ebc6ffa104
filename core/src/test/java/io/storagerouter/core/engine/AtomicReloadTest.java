package io.storagerouter.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.storagerouter.core.error.RuleSetParseException;
import io.storagerouter.core.model.AccessPattern;
import io.storagerouter.core.model.Criteria;
import io.storagerouter.core.model.DataType;
import io.storagerouter.core.model.DecisionResult;
import io.storagerouter.core.model.SearchIntensity;
import io.storagerouter.core.model.StorageIntent;
import io.storagerouter.core.spec.RuleSetParser;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for the atomic snapshot swap on {@code DecisionEngine.load()}.
 *
 * <p>
 * Evaluations in flight complete against the snapshot they captured; evaluations
 * after the swap use the new rule set; a failed load leaves the old one active.
 */
class AtomicReloadTest {

    private static final Criteria MEMORY_REQUEST =
            new Criteria(StorageIntent.MEMORY, AccessPattern.CRUD, false, DataType.TEXT, SearchIntensity.NONE);

    private DecisionEngine engine;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        engine = new DecisionEngine(new RuleSetParser());
    }

    // --- Helper to write a rule set YAML ---

    private Path writeRuleSet(String filename, String version, String memoryTarget) throws Exception {
        String yaml = String.format("""
                ruleset: swap-test
                version: "%s"
                rules:
                  - id: memory
                    when: { storage_intent: memory }
                    then: { targets: [%s], rationale: "memory via {rule_id}" }
                  - id: default
                    when: "*"
                    then: { targets: [file_store], rationale: fallback }
                """, version, memoryTarget);
        Path path = tempDir.resolve(filename);
        Files.writeString(path, yaml);
        return path;
    }

    @Test
    void loadSwapsSnapshot() throws Exception {
        engine.load(writeRuleSet("v1.yaml", "1.0.0", "memory"));
        assertThat(engine.evaluate(MEMORY_REQUEST).targetNames()).containsExactly("memory");

        engine.load(writeRuleSet("v2.yaml", "2.0.0", "relational_store"));

        DecisionResult result = engine.evaluate(MEMORY_REQUEST);
        assertThat(result.targetNames()).containsExactly("relational_store");
        assertThat(result.ruleSetKey()).isEqualTo("swap-test@2.0.0");
        assertThat(engine.snapshot().source()).endsWith("v2.yaml");
    }

    @Test
    void failedLoadKeepsPreviousSnapshot() throws Exception {
        engine.load(writeRuleSet("v1.yaml", "1.0.0", "memory"));
        RuleSetSnapshot before = engine.snapshot();

        Path broken = tempDir.resolve("broken.yaml");
        Files.writeString(broken, "ruleset: swap-test\nrules: not-a-list\n");

        assertThatThrownBy(() -> engine.load(broken)).isInstanceOf(RuleSetParseException.class);
        assertThat(engine.snapshot()).isSameAs(before);
        assertThat(engine.evaluate(MEMORY_REQUEST).ruleSetKey()).isEqualTo("swap-test@1.0.0");
    }

    @Test
    void concurrentEvaluationsObserveConsistentSnapshot() throws Exception {
        // Each snapshot pairs a version with one target; a mix would pair them wrongly.
        Path v1 = writeRuleSet("conc-v1.yaml", "1.0.0", "memory");
        Path v2 = writeRuleSet("conc-v2.yaml", "2.0.0", "vector_store");
        engine.load(v1);

        int numReaders = 10;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numReaders);
        AtomicReference<Throwable> error = new AtomicReference<>();

        for (int i = 0; i < numReaders; i++) {
            Thread t = new Thread(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < 200; j++) {
                        DecisionResult r = engine.evaluate(MEMORY_REQUEST);
                        String expectedTarget = r.ruleSetKey().endsWith("1.0.0") ? "memory" : "vector_store";
                        assertThat(r.targetNames()).containsExactly(expectedTarget);
                    }
                } catch (Throwable t1) {
                    error.compareAndSet(null, t1);
                } finally {
                    doneLatch.countDown();
                }
            });
            t.setDaemon(true);
            t.start();
        }

        startLatch.countDown();
        for (int k = 0; k < 10; k++) {
            engine.load(k % 2 == 0 ? v2 : v1);
        }

        doneLatch.await();
        if (error.get() != null) {
            throw new AssertionError("Concurrent evaluation failed", error.get());
        }
    }
}
