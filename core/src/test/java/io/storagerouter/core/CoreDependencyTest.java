package io.storagerouter.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies that the core module stays a plain library: no CLI framework and no
 * harness classes on its classpath.
 */
class CoreDependencyTest {

    /** Packages that MUST NOT appear on the core classpath. */
    private static final List<String> FORBIDDEN = List.of(
            "picocli", // CLI framework, cli module only
            "storage-router-harness", // harness module
            "storage-router-cli" // cli module
            );

    @Test
    void coreClasspathContainsNoOuterModules() {
        String classpath = System.getProperty("java.class.path");
        assertThat(classpath).as("java.class.path should be set").isNotNull();

        for (String forbidden : FORBIDDEN) {
            assertThat(classpath)
                    .as("Core classpath must not contain: %s", forbidden)
                    .doesNotContain(forbidden);
        }
    }
}
