package io.storagerouter.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Environment variables take precedence over YAML values. A variable counts as set
 * only when it is defined and non-blank after trimming.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path minimalConfigPath;
    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        minimalConfigPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/minimal-config.yaml")
                .toURI());
        fullConfigPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/full-config.yaml")
                .toURI());
        envVars.clear();
    }

    @Nested
    @DisplayName("String overrides")
    class StringOverrides {

        @Test
        @DisplayName("ROUTER_RULES overrides rules")
        void rules() {
            envVars.put("ROUTER_RULES", "/etc/router/rules.yaml");
            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).rules()).isEqualTo("/etc/router/rules.yaml");
        }

        @Test
        @DisplayName("ROUTER_CORPUS overrides corpus")
        void corpus() {
            envVars.put("ROUTER_CORPUS", "classpath:corpus/other.yaml");
            assertThat(ConfigLoader.load(minimalConfigPath, envLookup()).corpus())
                    .isEqualTo("classpath:corpus/other.yaml");
        }

        @Test
        @DisplayName("ROUTER_MATCH and ROUTER_SHADOW_POLICY override harness.match and engine.shadow-policy")
        void matchAndShadowPolicy() {
            envVars.put("ROUTER_MATCH", "superset");
            envVars.put("ROUTER_SHADOW_POLICY", "strict");
            RouterConfig config = ConfigLoader.load(minimalConfigPath, envLookup());
            assertThat(config.match()).isEqualTo("superset");
            assertThat(config.shadowPolicy()).isEqualTo("strict");
        }

        @Test
        @DisplayName("LOG_FORMAT and LOG_LEVEL override logging")
        void logging() {
            envVars.put("LOG_FORMAT", "text");
            envVars.put("LOG_LEVEL", "WARN");
            RouterConfig config = ConfigLoader.load(fullConfigPath, envLookup());
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        @DisplayName("values are trimmed")
        void trimmed() {
            envVars.put("ROUTER_MATCH", "  superset ");
            assertThat(ConfigLoader.load(minimalConfigPath, envLookup()).match()).isEqualTo("superset");
        }
    }

    @Nested
    @DisplayName("Numeric overrides")
    class NumericOverrides {

        @Test
        void threshold() {
            envVars.put("ROUTER_THRESHOLD", "0.95");
            assertThat(ConfigLoader.load(minimalConfigPath, envLookup()).threshold()).isEqualTo(0.95);
        }

        @Test
        void repetitionsAndWorkers() {
            envVars.put("ROUTER_REPETITIONS", "1");
            envVars.put("ROUTER_WORKERS", "16");
            RouterConfig config = ConfigLoader.load(fullConfigPath, envLookup());
            assertThat(config.repetitions()).isEqualTo(1);
            assertThat(config.workers()).isEqualTo(16);
        }

        @Test
        @DisplayName("non-numeric value names the variable")
        void notAnInteger() {
            envVars.put("ROUTER_WORKERS", "many");
            assertThatThrownBy(() -> ConfigLoader.load(minimalConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("ROUTER_WORKERS must be an integer, got: many");
        }

        @Test
        void notANumber() {
            envVars.put("ROUTER_THRESHOLD", "high");
            assertThatThrownBy(() -> ConfigLoader.load(minimalConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("ROUTER_THRESHOLD must be a number");
        }

        @Test
        @DisplayName("overridden values are still range-checked")
        void rangeChecked() {
            envVars.put("ROUTER_THRESHOLD", "2");
            assertThatThrownBy(() -> ConfigLoader.load(minimalConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("harness.threshold");
        }
    }

    @Nested
    @DisplayName("Unset semantics")
    class UnsetSemantics {

        @Test
        @DisplayName("empty value is treated as unset")
        void empty() {
            envVars.put("ROUTER_THRESHOLD", "");
            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).threshold()).isEqualTo(0.9);
        }

        @Test
        @DisplayName("whitespace-only value is treated as unset")
        void blank() {
            envVars.put("ROUTER_RULES", "   ");
            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).rules()).isEqualTo("rules/custom.yaml");
        }
    }
}
