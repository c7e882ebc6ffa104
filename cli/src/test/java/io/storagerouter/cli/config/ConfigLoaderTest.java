package io.storagerouter.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.storagerouter.core.engine.ShadowPolicy;
import io.storagerouter.harness.TargetMatchMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    @Nested
    @DisplayName("YAML mapping")
    class YamlMapping {

        @Test
        @DisplayName("every key is read from a full config")
        void fullConfig() throws Exception {
            RouterConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV);

            assertThat(config.rules()).isEqualTo("rules/custom.yaml");
            assertThat(config.corpus()).isEqualTo("corpus/regression.yaml");
            assertThat(config.threshold()).isEqualTo(0.9);
            assertThat(config.repetitions()).isEqualTo(5);
            assertThat(config.workers()).isEqualTo(2);
            assertThat(config.match()).isEqualTo("superset");
            assertThat(config.shadowPolicy()).isEqualTo("strict");
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
            assertThat(ConfigLoader.shadowPolicy(config)).isEqualTo(ShadowPolicy.STRICT);
            assertThat(ConfigLoader.matchMode(config)).isEqualTo(TargetMatchMode.SUPERSET);
        }

        @Test
        @DisplayName("absent keys keep their defaults")
        void minimalConfig() throws Exception {
            RouterConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV);

            assertThat(config.threshold()).isEqualTo(0.8);
            assertThat(config.rules()).isEqualTo(RouterConfig.DEFAULT_RULES);
            assertThat(config.corpus()).isEqualTo(RouterConfig.DEFAULT_CORPUS);
            assertThat(config.repetitions()).isEqualTo(3);
            assertThat(config.workers()).isEqualTo(4);
            assertThat(ConfigLoader.matchMode(config)).isEqualTo(TargetMatchMode.EXACT);
            assertThat(ConfigLoader.shadowPolicy(config)).isEqualTo(ShadowPolicy.WARN);
        }

        @Test
        void emptyFileMeansDefaults(@TempDir Path dir) throws Exception {
            Path empty = Files.writeString(dir.resolve("empty.yaml"), "");

            assertThat(ConfigLoader.load(empty, NO_ENV)).isEqualTo(RouterConfig.builder().build());
        }

        @Test
        void bundledConfigMatchesDefaults() {
            assertThat(ConfigLoader.loadBundled(NO_ENV)).isEqualTo(RouterConfig.builder().build());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void missingFile(@TempDir Path dir) {
            Path missing = dir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found")
                    .hasMessageContaining("--config");
        }

        @Test
        void malformedYaml(@TempDir Path dir) throws Exception {
            Path broken = Files.writeString(dir.resolve("broken.yaml"), "harness: [unclosed");

            assertThatThrownBy(() -> ConfigLoader.load(broken, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML configuration");
        }

        @Test
        void topLevelMustBeMapping() throws Exception {
            Path path = fixture("not-a-mapping.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Configuration must be a YAML mapping");
        }

        @Test
        void thresholdOutOfRange() throws Exception {
            Path path = fixture("bad-threshold.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("harness.threshold must be between 0 and 1");
        }

        @Test
        void unknownMatchMode() throws Exception {
            Path path = fixture("bad-match.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("harness.match must be one of [exact, superset]")
                    .hasMessageContaining("fuzzy");
        }

        @Test
        void unknownShadowPolicy() {
            RouterConfig config = RouterConfig.builder().shadowPolicy("lenient").build();

            assertThatThrownBy(() -> ConfigLoader.validate(config))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("engine.shadow-policy must be one of [warn, strict]");
        }

        @Test
        void unknownLogFormat() {
            RouterConfig config = RouterConfig.builder().loggingFormat("xml").build();

            assertThatThrownBy(() -> ConfigLoader.validate(config))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("logging.format");
        }

        @Test
        void zeroWorkers() {
            RouterConfig config = RouterConfig.builder().workers(0).build();

            assertThatThrownBy(() -> ConfigLoader.validate(config))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("harness.workers must be at least 1");
        }
    }

    @Test
    @DisplayName("explicit path wins over the bundled defaults")
    void resolveExplicitPath() throws Exception {
        RouterConfig config = ConfigLoader.resolve(fixture("full-config.yaml"), Map.<String, String>of()::get);

        assertThat(config.workers()).isEqualTo(2);
    }
}
