package io.storagerouter.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.storagerouter.core.engine.ShadowPolicy;
import io.storagerouter.core.model.WireEnum;
import io.storagerouter.harness.TargetMatchMode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link RouterConfig} from YAML with an environment variable overlay.
 *
 * <p>
 * Lookup order for the file: an explicit {@code --config} path, then
 * {@code storage-router.yaml} in the working directory, then the copy bundled on
 * the classpath.
 *
 * <pre>
 * rules: classpath:rulesets/reference.yaml
 * corpus: classpath:corpus/pinned-50.yaml
 * harness: { threshold: 0.85, repetitions: 3, workers: 4, match: exact }
 * engine: { shadow-policy: warn }
 * logging: { format: text, level: INFO }
 * </pre>
 *
 * <p>
 * Every key can be overridden by an environment variable, which takes precedence
 * over the YAML value. A variable counts as set only if it is defined and
 * non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** File looked up in the working directory when no path is given. */
    public static final String DEFAULT_CONFIG_FILE = "storage-router.yaml";

    private static final String BUNDLED_CONFIG = "/storage-router.yaml";
    private static final List<String> LOG_FORMATS = List.of("text", "json");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Resolves and loads the configuration.
     *
     * @param explicitPath {@code --config} value, or null
     * @param envLookup    environment variable lookup; null result means unset
     * @throws ConfigLoadException if an explicit file is missing, or any file is
     *                             malformed or holds an invalid value
     */
    public static RouterConfig resolve(Path explicitPath, Function<String, String> envLookup) {
        if (explicitPath != null) {
            return load(explicitPath, envLookup);
        }
        Path local = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.isRegularFile(local)) {
            return load(local, envLookup);
        }
        return loadBundled(envLookup);
    }

    /** Loads a config file, applying overrides from {@link System#getenv}. */
    public static RouterConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a config file, applying overrides from {@code envLookup}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static RouterConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return mapToConfig(YAML_MAPPER.readTree(in), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /** Loads the configuration bundled with the tool. */
    public static RouterConfig loadBundled(Function<String, String> envLookup) {
        try (InputStream in = ConfigLoader.class.getResourceAsStream(BUNDLED_CONFIG)) {
            if (in == null) {
                return mapToConfig(null, envLookup);
            }
            return mapToConfig(YAML_MAPPER.readTree(in), envLookup);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse bundled configuration", e);
        }
    }

    private static RouterConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        RouterConfig.Builder builder = RouterConfig.builder();

        // --- YAML mapping ---
        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration must be a YAML mapping");
            }
            if (root.has("rules")) builder.rules(root.get("rules").asText());
            if (root.has("corpus")) builder.corpus(root.get("corpus").asText());

            JsonNode harness = root.path("harness");
            if (harness.has("threshold")) builder.threshold(harness.get("threshold").asDouble());
            if (harness.has("repetitions")) builder.repetitions(harness.get("repetitions").asInt());
            if (harness.has("workers")) builder.workers(harness.get("workers").asInt());
            if (harness.has("match")) builder.match(harness.get("match").asText());

            JsonNode engine = root.path("engine");
            if (engine.has("shadow-policy")) builder.shadowPolicy(engine.get("shadow-policy").asText());

            JsonNode logging = root.path("logging");
            if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
            if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
        }

        // --- Environment variable overlay ---
        envString(envLookup, "ROUTER_RULES", builder::rules);
        envString(envLookup, "ROUTER_CORPUS", builder::corpus);
        envDouble(envLookup, "ROUTER_THRESHOLD", builder::threshold);
        envInt(envLookup, "ROUTER_REPETITIONS", builder::repetitions);
        envInt(envLookup, "ROUTER_WORKERS", builder::workers);
        envString(envLookup, "ROUTER_MATCH", builder::match);
        envString(envLookup, "ROUTER_SHADOW_POLICY", builder::shadowPolicy);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        return validate(builder.build());
    }

    /**
     * Checks ranges and vocabularies.
     *
     * @throws ConfigLoadException naming the offending key
     */
    public static RouterConfig validate(RouterConfig config) {
        if (config.threshold() < 0.0 || config.threshold() > 1.0) {
            throw new ConfigLoadException("harness.threshold must be between 0 and 1, got: " + config.threshold());
        }
        if (config.repetitions() < 1) {
            throw new ConfigLoadException("harness.repetitions must be at least 1, got: " + config.repetitions());
        }
        if (config.workers() < 1) {
            throw new ConfigLoadException("harness.workers must be at least 1, got: " + config.workers());
        }
        if (WireEnum.lookup(TargetMatchMode.class, config.match()) == null) {
            throw new ConfigLoadException("harness.match must be one of "
                    + WireEnum.wireNames(TargetMatchMode.class) + ", got: " + config.match());
        }
        shadowPolicy(config);
        if (!LOG_FORMATS.contains(config.loggingFormat().toLowerCase(Locale.ROOT))) {
            throw new ConfigLoadException(
                    "logging.format must be one of " + LOG_FORMATS + ", got: " + config.loggingFormat());
        }
        return config;
    }

    /** The configured shadow policy as an engine constant. */
    public static ShadowPolicy shadowPolicy(RouterConfig config) {
        try {
            return ShadowPolicy.valueOf(config.shadowPolicy().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "engine.shadow-policy must be one of [warn, strict], got: " + config.shadowPolicy(), e);
        }
    }

    /** The configured match mode as a harness constant. */
    public static TargetMatchMode matchMode(RouterConfig config) {
        return WireEnum.lookup(TargetMatchMode.class, config.match());
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + raw, e);
            }
        }
    }

    private static void envDouble(Function<String, String> envLookup, String envVar, DoubleConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Double.parseDouble(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be a number, got: " + raw, e);
            }
        }
    }
}
