package io.storagerouter.harness;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.storagerouter.core.model.StorageTarget;
import io.storagerouter.core.model.WireEnum;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads corpus YAML files.
 *
 * <pre>
 * corpus: pinned-50
 * version: "1.0.0"
 * cases:
 *   - id: memory-01
 *     category: memory
 *     request: "Remember that I prefer dark mode"
 *     criteria: { storage_intent: memory, access_pattern: crud, ... }
 *     expected: { targets: [memory] }
 *     fix-needed: false
 * </pre>
 *
 * <p>
 * Criteria values are not checked here; see {@link ValidationCase}.
 */
public final class CorpusLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private CorpusLoader() {}

    /**
     * Loads a corpus from a file.
     *
     * @throws CorpusLoadException if the file cannot be read or is malformed
     */
    public static Corpus load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        try {
            return parse(Files.readString(path), source);
        } catch (IOException e) {
            throw new CorpusLoadException("Failed to read corpus: " + e.getMessage(), e, source);
        }
    }

    /**
     * Loads a corpus bundled on the classpath.
     *
     * @param resource resource name, e.g. {@code corpus/pinned-50.yaml}
     */
    public static Corpus loadResource(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        String name = resource.startsWith("/") ? resource : "/" + resource;
        String source = "classpath:" + name.substring(1);
        try (InputStream in = CorpusLoader.class.getResourceAsStream(name)) {
            if (in == null) {
                throw new CorpusLoadException("Corpus resource not found", source);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), source);
        } catch (IOException e) {
            throw new CorpusLoadException("Failed to read corpus: " + e.getMessage(), e, source);
        }
    }

    /**
     * Loads from a location string: {@code classpath:name} or a file path.
     */
    public static Corpus loadLocation(String location) {
        Objects.requireNonNull(location, "location must not be null");
        if (location.startsWith("classpath:")) {
            return loadResource(location.substring("classpath:".length()));
        }
        return load(Path.of(location));
    }

    /**
     * Parses corpus YAML held in memory.
     *
     * @param content YAML text
     * @param source  label used in error messages
     */
    public static Corpus parse(String content, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(content);
        } catch (IOException e) {
            throw new CorpusLoadException("Failed to parse corpus YAML: " + e.getMessage(), e, source);
        }
        if (root == null || !root.isObject()) {
            throw new CorpusLoadException("Corpus YAML must be a mapping at the top level", source);
        }
        String id = requireText(root, "corpus", "corpus", source);
        String version = requireText(root, "version", "corpus", source);
        JsonNode casesNode = root.path("cases");
        if (!casesNode.isArray() || casesNode.isEmpty()) {
            throw new CorpusLoadException("Corpus '" + id + "' must contain a non-empty 'cases' list", source);
        }

        List<ValidationCase> cases = new ArrayList<>(casesNode.size());
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < casesNode.size(); i++) {
            ValidationCase validationCase = parseCase(casesNode.get(i), i, source);
            if (!ids.add(validationCase.id())) {
                throw new CorpusLoadException("Duplicate case id '" + validationCase.id() + "'", source);
            }
            cases.add(validationCase);
        }
        return new Corpus(id, version, cases);
    }

    // --- Private helpers ---

    private static ValidationCase parseCase(JsonNode node, int index, String source) {
        String where = "case #" + index;
        String id = requireText(node, "id", where, source);
        where = "case '" + id + "'";
        String category = requireText(node, "category", where, source);
        String request = node.hasNonNull("request") ? node.get("request").asText() : null;
        Map<String, String> criteria = readCriteria(node.get("criteria"), where, source);

        JsonNode expected = node.path("expected");
        Set<StorageTarget> targets = EnumSet.noneOf(StorageTarget.class);
        for (JsonNode targetNode : expected.path("targets")) {
            StorageTarget target = WireEnum.lookup(StorageTarget.class, targetNode.asText());
            if (target == null) {
                throw new CorpusLoadException(
                        String.format(
                                "%s expects undeclared storage target '%s' (expected one of %s)",
                                where, targetNode.asText(), WireEnum.wireNames(StorageTarget.class)),
                        source);
            }
            targets.add(target);
        }
        Map<String, String> expectedCriteria = readCriteria(expected.get("criteria"), where, source);

        if (request == null && criteria == null) {
            throw new CorpusLoadException(where + " has neither 'request' nor 'criteria'", source);
        }
        String notes = node.hasNonNull("notes") ? node.get("notes").asText() : null;
        boolean fixNeeded = node.path("fix-needed").asBoolean(false);
        return new ValidationCase(id, category, request, criteria, targets, expectedCriteria, notes, fixNeeded);
    }

    private static Map<String, String> readCriteria(JsonNode node, String where, String source) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new CorpusLoadException(where + ": criteria must be a mapping", source);
        }
        Map<String, String> criteria = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            criteria.put(entry.getKey(), entry.getValue().isNull() ? null : entry.getValue().asText());
        }
        return criteria;
    }

    private static String requireText(JsonNode node, String field, String where, String source) {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.asText().isBlank()) {
            throw new CorpusLoadException(where + " is missing required field '" + field + "'", source);
        }
        return value.asText();
    }
}
