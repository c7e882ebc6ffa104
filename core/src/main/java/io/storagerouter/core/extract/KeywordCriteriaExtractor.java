package io.storagerouter.core.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.storagerouter.core.error.CriteriaParseException;
import io.storagerouter.core.error.CriteriaSchemaException;
import io.storagerouter.core.model.Criteria;
import io.storagerouter.core.model.CriteriaField;
import io.storagerouter.core.spi.CriteriaExtractor;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic reference extractor driven by a keyword table.
 *
 * <p>
 * For every criteria field the table lists candidate values in order, each with
 * a set of keywords. The first value whose keyword occurs in the lower-cased
 * request wins; otherwise the field's default applies. A field without a default
 * (by convention {@code storage_intent}) makes the request unclassifiable when no
 * keyword matches, which is reported as {@link CriteriaParseException}.
 *
 * <p>
 * Used as a baseline for the extractor phases of the validation harness and as a
 * stand-in when no model-backed extractor is available. Thread-safe; the table is
 * immutable after construction.
 */
public final class KeywordCriteriaExtractor implements CriteriaExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(KeywordCriteriaExtractor.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Bundled keyword table. */
    public static final String DEFAULT_TABLE = "/extractor/keywords.yaml";

    private final String name;
    private final Map<CriteriaField, FieldTable> table;

    private KeywordCriteriaExtractor(String name, Map<CriteriaField, FieldTable> table) {
        this.name = name;
        this.table = table;
    }

    /** Creates an extractor backed by the bundled keyword table. */
    public static KeywordCriteriaExtractor withDefaultTable() {
        return fromResource(DEFAULT_TABLE);
    }

    /**
     * Creates an extractor from a keyword table on the classpath.
     *
     * @throws IllegalArgumentException if the resource is missing or the table is
     *                                  invalid
     */
    public static KeywordCriteriaExtractor fromResource(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        String name = resource.startsWith("/") ? resource : "/" + resource;
        try (InputStream in = KeywordCriteriaExtractor.class.getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalArgumentException("Keyword table resource not found: " + name);
            }
            return fromYaml(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read keyword table " + name + ": " + e.getMessage(), e);
        }
    }

    /**
     * Creates an extractor from keyword table YAML.
     *
     * @throws IllegalArgumentException if the table names an undeclared field or
     *                                  value, or omits a field
     */
    public static KeywordCriteriaExtractor fromYaml(String yaml) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid keyword table YAML: " + e.getMessage(), e);
        }
        if (root == null || !root.path("fields").isObject()) {
            throw new IllegalArgumentException("Keyword table must contain a 'fields' mapping");
        }
        String name = root.path("name").asText("keyword");

        Map<CriteriaField, FieldTable> table = new EnumMap<>(CriteriaField.class);
        Iterator<Map.Entry<String, JsonNode>> fields = root.get("fields").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            CriteriaField field = CriteriaField.fromWire(entry.getKey());
            if (field == null) {
                throw new IllegalArgumentException("Keyword table names undeclared field '" + entry.getKey() + "'");
            }
            table.put(field, parseField(field, entry.getValue()));
        }
        for (CriteriaField field : CriteriaField.values()) {
            if (!table.containsKey(field)) {
                throw new IllegalArgumentException("Keyword table has no entry for field '" + field.wireName() + "'");
            }
        }
        return new KeywordCriteriaExtractor(name, table);
    }

    @Override
    public Criteria extract(String requestText) {
        if (requestText == null || requestText.isBlank()) {
            throw new CriteriaParseException("Request text is empty", requestText);
        }
        String text = requestText.toLowerCase(Locale.ROOT);
        Map<String, Object> wire = new LinkedHashMap<>();
        for (Map.Entry<CriteriaField, FieldTable> entry : table.entrySet()) {
            CriteriaField field = entry.getKey();
            String value = entry.getValue().classify(text);
            if (value == null) {
                throw new CriteriaParseException(
                        "No keyword for '" + field.wireName() + "' found in request", requestText);
            }
            wire.put(field.wireName(), value);
        }
        try {
            Criteria criteria = Criteria.fromWire(wire);
            LOG.debug("extract.classified extractor={} criteria={}", name, wire);
            return criteria;
        } catch (CriteriaSchemaException e) {
            // table values are validated at construction, so this means the table and vocabulary drifted
            throw new CriteriaParseException("Keyword table produced invalid criteria: " + e.getMessage(), e, requestText);
        }
    }

    @Override
    public String name() {
        return name;
    }

    // --- Table parsing ---

    private static FieldTable parseField(CriteriaField field, JsonNode node) {
        String defaultValue = null;
        if (node.hasNonNull("default")) {
            defaultValue = requireDeclared(field, node.get("default").asText());
        }
        List<Candidate> candidates = new ArrayList<>();
        for (JsonNode candidate : node.path("values")) {
            String value = requireDeclared(field, candidate.path("value").asText(null));
            List<String> keywords = new ArrayList<>();
            for (JsonNode keyword : candidate.path("keywords")) {
                String kw = keyword.asText().trim().toLowerCase(Locale.ROOT);
                if (!kw.isEmpty()) {
                    keywords.add(kw);
                }
            }
            if (keywords.isEmpty()) {
                throw new IllegalArgumentException(
                        "Keyword table value '" + value + "' of field '" + field.wireName() + "' has no keywords");
            }
            candidates.add(new Candidate(value, List.copyOf(keywords)));
        }
        return new FieldTable(List.copyOf(candidates), defaultValue);
    }

    private static String requireDeclared(CriteriaField field, String raw) {
        String value = field.normalize(raw);
        if (value == null) {
            throw new IllegalArgumentException(String.format(
                    "Keyword table uses undeclared value '%s' for field '%s' (expected one of %s)",
                    raw, field.wireName(), field.vocabulary()));
        }
        return value;
    }

    private record Candidate(String value, List<String> keywords) {

        boolean matches(String text) {
            for (String keyword : keywords) {
                if (text.contains(keyword)) {
                    return true;
                }
            }
            return false;
        }
    }

    private record FieldTable(List<Candidate> candidates, String defaultValue) {

        /** Winning value, the default, or null when neither applies. */
        String classify(String text) {
            for (Candidate candidate : candidates) {
                if (candidate.matches(text)) {
                    return candidate.value();
                }
            }
            return defaultValue;
        }
    }
}
