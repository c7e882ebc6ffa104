package io.storagerouter.harness;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.storagerouter.core.model.WireEnum;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Machine-readable form of a {@link ValidationReport}.
 *
 * <p>
 * The JSON carries the per-case outcomes plus the derived aggregates
 * (accuracy, grade, per-category and per-field figures) for consumers that
 * do not recompute them. {@link #read} uses only the per-case data, so a report
 * read back reproduces the same aggregates.
 *
 * <pre>{@code
 * {
 *   "phase": "engine",
 *   "ruleset": "storage-routing@1.0.0",
 *   "corpus": "pinned-50@1.0.0",
 *   "accuracy": 1.0,
 *   "grade": "EXCELLENT",
 *   "cases": [ { "id": "memory-01", "status": "PASS", ... } ]
 * }
 * }</pre>
 *
 * <p>
 * Thread-safe; all methods are stateless.
 */
public final class JsonReportCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonReportCodec() {
        // utility class
    }

    /** Builds the JSON tree for {@code report}. */
    public static ObjectNode toJson(ValidationReport report) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("phase", report.phase().wireName());
        root.put("ruleset", report.ruleSetKey());
        root.put("extractor", report.extractorName());
        root.put("corpus", report.corpusKey());
        root.put("match", report.matchMode().wireName());
        root.put("repetitions", report.repetitions());
        root.put("generated_at", report.generatedAt().toString());

        root.put("total", report.totalCases());
        root.put("passed", report.passedCases());
        root.put("accuracy", report.accuracy());
        root.put("grade", report.grade().name());
        root.put("hard_failure_rate", report.hardFailureRate());
        root.put("extraction_failure_rate", report.extractionFailureRate());
        root.put("consistency", report.consistency());

        ObjectNode categories = root.putObject("categories");
        report.categoryStats().forEach((category, stats) -> {
            ObjectNode node = categories.putObject(category);
            node.put("passed", stats.passed());
            node.put("total", stats.total());
            node.put("accuracy", stats.accuracy());
        });
        CategoryStats fixNeeded = report.fixNeededStats();
        ObjectNode fixNode = root.putObject("fix_needed");
        fixNode.put("passed", fixNeeded.passed());
        fixNode.put("total", fixNeeded.total());
        ObjectNode fields = root.putObject("field_accuracy");
        report.fieldAccuracy().forEach(fields::put);

        LatencyStats latency = report.latency();
        ObjectNode latencyNode = root.putObject("latency_nanos");
        latencyNode.put("count", latency.count());
        latencyNode.put("p50", latency.p50());
        latencyNode.put("p90", latency.p90());
        latencyNode.put("p95", latency.p95());
        latencyNode.put("p99", latency.p99());
        latencyNode.put("max", latency.max());

        ArrayNode cases = root.putArray("cases");
        for (CaseOutcome outcome : report.outcomes()) {
            cases.add(caseNode(outcome));
        }
        return root;
    }

    /** Pretty-printed JSON text. */
    public static String toJsonString(ValidationReport report) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(report));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize report", e);
        }
    }

    /** Writes {@code report} to {@code path}, creating parent directories. */
    public static void write(ValidationReport report, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJsonString(report));
    }

    /**
     * Reads a report written by {@link #write}.
     *
     * @throws IOException              if the file cannot be read or is not JSON
     * @throws IllegalArgumentException if the JSON is not a report
     */
    public static ValidationReport read(Path path) throws IOException {
        return fromJson(MAPPER.readTree(path.toFile()));
    }

    /** Rebuilds a report from its JSON tree. */
    public static ValidationReport fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Report JSON must be an object");
        }
        ValidationPhase phase = requireEnum(ValidationPhase.class, root, "phase");
        TargetMatchMode matchMode = requireEnum(TargetMatchMode.class, root, "match");
        Instant generatedAt;
        try {
            generatedAt = Instant.parse(root.path("generated_at").asText());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Report has invalid 'generated_at': " + e.getMessage(), e);
        }

        List<CaseOutcome> outcomes = new ArrayList<>();
        for (JsonNode node : root.path("cases")) {
            outcomes.add(readCase(node));
        }
        JsonNode latency = root.path("latency_nanos");
        LatencyStats latencyStats = new LatencyStats(
                latency.path("count").asLong(),
                latency.path("p50").asLong(),
                latency.path("p90").asLong(),
                latency.path("p95").asLong(),
                latency.path("p99").asLong(),
                latency.path("max").asLong());

        return new ValidationReport(
                phase,
                textOrNull(root, "ruleset"),
                textOrNull(root, "extractor"),
                textOrNull(root, "corpus"),
                matchMode,
                root.path("repetitions").asInt(1),
                outcomes,
                latencyStats,
                generatedAt);
    }

    // --- Cases ---

    private static ObjectNode caseNode(CaseOutcome outcome) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", outcome.caseId());
        node.put("category", outcome.category());
        node.put("fix_needed", outcome.fixNeeded());
        node.put("status", outcome.status().name());
        ArrayNode expected = node.putArray("expected_targets");
        outcome.expectedTargets().forEach(expected::add);
        ArrayNode predicted = node.putArray("predicted_targets");
        outcome.predictedTargets().forEach(predicted::add);
        node.put("matched_rule_id", outcome.matchedRuleId());
        if (outcome.extractedCriteria() != null) {
            ObjectNode extracted = node.putObject("extracted_criteria");
            outcome.extractedCriteria().forEach(extracted::put);
        }
        if (!outcome.fieldMatches().isEmpty()) {
            ObjectNode matches = node.putObject("field_matches");
            outcome.fieldMatches().forEach(matches::put);
        }
        node.put("consistent", outcome.consistent());
        if (outcome.error() != null) {
            node.put("error", outcome.error());
        }
        return node;
    }

    private static CaseOutcome readCase(JsonNode node) {
        String id = node.path("id").asText(null);
        if (id == null) {
            throw new IllegalArgumentException("Report case is missing 'id'");
        }
        CaseStatus status;
        try {
            status = CaseStatus.valueOf(node.path("status").asText());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Report case '" + id + "' has unknown status '" + node.path("status").asText() + "'", e);
        }

        Map<String, String> extracted = null;
        if (node.has("extracted_criteria")) {
            extracted = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.get("extracted_criteria").fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                extracted.put(entry.getKey(), entry.getValue().asText());
            }
        }
        Map<String, Boolean> fieldMatches = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.path("field_matches").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            fieldMatches.put(entry.getKey(), entry.getValue().asBoolean());
        }

        return new CaseOutcome(
                id,
                node.path("category").asText(""),
                node.path("fix_needed").asBoolean(false),
                status,
                textList(node.path("expected_targets")),
                textList(node.path("predicted_targets")),
                textOrNull(node, "matched_rule_id"),
                extracted,
                fieldMatches,
                node.path("consistent").asBoolean(true),
                textOrNull(node, "error"));
    }

    // --- Helpers ---

    private static <E extends Enum<E> & WireEnum> E requireEnum(Class<E> type, JsonNode root, String field) {
        String raw = root.path(field).asText();
        E value = WireEnum.lookup(type, raw);
        if (value == null) {
            throw new IllegalArgumentException(String.format(
                    "Report has invalid '%s': '%s' (expected one of %s)", field, raw, WireEnum.wireNames(type)));
        }
        return value;
    }

    private static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(v -> values.add(v.asText()));
        return values;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
