package io.storagerouter.core.model;

import io.storagerouter.core.error.CriteriaSchemaException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classification of one storage request. Every field is required: a producer that
 * cannot classify a field must fail (with {@link CriteriaSchemaException} or, for
 * extractors, {@link io.storagerouter.core.error.CriteriaParseException}) rather
 * than leave it null.
 *
 * <p>
 * Immutable, thread-safe. Created per request and discarded after one evaluation.
 *
 * @param storageIntent   where the requester intends the data to live
 * @param accessPattern   how the data will be read back
 * @param analyticIntent  whether aggregation or analytical queries are expected
 * @param dataType        shape of the payload
 * @param searchIntensity how heavily the data will be similarity-searched
 */
public record Criteria(
        StorageIntent storageIntent,
        AccessPattern accessPattern,
        boolean analyticIntent,
        DataType dataType,
        SearchIntensity searchIntensity) {

    private static final List<Criteria> ALL = enumerate();

    /** Canonical constructor: rejects absent fields. */
    public Criteria {
        requirePresent(storageIntent, CriteriaField.STORAGE_INTENT);
        requirePresent(accessPattern, CriteriaField.ACCESS_PATTERN);
        requirePresent(dataType, CriteriaField.DATA_TYPE);
        requirePresent(searchIntensity, CriteriaField.SEARCH_INTENSITY);
    }

    /**
     * Binds a wire-named map (as produced by JSON/YAML or an extractor that emits
     * strings) to a typed criteria record. Values may be strings, booleans or
     * {@link WireEnum} constants.
     *
     * @param raw map of wire field name to value
     * @return the bound criteria
     * @throws CriteriaSchemaException if the map is null, names an undeclared field,
     *                                 omits a field, or holds an undeclared value
     */
    public static Criteria fromWire(Map<String, ?> raw) {
        if (raw == null) {
            throw new CriteriaSchemaException("Criteria must not be null", null, null);
        }
        for (String key : raw.keySet()) {
            if (CriteriaField.fromWire(key) == null) {
                throw new CriteriaSchemaException(
                        "Undeclared criteria field '" + key + "'; declared fields are: " + wireFieldNames(),
                        key,
                        String.valueOf(raw.get(key)));
            }
        }
        Map<CriteriaField, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            CriteriaField field = CriteriaField.fromWire(entry.getKey());
            values.put(field, bindValue(field, entry.getValue()));
        }
        for (CriteriaField field : CriteriaField.values()) {
            if (!values.containsKey(field)) {
                throw new CriteriaSchemaException(
                        "Missing required criteria field '" + field.wireName() + "'", field.wireName(), null);
            }
        }
        return new Criteria(
                WireEnum.lookup(StorageIntent.class, values.get(CriteriaField.STORAGE_INTENT)),
                WireEnum.lookup(AccessPattern.class, values.get(CriteriaField.ACCESS_PATTERN)),
                Boolean.parseBoolean(values.get(CriteriaField.ANALYTIC_INTENT)),
                WireEnum.lookup(DataType.class, values.get(CriteriaField.DATA_TYPE)),
                WireEnum.lookup(SearchIntensity.class, values.get(CriteriaField.SEARCH_INTENSITY)));
    }

    /**
     * Every distinct criteria value, in field-major enumeration order. The space is
     * finite and small, which lets the shadow analyzer decide reachability exactly.
     */
    public static List<Criteria> allCombinations() {
        return ALL;
    }

    /** Reads one field as a wire value. */
    public String get(CriteriaField field) {
        return field.valueOf(this);
    }

    /** Wire-named view in field declaration order. */
    public Map<String, String> toWireMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (CriteriaField field : CriteriaField.values()) {
            map.put(field.wireName(), field.valueOf(this));
        }
        return Collections.unmodifiableMap(map);
    }

    private static String bindValue(CriteriaField field, Object value) {
        if (value == null) {
            throw new CriteriaSchemaException(
                    "Missing required criteria field '" + field.wireName() + "'", field.wireName(), null);
        }
        String raw = value instanceof WireEnum wire ? wire.wireName() : value.toString();
        String normalized = field.normalize(raw);
        if (normalized == null) {
            throw new CriteriaSchemaException(
                    "Undeclared value '" + raw + "' for criteria field '" + field.wireName() + "'; expected one of "
                            + field.vocabulary(),
                    field.wireName(),
                    raw);
        }
        return normalized;
    }

    private static void requirePresent(Object value, CriteriaField field) {
        if (value == null) {
            throw new CriteriaSchemaException(
                    "Missing required criteria field '" + field.wireName() + "'", field.wireName(), null);
        }
    }

    private static List<String> wireFieldNames() {
        List<String> names = new ArrayList<>();
        for (CriteriaField field : CriteriaField.values()) {
            names.add(field.wireName());
        }
        return names;
    }

    private static List<Criteria> enumerate() {
        List<Criteria> all = new ArrayList<>();
        for (StorageIntent intent : StorageIntent.values()) {
            for (AccessPattern access : AccessPattern.values()) {
                for (boolean analytic : new boolean[] {false, true}) {
                    for (DataType type : DataType.values()) {
                        for (SearchIntensity search : SearchIntensity.values()) {
                            all.add(new Criteria(intent, access, analytic, type, search));
                        }
                    }
                }
            }
        }
        return List.copyOf(all);
    }
}
