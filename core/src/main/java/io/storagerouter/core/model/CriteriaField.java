package io.storagerouter.core.model;

import java.util.List;
import java.util.Locale;

/**
 * The fixed vocabulary of classification fields. Rule conditions, raw criteria maps,
 * corpora and extractor scoring all name fields through this enum, so adding a field
 * here is the only place the vocabulary changes.
 */
public enum CriteriaField {
    STORAGE_INTENT("storage_intent", WireEnum.wireNames(StorageIntent.class)),
    ACCESS_PATTERN("access_pattern", WireEnum.wireNames(AccessPattern.class)),
    ANALYTIC_INTENT("analytic_intent", List.of("true", "false")),
    DATA_TYPE("data_type", WireEnum.wireNames(DataType.class)),
    SEARCH_INTENSITY("search_intensity", WireEnum.wireNames(SearchIntensity.class));

    private final String wireName;
    private final List<String> vocabulary;

    CriteriaField(String wireName, List<String> vocabulary) {
        this.wireName = wireName;
        this.vocabulary = vocabulary;
    }

    /** Field name as written in artifacts (e.g. {@code storage_intent}). */
    public String wireName() {
        return wireName;
    }

    /** Every value this field may hold, as wire names. */
    public List<String> vocabulary() {
        return vocabulary;
    }

    /**
     * Normalizes a raw value (trimmed, lower-cased) and checks it against the
     * vocabulary.
     *
     * @return the normalized wire value, or {@code null} if undeclared
     */
    public String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return vocabulary.contains(normalized) ? normalized : null;
    }

    /** Reads this field from {@code criteria} as a wire value. */
    public String valueOf(Criteria criteria) {
        return switch (this) {
            case STORAGE_INTENT -> criteria.storageIntent().wireName();
            case ACCESS_PATTERN -> criteria.accessPattern().wireName();
            case ANALYTIC_INTENT -> Boolean.toString(criteria.analyticIntent());
            case DATA_TYPE -> criteria.dataType().wireName();
            case SEARCH_INTENSITY -> criteria.searchIntensity().wireName();
        };
    }

    /**
     * Looks up a field by wire name.
     *
     * @return the field, or {@code null} if {@code wireName} is not a declared field
     */
    public static CriteriaField fromWire(String wireName) {
        if (wireName == null) {
            return null;
        }
        String normalized = wireName.trim().toLowerCase(Locale.ROOT);
        for (CriteriaField field : values()) {
            if (field.wireName.equals(normalized)) {
                return field;
            }
        }
        return null;
    }
}
