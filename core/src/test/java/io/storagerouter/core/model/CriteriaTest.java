package io.storagerouter.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.storagerouter.core.error.CriteriaSchemaException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CriteriaTest {

    private static Map<String, Object> wire() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("storage_intent", "database");
        raw.put("access_pattern", "query");
        raw.put("analytic_intent", true);
        raw.put("data_type", "structured");
        raw.put("search_intensity", "none");
        return raw;
    }

    @Nested
    @DisplayName("fromWire")
    class FromWire {

        @Test
        void bindsAllFields() {
            Criteria criteria = Criteria.fromWire(wire());

            assertThat(criteria.storageIntent()).isEqualTo(StorageIntent.DATABASE);
            assertThat(criteria.accessPattern()).isEqualTo(AccessPattern.QUERY);
            assertThat(criteria.analyticIntent()).isTrue();
            assertThat(criteria.dataType()).isEqualTo(DataType.STRUCTURED);
            assertThat(criteria.searchIntensity()).isEqualTo(SearchIntensity.NONE);
        }

        @Test
        void normalizesCaseAndWhitespace() {
            Map<String, Object> raw = wire();
            raw.put("storage_intent", "  Memory ");
            raw.put("analytic_intent", "FALSE");

            Criteria criteria = Criteria.fromWire(raw);

            assertThat(criteria.storageIntent()).isEqualTo(StorageIntent.MEMORY);
            assertThat(criteria.analyticIntent()).isFalse();
        }

        @Test
        void acceptsWireEnumValues() {
            Map<String, Object> raw = wire();
            raw.put("data_type", DataType.BINARY);

            assertThat(Criteria.fromWire(raw).dataType()).isEqualTo(DataType.BINARY);
        }

        @Test
        @DisplayName("Undeclared value → CriteriaSchemaException naming field and value")
        void undeclaredValueRejected() {
            Map<String, Object> raw = wire();
            raw.put("data_type", "unrecognized");

            assertThatThrownBy(() -> Criteria.fromWire(raw))
                    .isInstanceOf(CriteriaSchemaException.class)
                    .hasMessageContaining("unrecognized")
                    .satisfies(e -> {
                        CriteriaSchemaException ex = (CriteriaSchemaException) e;
                        assertThat(ex.field()).isEqualTo("data_type");
                        assertThat(ex.value()).isEqualTo("unrecognized");
                    });
        }

        @Test
        void missingFieldRejected() {
            Map<String, Object> raw = wire();
            raw.remove("search_intensity");

            assertThatThrownBy(() -> Criteria.fromWire(raw))
                    .isInstanceOf(CriteriaSchemaException.class)
                    .hasMessageContaining("search_intensity");
        }

        @Test
        void nullValueRejected() {
            Map<String, Object> raw = wire();
            raw.put("access_pattern", null);

            assertThatThrownBy(() -> Criteria.fromWire(raw))
                    .isInstanceOf(CriteriaSchemaException.class)
                    .extracting(e -> ((CriteriaSchemaException) e).field())
                    .isEqualTo("access_pattern");
        }

        @Test
        void undeclaredFieldRejected() {
            Map<String, Object> raw = wire();
            raw.put("urgency", "high");

            assertThatThrownBy(() -> Criteria.fromWire(raw))
                    .isInstanceOf(CriteriaSchemaException.class)
                    .hasMessageContaining("urgency");
        }

        @Test
        void nullMapRejected() {
            assertThatThrownBy(() -> Criteria.fromWire(null)).isInstanceOf(CriteriaSchemaException.class);
        }
    }

    @Test
    void constructorRejectsNullField() {
        assertThatThrownBy(() -> new Criteria(StorageIntent.FILE, null, false, DataType.TEXT, SearchIntensity.NONE))
                .isInstanceOf(CriteriaSchemaException.class)
                .hasMessageContaining("access_pattern");
    }

    @Test
    void allCombinationsEnumeratesTheWholeSpace() {
        assertThat(Criteria.allCombinations()).hasSize(4 * 4 * 2 * 4 * 3);
        assertThat(new HashSet<>(Criteria.allCombinations())).hasSize(384);
    }

    @Test
    void toWireMapUsesFieldOrder() {
        Criteria criteria = Criteria.fromWire(wire());

        assertThat(criteria.toWireMap())
                .containsExactly(
                        Map.entry("storage_intent", "database"),
                        Map.entry("access_pattern", "query"),
                        Map.entry("analytic_intent", "true"),
                        Map.entry("data_type", "structured"),
                        Map.entry("search_intensity", "none"));
        assertThat(Criteria.fromWire(criteria.toWireMap())).isEqualTo(criteria);
    }

    @Test
    @DisplayName("case-insensitive matching does not depend on the default locale")
    void caseFoldingIgnoresTurkishLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertThat(WireEnum.lookup(StorageIntent.class, "FILE")).isEqualTo(StorageIntent.FILE);
            assertThat(CriteriaField.fromWire("STORAGE_INTENT")).isEqualTo(CriteriaField.STORAGE_INTENT);
            assertThat(CriteriaField.STORAGE_INTENT.normalize(" FILE ")).isEqualTo("file");
            assertThat(CriteriaField.DATA_TYPE.normalize("BINARY")).isEqualTo("binary");
        } finally {
            Locale.setDefault(original);
        }
    }
}
