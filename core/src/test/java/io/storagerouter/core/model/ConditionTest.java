package io.storagerouter.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ConditionTest {

    private static final Criteria DB_QUERY =
            new Criteria(StorageIntent.DATABASE, AccessPattern.QUERY, true, DataType.NUMERIC, SearchIntensity.NONE);

    @Test
    void wildcardMatchesEverything() {
        assertThat(Condition.any().isWildcard()).isTrue();
        assertThat(Criteria.allCombinations()).allMatch(Condition.any()::matches);
    }

    @Test
    void literalsMustAllMatch() {
        Condition condition = Condition.any()
                .and(CriteriaField.STORAGE_INTENT, "database")
                .and(CriteriaField.ANALYTIC_INTENT, "true");

        assertThat(condition.matches(DB_QUERY)).isTrue();
        assertThat(condition.and(CriteriaField.DATA_TYPE, "text").matches(DB_QUERY))
                .isFalse();
    }

    @Test
    void literalsAreNormalized() {
        Condition condition = new Condition(Map.of(CriteriaField.STORAGE_INTENT, " DATABASE "));

        assertThat(condition.literals()).containsEntry(CriteriaField.STORAGE_INTENT, "database");
    }

    @Test
    void undeclaredLiteralRejected() {
        assertThatThrownBy(() -> Condition.any().and(CriteriaField.SEARCH_INTENSITY, "extreme"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("extreme");
    }

    @Test
    void generalConditionSubsumesSpecificOne() {
        Condition general = Condition.any().and(CriteriaField.STORAGE_INTENT, "database");
        Condition specific = general.and(CriteriaField.ACCESS_PATTERN, "crud");

        assertThat(general.subsumes(specific)).isTrue();
        assertThat(specific.subsumes(general)).isFalse();
        assertThat(Condition.any().subsumes(specific)).isTrue();
    }

    @Test
    void disjointConditionsDoNotIntersect() {
        Condition memory = Condition.any().and(CriteriaField.STORAGE_INTENT, "memory");
        Condition file = Condition.any().and(CriteriaField.STORAGE_INTENT, "file");
        Condition textSearch = Condition.any().and(CriteriaField.DATA_TYPE, "text");

        assertThat(memory.intersects(file)).isFalse();
        assertThat(memory.intersects(textSearch)).isTrue();
    }

    @Test
    void describeListsLiteralsInFieldOrder() {
        Condition condition = Condition.any()
                .and(CriteriaField.SEARCH_INTENSITY, "high")
                .and(CriteriaField.STORAGE_INTENT, "vector");

        assertThat(condition.describe()).isEqualTo("storage_intent=vector, search_intensity=high");
        assertThat(Condition.any().describe()).isEqualTo("*");
    }
}
