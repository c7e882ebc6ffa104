package io.storagerouter.harness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.storagerouter.core.model.StorageTarget;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorpusLoaderTest {

    private static final String SMALL = """
            corpus: small
            version: "0.1"
            cases:
              - id: a
                category: memory
                request: "Remember my birthday"
                criteria: { storage_intent: memory, access_pattern: crud, analytic_intent: false, data_type: text, search_intensity: none }
                expected: { targets: [memory] }
              - id: b
                category: file
                request: "Export to Excel"
                expected:
                  targets: [file_store]
                  criteria: { storage_intent: file, access_pattern: crud, analytic_intent: false, data_type: binary, search_intensity: none }
                notes: "criteria only checked against the extractor"
                fix-needed: true
              - id: c
                category: multi
                criteria: { storage_intent: database, access_pattern: crud, analytic_intent: false, data_type: structured, search_intensity: high }
                expected: { targets: [vector_store, relational_store] }
            """;

    @Nested
    @DisplayName("Valid corpora")
    class Valid {

        @Test
        void parsesCasesInOrder() {
            Corpus corpus = CorpusLoader.parse(SMALL, "inline");

            assertThat(corpus.key()).isEqualTo("small@0.1");
            assertThat(corpus.cases()).extracting(ValidationCase::id).containsExactly("a", "b", "c");
            assertThat(corpus.categories()).containsExactly("memory", "file", "multi");
        }

        @Test
        void readsCriteriaAsWireStrings() {
            ValidationCase a = CorpusLoader.parse(SMALL, "inline").cases().get(0);

            assertThat(a.criteria())
                    .containsEntry("storage_intent", "memory")
                    .containsEntry("analytic_intent", "false");
            assertThat(a.expectedTargets()).containsExactly(StorageTarget.MEMORY);
            assertThat(a.fixNeeded()).isFalse();
        }

        @Test
        void expectedCriteriaAndFlags() {
            ValidationCase b = CorpusLoader.parse(SMALL, "inline").cases().get(1);

            assertThat(b.criteria()).isNull();
            assertThat(b.criteriaToExtract()).containsEntry("data_type", "binary");
            assertThat(b.notes()).contains("extractor");
            assertThat(b.fixNeeded()).isTrue();
        }

        @Test
        @DisplayName("cases are filtered by the inputs a phase needs")
        void casesForPhase() {
            Corpus corpus = CorpusLoader.parse(SMALL, "inline");

            assertThat(corpus.casesFor(ValidationPhase.ENGINE_ONLY))
                    .extracting(ValidationCase::id)
                    .containsExactly("a", "c");
            assertThat(corpus.casesFor(ValidationPhase.EXTRACTOR_ONLY))
                    .extracting(ValidationCase::id)
                    .containsExactly("a", "b");
            assertThat(corpus.casesFor(ValidationPhase.END_TO_END))
                    .extracting(ValidationCase::id)
                    .containsExactly("a", "b");
        }

        @Test
        void loadsFromFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("corpus.yaml");
            Files.writeString(file, SMALL);

            assertThat(CorpusLoader.load(file).cases()).hasSize(3);
            assertThat(CorpusLoader.loadLocation(file.toString()).id()).isEqualTo("small");
        }

        @Test
        void loadsBundledCorpusByLocation() {
            Corpus corpus = CorpusLoader.loadLocation("classpath:corpus/pinned-50.yaml");

            assertThat(corpus.key()).isEqualTo("pinned-50@1.0.0");
            assertThat(corpus.cases()).hasSize(50);
        }
    }

    @Nested
    @DisplayName("Malformed corpora")
    class Malformed {

        @Test
        void duplicateIdRejected() {
            String yaml = """
                    corpus: dup
                    version: "1"
                    cases:
                      - { id: x, category: c, request: "one" }
                      - { id: x, category: c, request: "two" }
                    """;

            assertThatThrownBy(() -> CorpusLoader.parse(yaml, "dup.yaml"))
                    .isInstanceOf(CorpusLoadException.class)
                    .hasMessageContaining("Duplicate case id 'x'")
                    .satisfies(e -> assertThat(((CorpusLoadException) e).source()).isEqualTo("dup.yaml"));
        }

        @Test
        void undeclaredTargetRejected() {
            String yaml = """
                    corpus: bad
                    version: "1"
                    cases:
                      - { id: x, category: c, request: "r", expected: { targets: [tape_archive] } }
                    """;

            assertThatThrownBy(() -> CorpusLoader.parse(yaml, "inline"))
                    .isInstanceOf(CorpusLoadException.class)
                    .hasMessageContaining("tape_archive")
                    .hasMessageContaining("file_store");
        }

        @Test
        void missingCategoryRejected() {
            String yaml = """
                    corpus: bad
                    version: "1"
                    cases:
                      - { id: x, request: "r" }
                    """;

            assertThatThrownBy(() -> CorpusLoader.parse(yaml, "inline"))
                    .isInstanceOf(CorpusLoadException.class)
                    .hasMessageContaining("case 'x' is missing required field 'category'");
        }

        @Test
        void caseWithoutInputRejected() {
            String yaml = """
                    corpus: bad
                    version: "1"
                    cases:
                      - { id: x, category: c, expected: { targets: [memory] } }
                    """;

            assertThatThrownBy(() -> CorpusLoader.parse(yaml, "inline"))
                    .isInstanceOf(CorpusLoadException.class)
                    .hasMessageContaining("neither 'request' nor 'criteria'");
        }

        @Test
        void emptyCaseListRejected() {
            assertThatThrownBy(() -> CorpusLoader.parse("corpus: e\nversion: \"1\"\ncases: []\n", "inline"))
                    .isInstanceOf(CorpusLoadException.class)
                    .hasMessageContaining("non-empty 'cases'");
        }

        @Test
        void invalidYamlRejected() {
            assertThatThrownBy(() -> CorpusLoader.parse("corpus: [unclosed", "inline"))
                    .isInstanceOf(CorpusLoadException.class)
                    .hasMessageContaining("Failed to parse corpus YAML");
        }

        @Test
        void missingResourceRejected() {
            assertThatThrownBy(() -> CorpusLoader.loadResource("corpus/nope.yaml"))
                    .isInstanceOf(CorpusLoadException.class)
                    .satisfies(e -> assertThat(((CorpusLoadException) e).source()).isEqualTo("classpath:corpus/nope.yaml"));
        }

        @Test
        void missingFileRejected(@TempDir Path dir) {
            assertThatThrownBy(() -> CorpusLoader.load(dir.resolve("absent.yaml")))
                    .isInstanceOf(CorpusLoadException.class)
                    .hasMessageContaining("Failed to read corpus");
        }
    }
}
