package io.storagerouter.cli.config;

/**
 * Settings for the command-line tool, read from {@code storage-router.yaml} and
 * the environment. Command-line options override them per invocation.
 *
 * <p>
 * Use {@link #builder()}; every field has a default.
 *
 * @param rules         rule set location: a file path or {@code classpath:name}
 * @param corpus        corpus location: a file path or {@code classpath:name}
 * @param threshold     minimum accuracy for the regression gate, in {@code [0, 1]}
 * @param repetitions   runs per case
 * @param workers       harness worker threads
 * @param match         target comparison: exact or superset
 * @param shadowPolicy  warn or strict
 * @param loggingFormat json or text
 * @param loggingLevel  root log level
 */
public record RouterConfig(
        String rules,
        String corpus,
        double threshold,
        int repetitions,
        int workers,
        String match,
        String shadowPolicy,
        String loggingFormat,
        String loggingLevel) {

    public static final String DEFAULT_RULES = "classpath:rulesets/reference.yaml";
    public static final String DEFAULT_CORPUS = "classpath:corpus/pinned-50.yaml";

    public static Builder builder() {
        return new Builder();
    }

    /** Builder seeded with the documented defaults. */
    public static final class Builder {
        private String rules = DEFAULT_RULES;
        private String corpus = DEFAULT_CORPUS;
        private double threshold = 0.85;
        private int repetitions = 3;
        private int workers = 4;
        private String match = "exact";
        private String shadowPolicy = "warn";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder rules(String rules) {
            this.rules = rules;
            return this;
        }

        public Builder corpus(String corpus) {
            this.corpus = corpus;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder repetitions(int repetitions) {
            this.repetitions = repetitions;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder match(String match) {
            this.match = match;
            return this;
        }

        public Builder shadowPolicy(String shadowPolicy) {
            this.shadowPolicy = shadowPolicy;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public RouterConfig build() {
            return new RouterConfig(
                    rules, corpus, threshold, repetitions, workers, match, shadowPolicy, loggingFormat, loggingLevel);
        }
    }
}
