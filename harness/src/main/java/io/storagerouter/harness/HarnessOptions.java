package io.storagerouter.harness;

import java.util.Objects;

/**
 * Run settings for {@link ValidationHarness}.
 *
 * @param repetitions times each case is run, to measure consistency (at least 1)
 * @param workers     size of the fixed worker pool (at least 1)
 * @param matchMode   how predicted targets are compared with expected ones
 */
public record HarnessOptions(int repetitions, int workers, TargetMatchMode matchMode) {

    public static final int DEFAULT_REPETITIONS = 3;
    public static final int DEFAULT_WORKERS = 4;

    public HarnessOptions {
        if (repetitions < 1) {
            throw new IllegalArgumentException("repetitions must be at least 1, got: " + repetitions);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got: " + workers);
        }
        Objects.requireNonNull(matchMode, "matchMode must not be null");
    }

    /** Three repetitions, four workers, exact matching. */
    public static HarnessOptions defaults() {
        return new HarnessOptions(DEFAULT_REPETITIONS, DEFAULT_WORKERS, TargetMatchMode.EXACT);
    }

    public HarnessOptions withRepetitions(int repetitions) {
        return new HarnessOptions(repetitions, workers, matchMode);
    }

    public HarnessOptions withWorkers(int workers) {
        return new HarnessOptions(repetitions, workers, matchMode);
    }

    public HarnessOptions withMatchMode(TargetMatchMode matchMode) {
        return new HarnessOptions(repetitions, workers, matchMode);
    }
}
