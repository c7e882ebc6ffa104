package io.storagerouter.harness;

/**
 * Pass count for one category (or for the fix-needed subset).
 *
 * @param passed cases that passed
 * @param total  cases run
 */
public record CategoryStats(int passed, int total) {

    public double accuracy() {
        return total == 0 ? 0.0 : (double) passed / total;
    }
}
