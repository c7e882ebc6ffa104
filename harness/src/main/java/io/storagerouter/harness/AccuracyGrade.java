package io.storagerouter.harness;

/** Coarse verdict printed next to an accuracy figure. */
public enum AccuracyGrade {
    EXCELLENT(0.95),
    VERY_GOOD(0.90),
    ACCEPTABLE(0.85),
    INSUFFICIENT(0.0);

    private final double floor;

    AccuracyGrade(double floor) {
        this.floor = floor;
    }

    /** Lowest accuracy that earns this grade. */
    public double floor() {
        return floor;
    }

    /** Grade for an accuracy in {@code [0, 1]}. */
    public static AccuracyGrade of(double accuracy) {
        for (AccuracyGrade grade : values()) {
            if (accuracy >= grade.floor) {
                return grade;
            }
        }
        return INSUFFICIENT;
    }

    /** Human-readable form, e.g. {@code VERY GOOD}. */
    public String label() {
        return name().replace('_', ' ');
    }
}
