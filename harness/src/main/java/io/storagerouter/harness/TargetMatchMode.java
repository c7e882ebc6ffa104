package io.storagerouter.harness;

import io.storagerouter.core.model.StorageTarget;
import io.storagerouter.core.model.WireEnum;
import java.util.Set;

/** How predicted storage targets are compared with expected ones. */
public enum TargetMatchMode implements WireEnum {
    /** Predicted targets must equal the expected set. */
    EXACT("exact"),

    /**
     * Every expected target must be predicted; extra predicted targets are
     * tolerated. Useful while multi-target rules are being introduced.
     */
    SUPERSET("superset");

    private final String wireName;

    TargetMatchMode(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    /** Applies this mode. */
    public boolean matches(Set<StorageTarget> expected, Set<StorageTarget> predicted) {
        return switch (this) {
            case EXACT -> predicted.equals(expected);
            case SUPERSET -> predicted.containsAll(expected);
        };
    }
}
