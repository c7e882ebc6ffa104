package io.storagerouter.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * An enumerated value with a stable lower-case wire name, as written in rule set
 * artifacts, corpora and reports.
 */
public interface WireEnum {

    /** The value as it appears in YAML and JSON. */
    String wireName();

    /**
     * Looks up a constant by wire name (case-insensitive, surrounding whitespace
     * ignored).
     *
     * @return the constant, or {@code null} if {@code raw} is null or undeclared
     */
    static <E extends Enum<E> & WireEnum> E lookup(Class<E> type, String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.wireName().equals(normalized)) {
                return constant;
            }
        }
        return null;
    }

    /** Wire names of every constant of {@code type}, in declaration order. */
    static <E extends Enum<E> & WireEnum> List<String> wireNames(Class<E> type) {
        List<String> names = new ArrayList<>();
        for (E constant : type.getEnumConstants()) {
            names.add(constant.wireName());
        }
        return List.copyOf(names);
    }
}
