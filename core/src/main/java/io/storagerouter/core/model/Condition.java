package io.storagerouter.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Left-hand side of a rule: a literal per constrained field, wildcard for every
 * field not named. Only literals are stored; the wildcard is implicit.
 *
 * <p>
 * Immutable, thread-safe.
 *
 * @param literals constrained fields mapped to normalized wire values
 */
public record Condition(Map<CriteriaField, String> literals) {

    /** Wildcard token accepted in artifacts for "matches anything". */
    public static final String WILDCARD = "*";

    private static final Condition ANY = new Condition(Map.of());

    /**
     * Canonical constructor: copies into field order and checks every literal
     * against the field vocabulary.
     *
     * @throws IllegalArgumentException if a literal is not a declared value
     */
    public Condition {
        EnumMap<CriteriaField, String> copy = new EnumMap<>(CriteriaField.class);
        if (literals != null) {
            for (Map.Entry<CriteriaField, String> entry : literals.entrySet()) {
                CriteriaField field = entry.getKey();
                String normalized = field.normalize(entry.getValue());
                if (normalized == null) {
                    throw new IllegalArgumentException("Undeclared value '" + entry.getValue() + "' for field '"
                            + field.wireName() + "'; expected one of " + field.vocabulary());
                }
                copy.put(field, normalized);
            }
        }
        literals = Collections.unmodifiableMap(copy);
    }

    /** The all-wildcard condition carried by the default rule. */
    public static Condition any() {
        return ANY;
    }

    /** Returns a copy of this condition with one more literal. */
    public Condition and(CriteriaField field, String value) {
        EnumMap<CriteriaField, String> next = new EnumMap<>(CriteriaField.class);
        next.putAll(literals);
        next.put(field, value);
        return new Condition(next);
    }

    /** True if no field is constrained. */
    public boolean isWildcard() {
        return literals.isEmpty();
    }

    /** True if every constrained field equals the criteria's value for that field. */
    public boolean matches(Criteria criteria) {
        for (Map.Entry<CriteriaField, String> entry : literals.entrySet()) {
            if (!entry.getValue().equals(entry.getKey().valueOf(criteria))) {
                return false;
            }
        }
        return true;
    }

    /**
     * True if every criteria matching {@code other} also matches this condition,
     * i.e. each literal here appears in {@code other} with the same value.
     */
    public boolean subsumes(Condition other) {
        for (Map.Entry<CriteriaField, String> entry : literals.entrySet()) {
            if (!entry.getValue().equals(other.literals.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /** True if at least one criteria value matches both conditions. */
    public boolean intersects(Condition other) {
        for (Map.Entry<CriteriaField, String> entry : literals.entrySet()) {
            String theirs = other.literals.get(entry.getKey());
            if (theirs != null && !theirs.equals(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    /** Compact form for logs and reports, e.g. {@code storage_intent=memory, analytic_intent=true}. */
    public String describe() {
        if (literals.isEmpty()) {
            return WILDCARD;
        }
        StringJoiner joiner = new StringJoiner(", ");
        literals.forEach((field, value) -> joiner.add(field.wireName() + "=" + value));
        return joiner.toString();
    }
}
