package io.storagerouter.core.error;

/**
 * A criteria record carries a missing or undeclared value. Surfaced immediately as a
 * hard rejection of malformed input; never retried.
 */
public final class CriteriaSchemaException extends RouterException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final String value;

    public CriteriaSchemaException(String message, String field, String value) {
        super(message, null, Phase.EVALUATION);
        this.field = field;
        this.value = value;
    }

    /** Wire name of the offending field, or {@code null} when the whole record is missing. */
    public String field() {
        return field;
    }

    /** The rejected value as supplied, or {@code null} when it was absent. */
    public String value() {
        return value;
    }
}
