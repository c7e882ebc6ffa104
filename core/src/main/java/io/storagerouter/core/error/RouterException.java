package io.storagerouter.core.error;

/**
 * Abstract base for all storage-router exceptions. Never thrown directly; use
 * one of the concrete subclasses.
 *
 * <p>
 * Every instance records the {@link Phase} it was raised in so that callers
 * (and the validation harness) can tell a defective rule set apart from
 * malformed input without inspecting the message.
 */
public abstract class RouterException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EVALUATION,
        EXTRACTION
    }

    private final String ruleSetId;
    private final Phase phase;

    protected RouterException(String message, String ruleSetId, Phase phase) {
        super(message);
        this.ruleSetId = ruleSetId;
        this.phase = phase;
    }

    protected RouterException(String message, Throwable cause, String ruleSetId, Phase phase) {
        super(message, cause);
        this.ruleSetId = ruleSetId;
        this.phase = phase;
    }

    /** The rule set involved, or {@code null} if not yet identified. */
    public String ruleSetId() {
        return ruleSetId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
