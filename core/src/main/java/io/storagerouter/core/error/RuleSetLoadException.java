package io.storagerouter.core.error;

/**
 * Abstract parent for errors raised while reading a rule set artifact. Carries the
 * {@code source} (file path or classpath resource) that could not be loaded.
 */
public abstract class RuleSetLoadException extends RouterException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected RuleSetLoadException(String message, String ruleSetId, String source) {
        super(message, ruleSetId, Phase.LOAD);
        this.source = source;
    }

    protected RuleSetLoadException(String message, Throwable cause, String ruleSetId, String source) {
        super(message, cause, ruleSetId, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
