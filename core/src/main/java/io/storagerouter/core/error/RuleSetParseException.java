package io.storagerouter.core.error;

/** Thrown when a rule set artifact cannot be read, is not valid YAML, or violates the artifact schema. */
public final class RuleSetParseException extends RuleSetLoadException {

    private static final long serialVersionUID = 1L;

    public RuleSetParseException(String message, String ruleSetId, String source) {
        super(message, ruleSetId, source);
    }

    public RuleSetParseException(String message, Throwable cause, String ruleSetId, String source) {
        super(message, cause, ruleSetId, source);
    }
}
