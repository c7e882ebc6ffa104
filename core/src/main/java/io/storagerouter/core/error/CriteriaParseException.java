package io.storagerouter.core.error;

/**
 * An extractor could not confidently classify a request. Callers typically answer
 * this by asking the user a clarifying question rather than guessing.
 */
public final class CriteriaParseException extends RouterException {

    private static final long serialVersionUID = 1L;

    private final String requestText;

    public CriteriaParseException(String message, String requestText) {
        super(message, null, Phase.EXTRACTION);
        this.requestText = requestText;
    }

    public CriteriaParseException(String message, Throwable cause, String requestText) {
        super(message, cause, null, Phase.EXTRACTION);
        this.requestText = requestText;
    }

    /** The request that could not be classified. */
    public String requestText() {
        return requestText;
    }
}
