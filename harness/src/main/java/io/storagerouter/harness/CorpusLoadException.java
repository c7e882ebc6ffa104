package io.storagerouter.harness;

/**
 * A corpus artifact is unreadable or malformed: bad YAML, a case without an id or
 * category, a duplicate id, or an undeclared expected target.
 */
public final class CorpusLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public CorpusLoadException(String message, String source) {
        super(message);
        this.source = source;
    }

    public CorpusLoadException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /** File path or classpath resource of the corpus. */
    public String source() {
        return source;
    }
}
