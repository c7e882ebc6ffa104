package io.storagerouter.cli.config;

/**
 * Thrown when configuration loading fails: a missing file, invalid YAML, or a
 * value out of range. The message is suitable for direct terminal output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
