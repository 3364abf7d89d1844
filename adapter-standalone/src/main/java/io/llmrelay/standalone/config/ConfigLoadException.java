package io.llmrelay.standalone.config;

/**
 * Thrown when configuration loading fails: unreadable file, invalid YAML,
 * or a value of the wrong shape. Carries a message suitable for startup
 * error output.
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
