package io.shakemyleg.standalone.config;

/**
 * Thrown when runner configuration cannot be loaded: missing file, invalid
 * YAML, a missing required key or an invalid value. The message is meant for
 * startup error output.
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
