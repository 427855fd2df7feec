package io.fluenthttp.core.config;

/**
 * Thrown when configuration cannot be read, parsed or validated. The message
 * names the offending file or key.
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
