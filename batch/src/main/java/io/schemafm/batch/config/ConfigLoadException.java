package io.schemafm.batch.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, a document that breaks the
 * configuration schema, or an unparseable environment override. The message is meant for startup
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
