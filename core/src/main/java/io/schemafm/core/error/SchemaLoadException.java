package io.schemafm.core.error;

/** The raw schema definitions could not be read or have an unusable shape. */
public final class SchemaLoadException extends InputException {

    private static final long serialVersionUID = 1L;

    public SchemaLoadException(String message, String source) {
        super(message, source);
    }

    public SchemaLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
