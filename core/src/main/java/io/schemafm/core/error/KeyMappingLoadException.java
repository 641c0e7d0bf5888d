package io.schemafm.core.error;

/** A key mapping table could not be read. */
public final class KeyMappingLoadException extends InputException {

    private static final long serialVersionUID = 1L;

    public KeyMappingLoadException(String message, String source) {
        super(message, source);
    }

    public KeyMappingLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
