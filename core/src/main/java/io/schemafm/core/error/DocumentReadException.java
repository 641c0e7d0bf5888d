package io.schemafm.core.error;

/** A configuration document is unreadable or is not a key/value tree. */
public final class DocumentReadException extends InputException {

    private static final long serialVersionUID = 1L;

    public DocumentReadException(String message, String source) {
        super(message, source);
    }

    public DocumentReadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
