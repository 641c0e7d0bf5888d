package io.schemafm.core.error;

/**
 * Abstract parent for fatal input errors: malformed or unreadable files and documents. Aborts the
 * current unit only. Carries a {@code source} identifying the file, resource or document.
 */
public abstract class InputException extends FeatureModelException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected InputException(String message, String source) {
        super(message, Category.FATAL);
        this.source = source;
    }

    protected InputException(String message, Throwable cause, String source) {
        super(message, cause, Category.FATAL);
        this.source = source;
    }

    /** The file path or document identifier that caused the error. */
    public String source() {
        return source;
    }
}
