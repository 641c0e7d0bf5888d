package io.schemafm.core.error;

/**
 * Abstract base for all schema-fm exceptions. Never thrown directly: use the concrete subclasses
 * under {@link SchemaException}, {@link MappingException} or {@link InputException}.
 */
public abstract class FeatureModelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error category, deciding whether processing of the current unit can continue. */
    public enum Category {
        /** Recoverable schema problem; the model degrades and a warning is recorded. */
        SCHEMA,
        /** Recoverable key-mapping problem, collected per entry. */
        MAPPING,
        /** Aborts the current unit (one schema load or one document). */
        FATAL
    }

    private final Category category;

    protected FeatureModelException(String message, Category category) {
        super(message);
        this.category = category;
    }

    protected FeatureModelException(String message, Throwable cause, Category category) {
        super(message, cause);
        this.category = category;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    public Category category() {
        return category;
    }
}
