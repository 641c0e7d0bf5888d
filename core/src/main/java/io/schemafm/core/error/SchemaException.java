package io.schemafm.core.error;

/**
 * Abstract parent for recoverable schema problems found while resolving the schema graph. Carries
 * the qualified name of the definition being materialized when the problem was found.
 */
public abstract class SchemaException extends FeatureModelException {

    private static final long serialVersionUID = 1L;

    private final String definition;

    protected SchemaException(String message, String definition) {
        super(message, Category.SCHEMA);
        this.definition = definition;
    }

    /** Qualified name of the definition that triggered the error. */
    public String definition() {
        return definition;
    }
}
