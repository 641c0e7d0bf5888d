package io.schemafm.core.error;

/** A {@code $ref} points at a definition the schema does not contain. */
public final class UnresolvedReferenceException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String reference;

    public UnresolvedReferenceException(String definition, String reference) {
        super("Unresolved reference '" + reference + "' in " + definition, definition);
        this.reference = reference;
    }

    public String reference() {
        return reference;
    }
}
