package io.schemafm.core.error;

/**
 * A definition uses schema vocabulary outside the supported operator subset. The node is kept as
 * an opaque feature.
 */
public final class UnsupportedConstructException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String construct;

    public UnsupportedConstructException(String definition, String construct) {
        super("Unsupported construct '" + construct + "' in " + definition, definition);
        this.construct = construct;
    }

    public String construct() {
        return construct;
    }
}
