package io.schemafm.core.schema;

import java.util.Objects;

/**
 * A named member of an object definition.
 *
 * @param name        the document key
 * @param target      qualified name of the value definition, or {@code null} when the reference
 *                    could not be resolved
 * @param description property-level description, may be {@code null}
 * @param deprecated  whether the property is marked or described as deprecated
 */
public record Property(String name, String target, String description, boolean deprecated) {

    public Property {
        Objects.requireNonNull(name, "name must not be null");
    }

    public boolean resolved() {
        return target != null;
    }
}
