package io.schemafm.core.mapping;

import java.util.Objects;

/** Binds a key path pattern to the feature it activates. */
public record KeyMappingEntry(KeyPath keyPath, String featureId, ValueKind valueKind) {

    public KeyMappingEntry {
        Objects.requireNonNull(keyPath, "keyPath must not be null");
        Objects.requireNonNull(featureId, "featureId must not be null");
        Objects.requireNonNull(valueKind, "valueKind must not be null");
    }
}
