package io.schemafm.core.schema;

import java.util.List;
import java.util.Objects;

/**
 * Requirement that applies only when a sibling property has a given value, or is present at all.
 * Built from {@code if}/{@code then} and {@code dependentRequired}.
 *
 * @param property the sibling being tested
 * @param value    the literal the sibling must equal, or {@code null} for plain presence
 * @param required properties that become required
 */
public record ConditionalRequirement(String property, String value, List<String> required) {

    public ConditionalRequirement {
        Objects.requireNonNull(property, "property must not be null");
        required = List.copyOf(required);
    }
}
