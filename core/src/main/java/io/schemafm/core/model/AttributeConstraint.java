package io.schemafm.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemafm.core.schema.ScalarType;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Value constraint on a terminal feature: its scalar type plus an optional value set and numeric
 * bounds.
 *
 * @param type       scalar type of the value
 * @param enumValues allowed literals; empty means unrestricted
 * @param minimum    inclusive lower bound, or {@code null}
 * @param maximum    inclusive upper bound, or {@code null}
 */
public record AttributeConstraint(ScalarType type, List<String> enumValues, BigDecimal minimum, BigDecimal maximum) {

    public AttributeConstraint {
        Objects.requireNonNull(type, "type must not be null");
        enumValues = List.copyOf(enumValues);
    }

    public static AttributeConstraint of(ScalarType type) {
        return new AttributeConstraint(type, List.of(), null, null);
    }

    public boolean enumerated() {
        return !enumValues.isEmpty();
    }

    /** Whether a document value satisfies type, value set and bounds. */
    public boolean accepts(JsonNode value) {
        if (!type.accepts(value)) {
            return false;
        }
        if (enumerated() && !enumValues.contains(value.asText())) {
            return false;
        }
        if (value.isNumber()) {
            BigDecimal number = value.decimalValue();
            if (minimum != null && number.compareTo(minimum) < 0) {
                return false;
            }
            return maximum == null || number.compareTo(maximum) <= 0;
        }
        return true;
    }
}
