package io.schemafm.core.schema;

import com.fasterxml.jackson.databind.JsonNode;

/** Scalar value types and their keyword in the model file. */
public enum ScalarType {
    STRING("String"),
    INTEGER("Integer"),
    NUMBER("Real"),
    BOOLEAN("Boolean");

    private final String keyword;

    ScalarType(String keyword) {
        this.keyword = keyword;
    }

    /** Type prefix used in the model file. */
    public String keyword() {
        return keyword;
    }

    /** Maps a JSON Schema {@code type} value, or returns {@code null} if it is not a scalar type. */
    public static ScalarType fromSchemaType(String type) {
        return switch (type) {
            case "string" -> STRING;
            case "integer" -> INTEGER;
            case "number" -> NUMBER;
            case "boolean" -> BOOLEAN;
            default -> null;
        };
    }

    public static ScalarType fromKeyword(String keyword) {
        for (ScalarType t : values()) {
            if (t.keyword.equals(keyword)) {
                return t;
            }
        }
        return null;
    }

    /** Whether a document value is acceptable for this type. */
    public boolean accepts(JsonNode value) {
        return switch (this) {
            case STRING -> value.isTextual();
            case INTEGER -> value.isIntegralNumber();
            case NUMBER -> value.isNumber();
            case BOOLEAN -> value.isBoolean();
        };
    }

    /** Infers the type of an enum literal. */
    static ScalarType ofLiteral(JsonNode value) {
        if (value.isIntegralNumber()) {
            return INTEGER;
        }
        if (value.isNumber()) {
            return NUMBER;
        }
        if (value.isBoolean()) {
            return BOOLEAN;
        }
        return STRING;
    }
}
