package io.schemafm.core.model;

/**
 * Cardinality rule over the children of a feature. In an {@code AND} group each child carries its
 * own {@link Cardinality}; {@code OR} and {@code ALTERNATIVE} constrain the number of selected
 * members instead.
 */
public enum GroupType {
    AND,
    /** One or more members. */
    OR("or"),
    /** Exactly one member. */
    ALTERNATIVE("alternative");

    private final String keyword;

    GroupType() {
        this.keyword = null;
    }

    GroupType(String keyword) {
        this.keyword = keyword;
    }

    /** Model-file keyword, {@code null} for {@code AND} which is written as mandatory/optional blocks. */
    public String keyword() {
        return keyword;
    }

    public static GroupType fromKeyword(String keyword) {
        return switch (keyword) {
            case "or" -> OR;
            case "alternative" -> ALTERNATIVE;
            case "mandatory", "optional" -> AND;
            default -> null;
        };
    }
}
