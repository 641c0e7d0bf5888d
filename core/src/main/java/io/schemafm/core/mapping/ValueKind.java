package io.schemafm.core.mapping;

/** How a mapped document value is recorded. */
public enum ValueKind {
    /** The key's presence activates the feature; the value itself is not recorded. */
    BOOLEAN_PRESENCE("boolean-presence"),
    /** The literal value is recorded as is. */
    VERBATIM("verbatim"),
    /** The literal value is recorded and must be one of the feature's enumerated values. */
    ENUMERATED("enumerated");

    private final String keyword;

    ValueKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static ValueKind fromKeyword(String keyword) {
        for (ValueKind k : values()) {
            if (k.keyword.equals(keyword)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown value kind '" + keyword + "'");
    }
}
