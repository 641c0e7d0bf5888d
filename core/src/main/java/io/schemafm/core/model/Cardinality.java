package io.schemafm.core.model;

/** Whether a child must be selected whenever its parent is. */
public enum Cardinality {
    MANDATORY("mandatory"),
    OPTIONAL("optional");

    private final String keyword;

    Cardinality(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
