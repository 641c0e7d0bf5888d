package io.schemafm.core.model;

/** Boolean markers on a feature; written as bare attributes in the model file, in this order. */
public enum FeatureFlag {
    /** Synthetic feature with no document key of its own (root, union branch, marker). */
    ABSTRACT("abstract"),
    /** Array feature; each element instantiates the same feature. */
    REPEATABLE("repeatable"),
    /** Map feature; arbitrary keys share the feature. */
    MAP("map"),
    /** Free-form content; documents may carry anything below it. */
    OPEN("open"),
    /** Built from vocabulary outside the supported subset. */
    UNKNOWN("unknown"),
    /** Expansion was cut because the definition is already an ancestor. */
    RECURSIVE("recursive"),
    DEPRECATED("deprecated");

    private final String keyword;

    FeatureFlag(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static FeatureFlag fromKeyword(String keyword) {
        for (FeatureFlag f : values()) {
            if (f.keyword.equals(keyword)) {
                return f;
            }
        }
        return null;
    }
}
