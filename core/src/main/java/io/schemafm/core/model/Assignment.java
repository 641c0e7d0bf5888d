package io.schemafm.core.model;

/** Truth assignment used to evaluate constraint expressions. */
public interface Assignment {

    boolean isSelected(String featureId);

    /** Whether the feature is selected and carries the given literal value. */
    boolean hasValue(String featureId, String literal);
}
