package io.schemafm.batch.runner;

/** Why a corpus document was left out of translation. */
public enum SkipReason {
    /** File contains template markers and is not a concrete document. */
    TEMPLATED,
    /** Document lacks {@code apiVersion} or {@code kind}. */
    MISSING_KIND,
    /** Document is a {@code CustomResourceDefinition}. */
    CUSTOM_RESOURCE,
    /** Empty document between separators. */
    EMPTY
}
