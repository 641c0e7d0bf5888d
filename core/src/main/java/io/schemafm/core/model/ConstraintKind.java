package io.schemafm.core.model;

public enum ConstraintKind {
    /** {@code a => b} */
    REQUIRES,
    /** {@code a => !b} */
    EXCLUDES,
    /** Any other propositional expression. */
    EXPRESSION
}
