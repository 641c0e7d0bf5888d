package io.schemafm.core.schema;

/** Tagged variant over the schema node shapes the synthesizer knows how to map. */
public enum DefinitionKind {
    /** Object with named properties. */
    OBJECT,
    /** Object whose members are arbitrary keys sharing one value schema. */
    MAP,
    /** Array; the element schema is in {@link Definition#element()}. */
    ARRAY,
    /** Terminal value. */
    SCALAR,
    /** oneOf: exactly one branch. */
    UNION,
    /** anyOf: one or more branches. */
    DISJUNCTION,
    /** allOf: branches merged into the enclosing object. */
    INTERSECTION,
    /** Free-form object or untyped node; documents may carry anything below it. */
    OPEN,
    /** Node using unsupported vocabulary; kept opaque. */
    UNKNOWN
}
