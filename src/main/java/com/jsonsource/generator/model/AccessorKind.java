package com.jsonsource.generator.model;

/**
 * How a field value is read from an instance.
 */
public enum AccessorKind {
    /** {@code instance.name} */
    FIELD,
    /** {@code instance.getName()} or {@code instance.isName()} */
    GETTER,
    /** {@code instance.name()} */
    RECORD_COMPONENT,
    /** Setter-only property; the value cannot be read. */
    NONE
}
