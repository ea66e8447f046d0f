package com.jsonsource.annotation;

/**
 * Naming strategies applied to a field name when no explicit {@link JsonKey#name()} is set.
 */
public enum FieldRename {
    /** Use the field name as is. */
    NONE,
    /** {@code someField} becomes {@code some-field}. */
    KEBAB,
    /** {@code someField} becomes {@code some_field}. */
    SNAKE,
    /** {@code someField} becomes {@code SomeField}. */
    PASCAL,
    /** {@code someField} becomes {@code SOME_FIELD}. */
    SCREAMING_SNAKE
}
