package com.jsonsource.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Per-field configuration. Only explicitly written members are taken into account.
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target({ElementType.FIELD, ElementType.METHOD, ElementType.RECORD_COMPONENT})
public @interface JsonKey {

    /** Output key, overriding any {@link FieldRename}. */
    String name() default "";

    /** Whether the decode factory reads this field. */
    boolean includeFromJson() default true;

    /** Whether the encoder writes this field. */
    boolean includeToJson() default true;

    /** Java expression used when the key is missing or {@code null}. */
    String defaultValue() default "";

    /** Fail decoding when the key is missing. */
    boolean required() default false;

    /** Fail decoding when the key is present with a {@code null} value. */
    boolean disallowNullValue() default false;

    /** Field-level override of {@link JsonSerializable#includeIfNull()}. */
    boolean includeIfNull() default true;
}
