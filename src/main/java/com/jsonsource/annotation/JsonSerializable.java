package com.jsonsource.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class or record for JSON code generation.
 *
 * Only the members written explicitly on the annotation override the generation run's
 * defaults; an omitted member inherits the value configured for the run.
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface JsonSerializable {

    /** Generate {@code xFromJson(Map)}. */
    boolean createFactory() default true;

    /** Generate {@code xToJson(X)}. */
    boolean createToJson() default true;

    /** Generate a constant map from field name to output key. */
    boolean createFieldMap() default false;

    /** Generate a nested class holding one constant per output key. */
    boolean createJsonKeys() default false;

    /** Generate a nested class with one encode method per field. */
    boolean createPerFieldToJson() default false;

    /** Take one conversion function per type parameter in the generated factory and encoder. */
    boolean genericArgumentFactories() default false;

    /** Write {@code null} values instead of omitting their keys. */
    boolean includeIfNull() default true;

    /** Call the nested type's encoder instead of storing the nested instance itself. */
    boolean explicitToJson() default false;

    /** Reject input maps carrying keys that no field decodes. */
    boolean disallowUnrecognizedKeys() default false;

    /** Only fields annotated with {@link JsonKey} take part. */
    boolean ignoreUnannotated() default false;

    /** Strategy used to derive output keys from field names. */
    FieldRename fieldRename() default FieldRename.NONE;

    /** Add {@code fromJson}/{@code toJson} members to the annotated declaration itself. */
    boolean patchSource() default false;
}
