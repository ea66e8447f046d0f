package com.jsonsource.generator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * Explicitly written members of one annotation, decoded into primitive values.
 *
 * Values are {@link Boolean}, {@link String}, {@link EnumConstant} or {@link Unresolved} when the
 * written expression is not a literal. Interpreting (and rejecting) values is left to the config layer.
 */
@Value
public class AnnotationValues {

    private static final AnnotationValues ABSENT = new AnnotationValues("", "", Map.of(), false);

    /**
     * Simple annotation name, e.g. {@code JsonKey}.
     */
    @NonNull
    String annotationName;

    /**
     * Element carrying the annotation, e.g. {@code Point.x}; used in error messages.
     */
    @NonNull
    String elementName;

    @NonNull
    Map<String, Object> values;

    boolean present;

    public static AnnotationValues of(String annotationName, String elementName, Map<String, Object> values) {
        return new AnnotationValues(annotationName, elementName,
                Collections.unmodifiableMap(new LinkedHashMap<>(values)), true);
    }

    public static AnnotationValues absent() {
        return ABSENT;
    }

    public Optional<Object> get(String member) {
        return Optional.ofNullable(values.get(member));
    }

    public boolean has(String member) {
        return values.containsKey(member);
    }

    /**
     * Reference to an enum constant such as {@code FieldRename.SNAKE}.
     */
    @Value
    public static class EnumConstant {
        String typeName;
        String constantName;

        @Override
        public String toString() {
            return typeName.isEmpty() ? constantName : typeName + "." + constantName;
        }
    }

    /**
     * A member value that is not a literal (a constant reference, a computation, ...).
     */
    @Value
    public static class Unresolved {
        String sourceText;

        @Override
        public String toString() {
            return sourceText;
        }
    }
}
