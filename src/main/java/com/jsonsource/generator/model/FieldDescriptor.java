package com.jsonsource.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One encodable/decodable property of a class: a field, a record component, or a setter-only
 * property.
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class FieldDescriptor {

    @NonNull
    String name;

    @NonNull
    TypeRef type;

    /**
     * Effective visibility: {@code PUBLIC} when the field itself or its accessor is public.
     */
    @NonNull
    Visibility visibility;

    /**
     * Visibility of the backing field; {@code null} for setter-only properties.
     */
    Visibility fieldVisibility;

    boolean finalField;

    @NonNull
    AccessorKind accessorKind;

    /**
     * Method or field name used to read the value.
     */
    String accessorName;

    /**
     * Public setter method name, if any.
     */
    String setterName;

    /**
     * {@code @JsonKey} members, {@link AnnotationValues#absent()} when not annotated.
     */
    @NonNull
    @Builder.Default
    AnnotationValues keyOverride = AnnotationValues.absent();

    /**
     * Class that declares the field (differs from the generated class for inherited fields).
     */
    String declaringClass;

    public boolean isPublic() {
        return visibility == Visibility.PUBLIC;
    }

    /**
     * A setter-only property has no getter.
     */
    public boolean hasGetter() {
        return accessorKind != AccessorKind.NONE;
    }

    /**
     * Whether generated code in the same package can read the value.
     */
    public boolean isReadable() {
        return switch (accessorKind) {
            case GETTER, RECORD_COMPONENT -> true;
            case FIELD -> fieldVisibility != null && fieldVisibility.isVisibleToPackage();
            case NONE -> false;
        };
    }

    /**
     * Whether generated code in the same package can assign the value after construction.
     */
    public boolean isAssignable() {
        if (setterName != null) {
            return true;
        }
        return accessorKind != AccessorKind.RECORD_COMPONENT
                && fieldVisibility != null
                && fieldVisibility.isVisibleToPackage()
                && !finalField;
    }

    /**
     * Expression reading this property from {@code target}.
     */
    public String readExpression(String target) {
        return switch (accessorKind) {
            case FIELD -> target + "." + name;
            case GETTER, RECORD_COMPONENT -> target + "." + accessorName + "()";
            case NONE -> throw new IllegalStateException("Setter-only property " + name + " cannot be read");
        };
    }

    /**
     * Statement assigning {@code valueExpression} to this property on {@code target}.
     */
    public String assignStatement(String target, String valueExpression) {
        if (setterName != null) {
            return target + "." + setterName + "(" + valueExpression + ");";
        }
        return target + "." + name + " = " + valueExpression + ";";
    }
}
