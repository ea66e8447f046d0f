package com.jsonsource.generator.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable snapshot of one class, record or enum declaration.
 *
 * Pure structure only (no selection / generation logic).
 */
@Value
@Builder(toBuilder = true)
public class ClassModel {

    @NonNull
    String name;

    /**
     * Empty for the default package.
     */
    @NonNull
    @Builder.Default
    String packageName = "";

    @NonNull
    ClassKind kind;

    /**
     * Properties in declaration order.
     */
    @NonNull
    @Singular("field")
    List<FieldDescriptor> fields;

    @NonNull
    @Singular("constructor")
    List<ConstructorModel> constructors;

    @NonNull
    @Singular("typeParameter")
    List<String> typeParameters;

    /**
     * Declared bounds of each type parameter, e.g. {@code T -> [Number]} for {@code <T extends Number>}.
     * Unbounded parameters have no entry.
     */
    @NonNull
    @Singular("typeParameterBound")
    Map<String, List<TypeRef>> typeParameterBounds;

    /**
     * Supertype as written after {@code extends}, if any.
     */
    TypeRef superType;

    /**
     * {@code @JsonSerializable} members, {@link AnnotationValues#absent()} when not annotated.
     */
    @NonNull
    @Builder.Default
    AnnotationValues serializableOverride = AnnotationValues.absent();

    /**
     * {@code @JsonEnum} members, {@link AnnotationValues#absent()} when not annotated.
     */
    @NonNull
    @Builder.Default
    AnnotationValues enumOverride = AnnotationValues.absent();

    /**
     * Declared methods as {@code name/parameterCount}, e.g. {@code toJson/0}.
     */
    @NonNull
    @Singular("existingMember")
    Set<String> existingMembers;

    @NonNull
    @Singular("enumConstant")
    List<String> enumConstants;

    /**
     * Static fields annotated {@code @JsonLiteral}, by field name, with the JSON file path they name.
     */
    @NonNull
    @Singular("jsonLiteral")
    Map<String, String> jsonLiterals;

    /**
     * Enclosing type names for nested declarations, e.g. {@code Outer}; empty for top-level ones.
     */
    @NonNull
    @Builder.Default
    String enclosingPath = "";

    /**
     * Non-static nested class, which cannot be instantiated without an outer instance.
     */
    boolean innerClass;

    /**
     * File name without extension of the unit declaring this class.
     */
    @NonNull
    @Builder.Default
    String unitName = "";

    public static String memberSignature(String methodName, int parameterCount) {
        return methodName + "/" + parameterCount;
    }

    public boolean isSerializable() {
        return serializableOverride.isPresent();
    }

    public boolean isJsonEnum() {
        return enumOverride.isPresent();
    }

    public boolean isEnum() {
        return kind == ClassKind.ENUM;
    }

    public boolean isGeneric() {
        return !typeParameters.isEmpty();
    }

    public boolean hasJsonLiterals() {
        return !jsonLiterals.isEmpty();
    }

    public List<TypeRef> boundsOf(String typeParameter) {
        return typeParameterBounds.getOrDefault(typeParameter, List.of());
    }

    /**
     * Type parameter list for a generic method or class declaration, e.g. {@code <T extends Number, U> },
     * or the empty string. {@code renderBound} writes each bound.
     */
    public String typeParameterDeclaration(Function<TypeRef, String> renderBound) {
        if (typeParameters.isEmpty()) {
            return "";
        }
        return typeParameters.stream()
                .map(t -> boundsOf(t).isEmpty() ? t
                        : t + " extends " + boundsOf(t).stream().map(renderBound).collect(Collectors.joining(" & ")))
                .collect(Collectors.joining(", ", "<", "> "));
    }

    /**
     * Prefix of the companion members generated for this class: {@code Request.Item} gives
     * {@code RequestItem}.
     */
    public String getMemberPrefix() {
        return getReferenceName().replace(".", "");
    }

    public boolean hasMember(String methodName, int parameterCount) {
        return existingMembers.contains(memberSignature(methodName, parameterCount));
    }

    /**
     * Name usable from the declaring package, e.g. {@code Outer.Point}.
     */
    public String getReferenceName() {
        return enclosingPath.isEmpty() ? name : enclosingPath + "." + name;
    }

    public String getQualifiedName() {
        return packageName.isEmpty() ? getReferenceName() : packageName + "." + getReferenceName();
    }

    public Optional<FieldDescriptor> findField(String fieldName) {
        return fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
    }

    /**
     * Type as used in generated signatures, e.g. {@code Box<T>}.
     */
    public String getTypeReference() {
        String reference = getReferenceName();
        return typeParameters.isEmpty() ? reference : reference + "<" + String.join(", ", typeParameters) + ">";
    }
}
