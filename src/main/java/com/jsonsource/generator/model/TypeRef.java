package com.jsonsource.generator.model;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A declared type as written in source, e.g. {@code int}, {@code List<String>},
 * {@code java.util.Map<String, Point>} or a type variable {@code T}.
 *
 * Pure structure only: type resolution beyond what the declaration spells out is not attempted.
 */
@Value
@Builder(toBuilder = true)
public class TypeRef {

    private static final Set<String> PRIMITIVES = Set.of(
            "boolean", "byte", "short", "int", "long", "char", "float", "double");

    public static final TypeRef OBJECT = TypeRef.of("Object");

    /**
     * Name as written, possibly qualified ({@code java.time.Instant}).
     */
    @NonNull
    String name;

    @NonNull
    @Singular("argument")
    List<TypeRef> arguments;

    int arrayDimensions;

    /**
     * Whether {@link #name} refers to a type parameter of the enclosing class.
     */
    boolean typeVariable;

    public static TypeRef of(String name, TypeRef... arguments) {
        return TypeRef.builder().name(name).arguments(List.of(arguments)).build();
    }

    public static TypeRef typeVariable(String name) {
        return TypeRef.builder().name(name).typeVariable(true).build();
    }

    /**
     * Name without any package qualifier.
     */
    public String getSimpleName() {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }

    public boolean isPrimitive() {
        return arrayDimensions == 0 && PRIMITIVES.contains(name);
    }

    public boolean isArray() {
        return arrayDimensions > 0;
    }

    public boolean hasArguments() {
        return !arguments.isEmpty();
    }

    public TypeRef argument(int index) {
        return index < arguments.size() ? arguments.get(index) : OBJECT;
    }

    /**
     * Whether this type or any of its arguments mentions a type variable.
     */
    public boolean mentionsTypeVariable() {
        return typeVariable || arguments.stream().anyMatch(TypeRef::mentionsTypeVariable);
    }

    /**
     * Source text for this type.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(name);
        if (!arguments.isEmpty()) {
            sb.append(arguments.stream().map(TypeRef::render).collect(Collectors.joining(", ", "<", ">")));
        }
        sb.append("[]".repeat(arrayDimensions));
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
