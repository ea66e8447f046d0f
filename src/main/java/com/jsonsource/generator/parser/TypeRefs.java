package com.jsonsource.generator.parser;

import java.util.Set;

import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.WildcardType;
import com.jsonsource.generator.model.TypeRef;

/**
 * Converts parser types into {@link TypeRef}s.
 */
final class TypeRefs {

    private TypeRefs() {
    }

    static TypeRef of(Type type, Set<String> typeVariables) {
        if (type instanceof ArrayType array) {
            TypeRef element = of(array.getElementType(), typeVariables);
            return element.toBuilder().arrayDimensions(array.getArrayLevel()).build();
        }
        if (type instanceof WildcardType wildcard) {
            // ? extends X reads as X; ? and ? super X read as Object
            return wildcard.getExtendedType()
                    .map(bound -> of(bound, typeVariables))
                    .orElse(TypeRef.OBJECT);
        }
        if (type instanceof ClassOrInterfaceType classType) {
            String name = classType.getNameWithScope();
            if (typeVariables.contains(name)) {
                return TypeRef.typeVariable(name);
            }
            TypeRef.TypeRefBuilder builder = TypeRef.builder().name(name);
            classType.getTypeArguments().ifPresent(args -> args.forEach(a -> builder.argument(of(a, typeVariables))));
            return builder.build();
        }
        if (type.isPrimitiveType()) {
            return TypeRef.of(type.asPrimitiveType().asString());
        }
        return TypeRef.of(type.asString());
    }
}
