package com.jsonsource.generator.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only index of every class declared in the scanned sources, shared by all units of a run.
 */
public final class TypeIndex {

    private static final TypeIndex EMPTY = new TypeIndex(Map.of());

    private final Map<String, List<ClassModel>> bySimpleName;

    private TypeIndex(Map<String, List<ClassModel>> bySimpleName) {
        this.bySimpleName = bySimpleName;
    }

    public static TypeIndex empty() {
        return EMPTY;
    }

    public static TypeIndex of(Collection<SourceUnit> units) {
        Map<String, List<ClassModel>> index = new LinkedHashMap<>();
        for (SourceUnit unit : units) {
            for (ClassModel model : unit.getClasses()) {
                index.computeIfAbsent(model.getName(), k -> new ArrayList<>()).add(model);
            }
        }
        index.replaceAll((k, v) -> Collections.unmodifiableList(v));
        return new TypeIndex(Collections.unmodifiableMap(index));
    }

    /**
     * Finds the class a type refers to. Qualified names must match exactly; simple names and
     * {@code Outer.Inner} references prefer the requesting package and otherwise resolve only when
     * unambiguous.
     */
    public Optional<ClassModel> lookup(TypeRef type, String fromPackage) {
        if (type.isTypeVariable() || type.isPrimitive() || type.isArray()) {
            return Optional.empty();
        }
        List<ClassModel> candidates = bySimpleName.getOrDefault(type.getSimpleName(), List.of());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        if (!type.getName().equals(type.getSimpleName())) {
            Optional<ClassModel> qualified = candidates.stream()
                    .filter(c -> c.getQualifiedName().equals(type.getName()))
                    .findFirst();
            if (qualified.isPresent()) {
                return qualified;
            }
            // Outer.Inner written from the declaring package or imported
            candidates = candidates.stream()
                    .filter(c -> c.getReferenceName().equals(type.getName()))
                    .toList();
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
        }
        Optional<ClassModel> samePackage = candidates.stream()
                .filter(c -> c.getPackageName().equals(fromPackage))
                .findFirst();
        if (samePackage.isPresent()) {
            return samePackage;
        }
        return candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
    }

    /**
     * Rewrites the names {@code scope} sees through its enclosing declarations so they can be written
     * outside of them: {@code Kind} declared in {@code Car} becomes {@code Car.Kind}. Type variables,
     * primitives and names resolving elsewhere are kept as written.
     */
    public TypeRef qualify(TypeRef type, ClassModel scope) {
        TypeRef.TypeRefBuilder builder = type.toBuilder().clearArguments();
        for (TypeRef argument : type.getArguments()) {
            builder.argument(qualify(argument, scope));
        }
        if (!type.isTypeVariable() && !type.isPrimitive()) {
            builder.name(qualifyName(type.getName(), scope));
        }
        return builder.build();
    }

    private String qualifyName(String name, ClassModel scope) {
        int dot = name.indexOf('.');
        String first = dot < 0 ? name : name.substring(0, dot);
        String rest = dot < 0 ? "" : name.substring(dot);
        List<ClassModel> candidates = bySimpleName.getOrDefault(first, List.of());
        String enclosing = scope.getReferenceName();
        while (!enclosing.isEmpty() && !candidates.isEmpty()) {
            String path = enclosing;
            Optional<ClassModel> member = candidates.stream()
                    .filter(c -> c.getPackageName().equals(scope.getPackageName()) && c.getEnclosingPath().equals(path))
                    .findFirst();
            if (member.isPresent()) {
                return member.get().getReferenceName() + rest;
            }
            int last = enclosing.lastIndexOf('.');
            enclosing = last < 0 ? "" : enclosing.substring(0, last);
        }
        return name;
    }

    public Optional<ClassModel> lookupEnum(TypeRef type, String fromPackage) {
        return lookup(type, fromPackage).filter(ClassModel::isEnum);
    }

    public int size() {
        return bySimpleName.values().stream().mapToInt(List::size).sum();
    }
}
