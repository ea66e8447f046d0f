package com.jsonsource.generator.codegen.selection;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.jsonsource.generator.model.AccessorKind;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.FieldDescriptor;
import com.jsonsource.generator.model.TypeIndex;
import com.jsonsource.generator.model.Visibility;

/**
 * Collects the fields of a class together with those inherited from superclasses found in the
 * {@link TypeIndex}. Superclass fields come first; a subclass field hides an inherited one with
 * the same name. Field types come back as written from outside the declaring class.
 */
public class ClassHierarchy {

    private final TypeIndex typeIndex;

    public ClassHierarchy(TypeIndex typeIndex) {
        this.typeIndex = typeIndex;
    }

    public List<FieldDescriptor> allFields(ClassModel model) {
        Deque<ClassModel> chain = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        ClassModel current = model;
        while (current != null && visited.add(current.getQualifiedName())) {
            chain.push(current);
            current = superclassOf(current).orElse(null);
        }

        Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        for (ClassModel declaring : chain) {
            for (FieldDescriptor field : declaring.getFields()) {
                FieldDescriptor qualified = field.toBuilder()
                        .type(typeIndex.qualify(field.getType(), declaring))
                        .build();
                FieldDescriptor visible = declaring == model ? qualified : asInherited(qualified, declaring, model);
                fields.remove(field.getName());
                fields.put(field.getName(), visible);
            }
        }
        return new ArrayList<>(fields.values());
    }

    private Optional<ClassModel> superclassOf(ClassModel model) {
        if (model.getSuperType() == null) {
            return Optional.empty();
        }
        return typeIndex.lookup(model.getSuperType(), model.getPackageName())
                .filter(c -> !c.isEnum());
    }

    /**
     * Package-level members of a superclass in another package are out of reach for the
     * generated companion.
     */
    private static FieldDescriptor asInherited(FieldDescriptor field, ClassModel declaring, ClassModel model) {
        if (declaring.getPackageName().equals(model.getPackageName())
                || field.getFieldVisibility() == null
                || field.getFieldVisibility() == Visibility.PUBLIC) {
            return field;
        }
        FieldDescriptor.FieldDescriptorBuilder builder = field.toBuilder().fieldVisibility(Visibility.PRIVATE);
        if (field.getAccessorKind() == AccessorKind.FIELD) {
            builder.visibility(Visibility.PRIVATE);
        }
        return builder.build();
    }
}
