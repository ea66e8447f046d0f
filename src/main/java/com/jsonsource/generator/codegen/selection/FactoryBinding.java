package com.jsonsource.generator.codegen.selection;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.jsonsource.generator.model.ConstructorModel;
import com.jsonsource.generator.model.FieldDescriptor;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * How the decode factory builds an instance: the constructor to call, the field bound to each
 * of its parameters, and the fields assigned after construction.
 */
@Value
@Builder
public class FactoryBinding {

    @NonNull
    ConstructorModel constructor;

    /**
     * One field per constructor parameter, in parameter order.
     */
    @NonNull
    @Singular("constructorArgument")
    List<FieldDescriptor> constructorArguments;

    /**
     * Fields set through a setter or a public non-final field, in declaration order.
     */
    @NonNull
    @Singular("assignedField")
    List<FieldDescriptor> assignedFields;

    /**
     * Names of every field the factory consumes.
     */
    public Set<String> getUsedFields() {
        Set<String> used = new LinkedHashSet<>();
        constructorArguments.forEach(f -> used.add(f.getName()));
        assignedFields.forEach(f -> used.add(f.getName()));
        return used;
    }
}
