package com.jsonsource.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One constructor of a class, explicit or implicit.
 */
@Value
@Builder(toBuilder = true)
public class ConstructorModel {

    @NonNull
    @Singular("parameter")
    List<ParameterDescriptor> parameters;

    @NonNull
    Visibility visibility;

    /**
     * Carries {@code @JsonConstructor}.
     */
    boolean annotated;

    /**
     * Not written in source (default constructor of a class, canonical constructor of a record).
     */
    boolean implicit;

    public boolean isNoArg() {
        return parameters.isEmpty();
    }
}
