package com.jsonsource.generator.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class ParameterDescriptor {

    @NonNull
    String name;

    @NonNull
    TypeRef type;
}
