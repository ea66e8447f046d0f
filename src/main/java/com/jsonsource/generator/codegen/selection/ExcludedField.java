package com.jsonsource.generator.codegen.selection;

import com.jsonsource.generator.model.FieldDescriptor;

import lombok.NonNull;
import lombok.Value;

/**
 * A field left out of decoding, with the human-readable reason.
 */
@Value
public class ExcludedField {

    public static final String PRIVATE_FIELD = "It is assigned to a private field.";
    public static final String SETTER_ONLY = "Setter-only properties are not supported.";
    public static final String NOT_FROM_JSON = "It is assigned to a field not meant to be used in fromJson.";
    public static final String NOT_ASSIGNED = "It is not assigned by the decode factory.";

    @NonNull
    FieldDescriptor field;

    @NonNull
    String reason;

    public String getFieldName() {
        return field.getName();
    }
}
