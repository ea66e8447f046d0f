package com.jsonsource.generator.codegen.selection;

import java.util.List;
import java.util.Optional;

import com.jsonsource.generator.codegen.diagnostics.Diagnostic;
import com.jsonsource.generator.model.FieldDescriptor;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of field selection for one class.
 *
 * {@link #usable} is always a subset of the class's fields in declaration order; every field of
 * {@link #excluded} carries a non-empty reason.
 */
@Value
@Builder
public class FieldSelection {

    /**
     * Fields encoded by {@code toJson}, after forced inclusions and exclusions.
     */
    @NonNull
    @Singular("usableField")
    List<FieldDescriptor> usable;

    /**
     * Fields the decode factory may read, before binding.
     */
    @NonNull
    @Singular("decodableField")
    List<FieldDescriptor> decodable;

    @NonNull
    @Singular("excludedField")
    List<ExcludedField> excluded;

    /**
     * Absent when factory generation is disabled.
     */
    FactoryBinding binding;

    @NonNull
    @Singular("diagnostic")
    List<Diagnostic> diagnostics;

    public Optional<FactoryBinding> getFactoryBinding() {
        return Optional.ofNullable(binding);
    }

    public Optional<String> reasonFor(String fieldName) {
        return excluded.stream()
                .filter(e -> e.getFieldName().equals(fieldName))
                .map(ExcludedField::getReason)
                .findFirst();
    }
}
