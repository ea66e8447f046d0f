package com.jsonsource.generator.codegen.convert;

import com.jsonsource.generator.config.GenerationOptions;
import com.jsonsource.generator.config.ResolvedConfig;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.TypeIndex;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * What a converter may consult while emitting the conversion of one field.
 */
@Value
@Builder(toBuilder = true)
public class ConversionContext {

    @NonNull
    ClassModel model;

    @NonNull
    ResolvedConfig config;

    /**
     * Run defaults, needed to resolve the configuration of other classes.
     */
    @NonNull
    GenerationOptions global;

    @NonNull
    TypeIndex typeIndex;

    @NonNull
    ConversionRegistry registry;

    /**
     * Shared members the emitted expressions call into.
     */
    @NonNull
    HelperRequirements helpers;

    /**
     * Element reported in conversion errors, e.g. {@code Point.x}.
     */
    @NonNull
    String element;

    /**
     * Nesting level; names lambda parameters {@code e0}, {@code e1}, ...
     */
    int depth;

    public String getPackageName() {
        return model.getPackageName();
    }

    public String lambdaParameter() {
        return "e" + depth;
    }

    public ConversionContext nested() {
        return toBuilder().depth(depth + 1).build();
    }

    /**
     * Whether type variables are converted through generic argument factories.
     */
    public boolean usesArgumentFactories() {
        return config.isGenericArgumentFactories() && model.isGeneric();
    }
}
