package com.jsonsource.generator.config;

import com.jsonsource.annotation.FieldRename;

import lombok.Builder;
import lombok.Value;

/**
 * Global generation defaults for a run. Class and field annotations override them.
 */
@Value
@Builder(toBuilder = true)
public class GenerationOptions {

    @Builder.Default
    boolean createFactory = true;

    @Builder.Default
    boolean createToJson = true;

    boolean createFieldMap;

    boolean createJsonKeys;

    boolean createPerFieldToJson;

    boolean genericArgumentFactories;

    @Builder.Default
    boolean includeIfNull = true;

    boolean explicitToJson;

    boolean disallowUnrecognizedKeys;

    boolean ignoreUnannotated;

    @Builder.Default
    FieldRename fieldRename = FieldRename.NONE;

    boolean patchSource;

    public static GenerationOptions defaults() {
        return GenerationOptions.builder().build();
    }
}
