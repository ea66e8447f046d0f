package com.jsonsource.generator.config;

import java.util.Map;

import com.jsonsource.annotation.FieldRename;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Generation switches of one class after layering global, class and field scopes.
 * Computed once per class; read-only afterwards.
 */
@Value
@Builder(toBuilder = true)
public class ResolvedConfig {

    boolean createFactory;
    boolean createToJson;
    boolean createFieldMap;
    boolean createJsonKeys;
    boolean createPerFieldToJson;
    boolean genericArgumentFactories;
    boolean includeIfNull;
    boolean explicitToJson;
    boolean disallowUnrecognizedKeys;
    boolean ignoreUnannotated;
    boolean patchSource;

    @NonNull
    FieldRename fieldRename;

    /**
     * Resolved key configuration per field name.
     */
    @NonNull
    @Singular("key")
    Map<String, KeyConfig> keys;

    public KeyConfig keyFor(String fieldName) {
        KeyConfig key = keys.get(fieldName);
        if (key == null) {
            throw new IllegalStateException("No key configuration resolved for field " + fieldName);
        }
        return key;
    }
}
