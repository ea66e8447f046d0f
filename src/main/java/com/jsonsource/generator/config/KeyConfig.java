package com.jsonsource.generator.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Resolved per-field configuration.
 *
 * {@code includeFromJson} and {@code includeToJson} stay tri-state: {@code null} means the field
 * follows the selection policy, {@code true}/{@code false} force it in or out.
 */
@Value
@Builder(toBuilder = true)
public class KeyConfig {

    @NonNull
    String fieldName;

    /**
     * Output key after rename configuration.
     */
    @NonNull
    String jsonKey;

    Boolean includeFromJson;

    Boolean includeToJson;

    /**
     * Java expression used for a missing or null key, {@code null} when not configured.
     */
    String defaultValue;

    boolean required;

    boolean disallowNullValue;

    boolean includeIfNull;

    public boolean isExplicitYesFromJson() {
        return Boolean.TRUE.equals(includeFromJson);
    }

    public boolean isExplicitNoFromJson() {
        return Boolean.FALSE.equals(includeFromJson);
    }

    public boolean isExplicitYesToJson() {
        return Boolean.TRUE.equals(includeToJson);
    }

    public boolean isExplicitNoToJson() {
        return Boolean.FALSE.equals(includeToJson);
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }
}
