package com.jsonsource.generator.config;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonsource.annotation.FieldRename;
import com.jsonsource.generator.codegen.exception.ConfigurationException;
import com.jsonsource.generator.codegen.util.NamingUtil;
import com.jsonsource.generator.model.AnnotationValues;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.FieldDescriptor;

/**
 * Layers global defaults, class-level and field-level overrides.
 *
 * Precedence: field > class > global. A member that is not written on an annotation inherits
 * from the next broader scope. Pure; every method is safe to call from any thread.
 */
public class ConfigMerger {

    private static final Logger log = LoggerFactory.getLogger(ConfigMerger.class);

    static final Set<String> CLASS_OPTIONS = Set.of(
            "createFactory", "createToJson", "createFieldMap", "createJsonKeys", "createPerFieldToJson",
            "genericArgumentFactories", "includeIfNull", "explicitToJson", "disallowUnrecognizedKeys",
            "ignoreUnannotated", "fieldRename", "patchSource");

    static final Set<String> KEY_OPTIONS = Set.of(
            "name", "includeFromJson", "includeToJson", "defaultValue", "required", "disallowNullValue",
            "includeIfNull");

    static final Set<String> ENUM_OPTIONS = Set.of("fieldRename");

    /**
     * Merges the three scopes into the switches of one class (or one field, when
     * {@code fieldOverride} is present).
     *
     * @throws ConfigurationException naming the annotated element when an override is malformed
     */
    public ResolvedConfig merge(GenerationOptions global, AnnotationValues classOverride,
                                AnnotationValues fieldOverride) {
        checkMembers(classOverride, CLASS_OPTIONS);
        checkMembers(fieldOverride, KEY_OPTIONS);

        return ResolvedConfig.builder()
                .createFactory(resolve("createFactory", global.isCreateFactory(), classOverride))
                .createToJson(resolve("createToJson", global.isCreateToJson(), classOverride))
                .createFieldMap(resolve("createFieldMap", global.isCreateFieldMap(), classOverride))
                .createJsonKeys(resolve("createJsonKeys", global.isCreateJsonKeys(), classOverride))
                .createPerFieldToJson(resolve("createPerFieldToJson", global.isCreatePerFieldToJson(), classOverride))
                .genericArgumentFactories(resolve("genericArgumentFactories", global.isGenericArgumentFactories(),
                        classOverride))
                .includeIfNull(resolve("includeIfNull", global.isIncludeIfNull(), fieldOverride, classOverride))
                .explicitToJson(resolve("explicitToJson", global.isExplicitToJson(), classOverride))
                .disallowUnrecognizedKeys(resolve("disallowUnrecognizedKeys", global.isDisallowUnrecognizedKeys(),
                        classOverride))
                .ignoreUnannotated(resolve("ignoreUnannotated", global.isIgnoreUnannotated(), classOverride))
                .patchSource(resolve("patchSource", global.isPatchSource(), classOverride))
                .fieldRename(resolveRename(global.getFieldRename(), classOverride))
                .build();
    }

    /**
     * Resolves the class switches plus one {@link KeyConfig} per field.
     */
    public ResolvedConfig resolve(GenerationOptions global, ClassModel model, List<FieldDescriptor> fields) {
        AnnotationValues classOverride = model.getSerializableOverride();
        ResolvedConfig classConfig = merge(global, classOverride, AnnotationValues.absent());

        Map<String, KeyConfig> keys = new LinkedHashMap<>();
        for (FieldDescriptor field : fields) {
            keys.put(field.getName(), resolveKey(global, classOverride, classConfig, field));
        }
        return classConfig.toBuilder().keys(keys).build();
    }

    /**
     * Rename strategy of a {@code @JsonEnum}; enums do not inherit the run's field rename.
     */
    public FieldRename resolveEnumRename(ClassModel enumModel) {
        AnnotationValues override = enumModel.getEnumOverride();
        checkMembers(override, ENUM_OPTIONS);
        return resolveRename(FieldRename.NONE, override);
    }

    KeyConfig resolveKey(GenerationOptions global, AnnotationValues classOverride, ResolvedConfig classConfig,
                         FieldDescriptor field) {
        AnnotationValues key = field.getKeyOverride();
        ResolvedConfig fieldScope = merge(global, classOverride, key);
        String element = key.isPresent() ? key.getElementName() : field.getName();

        String explicitName = readString(key, "name");
        if (explicitName != null && explicitName.isBlank()) {
            throw new ConfigurationException(element, "@JsonKey.name must not be blank on " + element + ".");
        }
        String defaultValue = readString(key, "defaultValue");
        if (defaultValue != null && defaultValue.isBlank()) {
            throw new ConfigurationException(element, "@JsonKey.defaultValue must not be blank on " + element + ".");
        }

        Boolean includeFromJson = readBoolean(key, "includeFromJson");
        Boolean includeToJson = readBoolean(key, "includeToJson");
        if (classConfig.isIgnoreUnannotated() && !key.isPresent()) {
            includeFromJson = Boolean.FALSE;
            includeToJson = Boolean.FALSE;
        }

        boolean required = Boolean.TRUE.equals(readBoolean(key, "required"));
        boolean disallowNullValue = Boolean.TRUE.equals(readBoolean(key, "disallowNullValue"));

        if (required && Boolean.FALSE.equals(includeFromJson)) {
            throw new ConfigurationException(element,
                    "Cannot set both required = true and includeFromJson = false on " + element + ".");
        }
        if (disallowNullValue && Boolean.TRUE.equals(readBoolean(key, "includeIfNull"))) {
            throw new ConfigurationException(element,
                    "Cannot set both disallowNullValue and includeIfNull to true on " + element + ".");
        }

        String jsonKey = explicitName != null
                ? explicitName
                : NamingUtil.rename(classConfig.getFieldRename(), field.getName());

        boolean includeIfNull = fieldScope.isIncludeIfNull() && !disallowNullValue;

        log.debug("Resolved key for {}: jsonKey={}, includeFromJson={}, includeToJson={}",
                element, jsonKey, includeFromJson, includeToJson);

        return KeyConfig.builder()
                .fieldName(field.getName())
                .jsonKey(jsonKey)
                .includeFromJson(includeFromJson)
                .includeToJson(includeToJson)
                .defaultValue(defaultValue)
                .required(required)
                .disallowNullValue(disallowNullValue)
                .includeIfNull(includeIfNull)
                .build();
    }

    /**
     * First explicit value among {@code overrides} (narrowest scope first), else the global value.
     */
    private boolean resolve(String option, boolean globalValue, AnnotationValues... overrides) {
        for (AnnotationValues override : overrides) {
            Boolean value = readBoolean(override, option);
            if (value != null) {
                return value;
            }
        }
        return globalValue;
    }

    private FieldRename resolveRename(FieldRename globalValue, AnnotationValues override) {
        Object raw = override.getValues().get("fieldRename");
        if (raw == null) {
            return globalValue;
        }
        if (raw instanceof AnnotationValues.EnumConstant constant
                && (constant.getTypeName().isEmpty() || constant.getTypeName().endsWith("FieldRename"))) {
            return Arrays.stream(FieldRename.values())
                    .filter(r -> r.name().equals(constant.getConstantName()))
                    .findFirst()
                    .orElseThrow(() -> malformed(override, "fieldRename", "a FieldRename constant", raw));
        }
        throw malformed(override, "fieldRename", "a FieldRename constant", raw);
    }

    private static void checkMembers(AnnotationValues override, Set<String> allowed) {
        for (String member : override.getValues().keySet()) {
            if (!allowed.contains(member)) {
                throw new ConfigurationException(override.getElementName(),
                        "Unknown member '" + member + "' in @" + override.getAnnotationName() + " on "
                                + override.getElementName() + ".");
            }
        }
    }

    private static Boolean readBoolean(AnnotationValues override, String member) {
        Object raw = override.getValues().get(member);
        if (raw == null || raw instanceof Boolean) {
            return (Boolean) raw;
        }
        throw malformed(override, member, "a boolean literal", raw);
    }

    private static String readString(AnnotationValues override, String member) {
        Object raw = override.getValues().get(member);
        if (raw == null || raw instanceof String) {
            return (String) raw;
        }
        throw malformed(override, member, "a string literal", raw);
    }

    private static ConfigurationException malformed(AnnotationValues override, String member, String expected,
                                                    Object actual) {
        return new ConfigurationException(override.getElementName(),
                "@" + override.getAnnotationName() + "." + member + " on " + override.getElementName()
                        + " must be " + expected + ", got `" + actual + "`.");
    }
}
