package com.jsonsource.generator.codegen.convert;

import java.util.List;
import java.util.stream.Collectors;

import com.jsonsource.annotation.FieldRename;
import com.jsonsource.generator.codegen.util.JavaLiterals;
import com.jsonsource.generator.codegen.util.NamingUtil;
import com.jsonsource.generator.config.ConfigMerger;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.TypeRef;

/**
 * Enums declared in the scanned sources. Values go through a constant map from enum constant to
 * JSON string, renamed by the enum's {@code @JsonEnum(fieldRename)}.
 */
public class EnumConverter implements TypeConverter {

    private final ConfigMerger configMerger;

    public EnumConverter(ConfigMerger configMerger) {
        this.configMerger = configMerger;
    }

    @Override
    public boolean supports(TypeRef type, ConversionContext context) {
        return context.getTypeIndex().lookupEnum(type, context.getPackageName()).isPresent();
    }

    @Override
    public String decode(TypeRef type, String expression, ConversionContext context) {
        String constant = requireMap(type, context);
        context.getHelpers().require(HelperFragments.DECODE_ENUM);
        return "decodeEnum(" + constant + ", " + expression + ")";
    }

    @Override
    public String encode(TypeRef type, String expression, ConversionContext context) {
        String constant = requireMap(type, context);
        return expression + " == null ? null : " + constant + ".get(" + expression + ")";
    }

    private String requireMap(TypeRef type, ConversionContext context) {
        ClassModel enumModel = context.getTypeIndex().lookupEnum(type, context.getPackageName()).orElseThrow();
        String typeText = enumModel.getPackageName().equals(context.getPackageName())
                ? enumModel.getReferenceName()
                : enumModel.getQualifiedName();
        context.getHelpers().require(enumMap(typeText, enumModel.getEnumConstants(),
                configMerger.resolveEnumRename(enumModel)));
        return enumMapName(typeText);
    }

    /**
     * {@code Color} gives {@code COLOR_ENUM_MAP}, {@code Car.Kind} gives {@code CAR_KIND_ENUM_MAP}.
     */
    public static String enumMapName(String typeText) {
        return NamingUtil.toScreamingSnakeCase(typeText.replace(".", "_")) + "_ENUM_MAP";
    }

    /**
     * Constant mapping each enum constant to its JSON value.
     */
    public static String enumMap(String typeText, List<String> constants, FieldRename rename) {
        String header = "private static final Map<" + typeText + ", String> " + enumMapName(typeText) + " = ";
        if (constants.isEmpty()) {
            return header + "Map.of();";
        }
        return constants.stream()
                .map(c -> "        Map.entry(" + typeText + "." + c + ", " + JavaLiterals.quote(NamingUtil.rename(rename, c))
                        + ")")
                .collect(Collectors.joining(",\n", header + "Map.ofEntries(\n", ");"));
    }
}
