package com.jsonsource.generator.codegen.convert;

import java.util.Map;

import com.jsonsource.generator.model.TypeRef;

/**
 * Primitives and their boxes. JSON numbers arrive as any {@link Number}; characters travel as
 * one-character strings.
 */
public class PrimitiveConverter implements TypeConverter {

    private static final Map<String, String> NUMBER_ACCESSORS = Map.ofEntries(
            Map.entry("int", "intValue"), Map.entry("Integer", "intValue"),
            Map.entry("long", "longValue"), Map.entry("Long", "longValue"),
            Map.entry("short", "shortValue"), Map.entry("Short", "shortValue"),
            Map.entry("byte", "byteValue"), Map.entry("Byte", "byteValue"),
            Map.entry("double", "doubleValue"), Map.entry("Double", "doubleValue"),
            Map.entry("float", "floatValue"), Map.entry("Float", "floatValue"));

    @Override
    public boolean supports(TypeRef type, ConversionContext context) {
        if (type.isTypeVariable()) {
            return false;
        }
        String name = unqualified(type);
        return NUMBER_ACCESSORS.containsKey(name) || isBoolean(name) || isChar(name);
    }

    @Override
    public String decode(TypeRef type, String expression, ConversionContext context) {
        String name = unqualified(type);
        String conversion;
        if (isBoolean(name)) {
            return "(Boolean) " + expression;
        } else if (isChar(name)) {
            conversion = "((String) " + expression + ").charAt(0)";
        } else {
            conversion = "((Number) " + expression + ")." + NUMBER_ACCESSORS.get(name) + "()";
        }
        return type.isPrimitive() ? conversion : expression + " == null ? null : " + conversion;
    }

    @Override
    public String encode(TypeRef type, String expression, ConversionContext context) {
        String name = unqualified(type);
        if (!isChar(name)) {
            return expression;
        }
        String conversion = "String.valueOf(" + expression + ")";
        return type.isPrimitive() ? conversion : expression + " == null ? null : " + conversion;
    }

    private static String unqualified(TypeRef type) {
        return type.getName().startsWith("java.lang.") ? type.getSimpleName() : type.getName();
    }

    private static boolean isBoolean(String name) {
        return name.equals("boolean") || name.equals("Boolean");
    }

    private static boolean isChar(String name) {
        return name.equals("char") || name.equals("Character");
    }
}
