package com.jsonsource.generator.codegen.convert;

import java.util.Set;

import com.jsonsource.generator.model.TypeRef;

/**
 * Types a JSON value already is: {@code String}, {@code Number} and {@code Object}.
 */
public class NativeValueConverter implements TypeConverter {

    private static final Set<String> NAMES = Set.of(
            "String", "java.lang.String", "Number", "java.lang.Number", "Object", "java.lang.Object");

    @Override
    public boolean supports(TypeRef type, ConversionContext context) {
        return !type.isTypeVariable() && NAMES.contains(type.getName());
    }

    @Override
    public String decode(TypeRef type, String expression, ConversionContext context) {
        if (type.getSimpleName().equals("Object")) {
            return expression;
        }
        return "(" + type.getSimpleName() + ") " + expression;
    }

    @Override
    public String encode(TypeRef type, String expression, ConversionContext context) {
        return expression;
    }
}
