package com.jsonsource.generator.codegen.convert;

import java.util.Map;

import com.jsonsource.generator.model.TypeRef;

/**
 * {@code BigDecimal} and {@code BigInteger}, read from any number or numeric string and written
 * as strings so that no precision is lost.
 */
public class BigNumberConverter implements TypeConverter {

    private static final Map<String, String> TYPES = Map.of(
            "BigDecimal", "java.math.BigDecimal",
            "BigInteger", "java.math.BigInteger");

    @Override
    public boolean supports(TypeRef type, ConversionContext context) {
        String qualified = TYPES.get(type.getSimpleName());
        return qualified != null && (type.getName().equals(type.getSimpleName()) || type.getName().equals(qualified));
    }

    @Override
    public String decode(TypeRef type, String expression, ConversionContext context) {
        return expression + " == null ? null : new " + TYPES.get(type.getSimpleName()) + "(" + expression
                + ".toString())";
    }

    @Override
    public String encode(TypeRef type, String expression, ConversionContext context) {
        return expression + " == null ? null : " + expression + ".toString()";
    }
}
