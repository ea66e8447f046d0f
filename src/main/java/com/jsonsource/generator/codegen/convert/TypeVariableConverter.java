package com.jsonsource.generator.codegen.convert;

import com.jsonsource.generator.model.TypeRef;

/**
 * Type parameters of the generated class. With generic argument factories the conversion is
 * delegated to the {@code fromJsonT}/{@code toJsonT} functions passed by the caller; otherwise
 * the value is cast and stored as is.
 */
public class TypeVariableConverter implements TypeConverter {

    @Override
    public boolean supports(TypeRef type, ConversionContext context) {
        return type.isTypeVariable();
    }

    @Override
    public String decode(TypeRef type, String expression, ConversionContext context) {
        if (context.usesArgumentFactories()) {
            return decodeFactoryName(type.getName()) + ".apply(" + expression + ")";
        }
        return "(" + type.getName() + ") " + expression;
    }

    @Override
    public String encode(TypeRef type, String expression, ConversionContext context) {
        if (context.usesArgumentFactories()) {
            return encodeFactoryName(type.getName()) + ".apply(" + expression + ")";
        }
        return expression;
    }

    public static String decodeFactoryName(String typeVariable) {
        return "fromJson" + typeVariable;
    }

    public static String encodeFactoryName(String typeVariable) {
        return "toJson" + typeVariable;
    }
}
