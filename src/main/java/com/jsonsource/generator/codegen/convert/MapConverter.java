package com.jsonsource.generator.codegen.convert;

import com.jsonsource.generator.codegen.exception.UnsupportedTypeException;
import com.jsonsource.generator.model.TypeRef;

/**
 * {@code Map<String, V>}, value by value. JSON object keys are strings, so other key types are
 * rejected.
 */
public class MapConverter implements TypeConverter {

    @Override
    public boolean supports(TypeRef type, ConversionContext context) {
        return !type.isTypeVariable() && (type.getName().equals("Map") || type.getName().equals("java.util.Map"));
    }

    @Override
    public String decode(TypeRef type, String expression, ConversionContext context) {
        checkKeyType(type, context);
        String parameter = context.lambdaParameter();
        String value = context.getRegistry().decode(type.argument(1), parameter, context.nested());
        context.getHelpers().require(HelperFragments.DECODE_MAP);
        return "decodeMap(" + expression + ", " + parameter + " -> " + value + ")";
    }

    @Override
    public String encode(TypeRef type, String expression, ConversionContext context) {
        checkKeyType(type, context);
        String parameter = context.lambdaParameter();
        String value = context.getRegistry().encode(type.argument(1), parameter, context.nested());
        if (value.equals(parameter)) {
            return expression;
        }
        context.getHelpers().require(HelperFragments.ENCODE_MAP);
        return "encodeMap(" + expression + ", " + parameter + " -> " + value + ")";
    }

    private static void checkKeyType(TypeRef type, ConversionContext context) {
        if (!type.hasArguments()) {
            return;
        }
        String key = type.argument(0).getName();
        if (!key.equals("String") && !key.equals("java.lang.String")) {
            throw new UnsupportedTypeException(context.getElement(),
                    "Map key type " + key + " of " + context.getElement() + " is not supported; keys must be String.");
        }
    }
}
