package com.jsonsource.generator.codegen.convert;

import java.util.Set;

import com.jsonsource.generator.model.TypeRef;

/**
 * {@code List}, {@code Set}, {@code Collection} and {@code Iterable}, element by element.
 */
public class CollectionConverter implements TypeConverter {

    private static final Set<String> LIST_TYPES = Set.of("List", "Collection", "Iterable");

    @Override
    public boolean supports(TypeRef type, ConversionContext context) {
        String simpleName = type.getSimpleName();
        boolean known = LIST_TYPES.contains(simpleName) || simpleName.equals("Set");
        if (!known || type.isTypeVariable()) {
            return false;
        }
        String name = type.getName();
        return name.equals(simpleName) || name.equals("java.util." + simpleName) || name.equals("java.lang.Iterable");
    }

    @Override
    public String decode(TypeRef type, String expression, ConversionContext context) {
        String parameter = context.lambdaParameter();
        String element = context.getRegistry().decode(type.argument(0), parameter, context.nested());
        boolean set = type.getSimpleName().equals("Set");
        context.getHelpers().require(set ? HelperFragments.DECODE_SET : HelperFragments.DECODE_LIST);
        return (set ? "decodeSet(" : "decodeList(") + expression + ", " + parameter + " -> " + element + ")";
    }

    @Override
    public String encode(TypeRef type, String expression, ConversionContext context) {
        String parameter = context.lambdaParameter();
        String element = context.getRegistry().encode(type.argument(0), parameter, context.nested());
        if (element.equals(parameter)) {
            return expression;
        }
        context.getHelpers().require(HelperFragments.ENCODE_ITERABLE);
        return "encodeIterable(" + expression + ", " + parameter + " -> " + element + ")";
    }
}
