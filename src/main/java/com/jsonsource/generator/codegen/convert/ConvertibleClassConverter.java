package com.jsonsource.generator.codegen.convert;

import java.util.Optional;

import com.jsonsource.generator.codegen.util.NamingUtil;
import com.jsonsource.generator.config.ConfigMerger;
import com.jsonsource.generator.model.AnnotationValues;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.TypeRef;

/**
 * Any other declared type, treated as a class with its own JSON support.
 *
 * Classes annotated {@code @JsonSerializable} in the scanned sources go through their companion
 * functions. Others must offer {@code static X fromJson(Map)} and, for
 * {@code explicitToJson}, {@code toJson()}. Without {@code explicitToJson} the value is stored
 * as is.
 */
public class ConvertibleClassConverter implements TypeConverter {

    private final ConfigMerger configMerger;

    public ConvertibleClassConverter(ConfigMerger configMerger) {
        this.configMerger = configMerger;
    }

    @Override
    public boolean supports(TypeRef type, ConversionContext context) {
        return !type.isPrimitive() && !type.isArray() && !type.isTypeVariable();
    }

    @Override
    public String decode(TypeRef type, String expression, ConversionContext context) {
        String json = "(Map<String, ?>) " + expression;
        Optional<ClassModel> target = serializable(type, context);
        String call;
        if (target.isPresent()) {
            call = companion(target.get(), context) + "." + NamingUtil.decodeFunctionName(target.get().getReferenceName())
                    + "(" + json + argumentFactories(target.get(), type, context, true) + ")";
        } else {
            call = type.getName() + ".fromJson(" + json + ")";
        }
        return expression + " == null ? null : " + call;
    }

    @Override
    public String encode(TypeRef type, String expression, ConversionContext context) {
        if (!context.getConfig().isExplicitToJson()) {
            return expression;
        }
        Optional<ClassModel> target = serializable(type, context);
        String call;
        if (target.isPresent()) {
            call = companion(target.get(), context) + "." + NamingUtil.encodeFunctionName(target.get().getReferenceName())
                    + "(" + expression + argumentFactories(target.get(), type, context, false) + ")";
        } else {
            call = expression + ".toJson()";
        }
        return expression + " == null ? null : " + call;
    }

    private static Optional<ClassModel> serializable(TypeRef type, ConversionContext context) {
        return context.getTypeIndex().lookup(type, context.getPackageName())
                .filter(c -> c.isSerializable() && !c.isEnum());
    }

    private static String companion(ClassModel target, ConversionContext context) {
        String companion = NamingUtil.companionClassName(target.getUnitName());
        if (target.getPackageName().isEmpty() || target.getPackageName().equals(context.getPackageName())) {
            return companion;
        }
        return target.getPackageName() + "." + companion;
    }

    /**
     * Conversion functions for the type arguments of a generic class generated with argument
     * factories, e.g. {@code , e0 -> (String) e0}.
     */
    private String argumentFactories(ClassModel target, TypeRef type, ConversionContext context, boolean decode) {
        if (!target.isGeneric() || !configMerger.merge(context.getGlobal(), target.getSerializableOverride(),
                AnnotationValues.absent()).isGenericArgumentFactories()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        String parameter = context.lambdaParameter();
        for (int i = 0; i < target.getTypeParameters().size(); i++) {
            TypeRef argument = type.argument(i);
            String body = decode
                    ? context.getRegistry().decode(argument, parameter, context.nested())
                    : context.getRegistry().encode(argument, parameter, context.nested());
            sb.append(", ").append(parameter).append(" -> ").append(body);
        }
        return sb.toString();
    }
}
