package com.jsonsource.generator.codegen.emit;

import com.jsonsource.generator.codegen.convert.ConversionContext;
import com.jsonsource.generator.codegen.convert.HelperFragments;
import com.jsonsource.generator.codegen.convert.TypeVariableConverter;
import com.jsonsource.generator.codegen.util.JavaLiterals;
import com.jsonsource.generator.codegen.util.NamingUtil;
import com.jsonsource.generator.config.KeyConfig;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.FieldDescriptor;

/**
 * Emits {@code static Map<String, Object> tToJson(T instance)}. Keys keep declaration order;
 * fields with {@code includeIfNull = false} are only written when non-null.
 */
class EncodeFunctionEmitter {

    String emit(ClassModel model, Iterable<FieldDescriptor> fields, ConversionContext context) {
        SourceWriter out = new SourceWriter()
                .open("public static " + DecodeFactoryEmitter.typeParameters(model, context) + "Map<String, Object> "
                        + NamingUtil.encodeFunctionName(model.getReferenceName()) + "(" + parameters(model, context) + ")")
                .line("Map<String, Object> json = new LinkedHashMap<>();");

        for (FieldDescriptor field : fields) {
            KeyConfig key = context.getConfig().keyFor(field.getName());
            ConversionContext fieldContext = DecodeFactoryEmitter.forField(context, model, field);
            String value = fieldContext.getRegistry().encode(field.getType(), field.readExpression("instance"),
                    fieldContext);
            String jsonKey = JavaLiterals.quote(key.getJsonKey());
            if (key.isIncludeIfNull() || field.getType().isPrimitive()) {
                out.line("json.put(" + jsonKey + ", " + value + ");");
            } else {
                context.getHelpers().require(HelperFragments.PUT_IF_NOT_NULL);
                out.line("putIfNotNull(json, " + jsonKey + ", " + value + ");");
            }
        }
        return out.line("return json;").close().toString();
    }

    private static String parameters(ClassModel model, ConversionContext context) {
        StringBuilder sb = new StringBuilder(model.getTypeReference()).append(" instance");
        if (context.usesArgumentFactories()) {
            for (String typeParameter : model.getTypeParameters()) {
                sb.append(", Function<").append(typeParameter).append(", Object> ")
                        .append(TypeVariableConverter.encodeFactoryName(typeParameter));
            }
        }
        return sb.toString();
    }
}
