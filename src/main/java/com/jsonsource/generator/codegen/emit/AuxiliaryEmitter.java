package com.jsonsource.generator.codegen.emit;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.jsonsource.generator.codegen.convert.ConversionContext;
import com.jsonsource.generator.codegen.convert.TypeVariableConverter;
import com.jsonsource.generator.codegen.exception.ConfigurationException;
import com.jsonsource.generator.codegen.util.JavaLiterals;
import com.jsonsource.generator.codegen.util.NamingUtil;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.FieldDescriptor;

/**
 * Optional companions of the encode/decode pair: the field map, the key constants class and the
 * per-field encoders.
 */
class AuxiliaryEmitter {

    /**
     * {@code POINT_FIELD_MAP}: field name to output key.
     */
    String fieldMap(ClassModel model, List<FieldDescriptor> fields, ConversionContext context) {
        String header = "public static final Map<String, String> " + fieldMapName(model) + " = ";
        if (fields.isEmpty()) {
            return header + "Map.of();";
        }
        return fields.stream()
                .map(f -> "        Map.entry(" + JavaLiterals.quote(f.getName()) + ", "
                        + JavaLiterals.quote(context.getConfig().keyFor(f.getName()).getJsonKey()) + ")")
                .collect(Collectors.joining(",\n", header + "Map.ofEntries(\n", ");"));
    }

    /**
     * {@code PointJsonKeys}: one constant per output key.
     */
    String jsonKeys(ClassModel model, List<FieldDescriptor> fields, ConversionContext context) {
        String className = model.getMemberPrefix() + "JsonKeys";
        SourceWriter out = new SourceWriter().open("public static final class " + className);
        Map<String, String> constants = new HashMap<>();
        for (FieldDescriptor field : fields) {
            String constant = NamingUtil.toScreamingSnakeCase(field.getName());
            String previous = constants.putIfAbsent(constant, field.getName());
            if (previous != null) {
                throw new ConfigurationException(model.getName(), "Fields " + previous + " and " + field.getName()
                        + " of " + model.getName() + " both give the key constant " + constant + ".");
            }
            out.line("public static final String " + constant + " = "
                    + JavaLiterals.quote(context.getConfig().keyFor(field.getName()).getJsonKey()) + ";");
        }
        if (!fields.isEmpty()) {
            out.blank();
        }
        return out.open("private " + className + "()")
                .close()
                .close()
                .toString();
    }

    /**
     * {@code PointPerFieldToJson}: one static encoder per field.
     */
    String perFieldToJson(ClassModel model, List<FieldDescriptor> fields, ConversionContext context) {
        String className = model.getMemberPrefix() + "PerFieldToJson";
        SourceWriter out = new SourceWriter().open("public static final class " + className);
        for (FieldDescriptor field : fields) {
            ConversionContext fieldContext = DecodeFactoryEmitter.forField(context, model, field);
            String value = fieldContext.getRegistry().encode(field.getType(), "value", fieldContext);
            out.open("public static " + typeParameters(model, field, context) + "Object " + field.getName() + "("
                            + field.getType().render() + " value" + encodeFactories(model, field, context) + ")")
                    .line("return " + value + ";")
                    .close()
                    .blank();
        }
        return out.open("private " + className + "()")
                .close()
                .close()
                .toString();
    }

    static String fieldMapName(ClassModel model) {
        return NamingUtil.toScreamingSnakeCase(model.getReferenceName().replace('.', '_')) + "_FIELD_MAP";
    }

    private static String typeParameters(ClassModel model, FieldDescriptor field, ConversionContext context) {
        if (!field.getType().mentionsTypeVariable()) {
            return "";
        }
        return DecodeFactoryEmitter.typeParameters(model, context);
    }

    private static String encodeFactories(ClassModel model, FieldDescriptor field, ConversionContext context) {
        if (!context.usesArgumentFactories() || !field.getType().mentionsTypeVariable()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String typeParameter : model.getTypeParameters()) {
            sb.append(", Function<").append(typeParameter).append(", Object> ")
                    .append(TypeVariableConverter.encodeFactoryName(typeParameter));
        }
        return sb.toString();
    }
}
