package com.jsonsource.generator.codegen.emit;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.jsonsource.generator.codegen.convert.ConversionContext;
import com.jsonsource.generator.codegen.convert.HelperFragments;
import com.jsonsource.generator.codegen.convert.TypeVariableConverter;
import com.jsonsource.generator.codegen.selection.FactoryBinding;
import com.jsonsource.generator.codegen.selection.FieldSelection;
import com.jsonsource.generator.codegen.util.JavaLiterals;
import com.jsonsource.generator.codegen.util.NamingUtil;
import com.jsonsource.generator.config.KeyConfig;
import com.jsonsource.generator.config.ResolvedConfig;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.FieldDescriptor;

/**
 * Emits {@code static T tFromJson(Map<String, ?> json)}: key checks, the constructor call with
 * one converted value per parameter, then assignments of the remaining decoded fields.
 */
class DecodeFactoryEmitter {

    String emit(ClassModel model, FieldSelection selection, ConversionContext context) {
        FactoryBinding binding = selection.getFactoryBinding()
                .orElseThrow(() -> new IllegalStateException("No factory binding for " + model.getName()));
        ResolvedConfig config = context.getConfig();
        String type = model.getTypeReference();

        SourceWriter out = new SourceWriter()
                .line("@SuppressWarnings(\"unchecked\")")
                .open("public static " + typeParameters(model, context) + type + " "
                        + NamingUtil.decodeFunctionName(model.getReferenceName()) + "(" + parameters(model, context) + ")");

        checkKeys(selection, binding, config, context).ifPresent(out::line);

        String constructorCall = "new " + (model.isGeneric() ? model.getReferenceName() + "<>" : type)
                + arguments(model, binding, context);
        if (binding.getAssignedFields().isEmpty()) {
            out.line("return " + constructorCall + ";");
            return out.close().toString();
        }

        out.line(type + " instance = " + constructorCall + ";");
        for (FieldDescriptor field : binding.getAssignedFields()) {
            KeyConfig key = config.keyFor(field.getName());
            ConversionContext fieldContext = forField(context, model, field);
            if (key.hasDefaultValue()) {
                out.line(field.assignStatement("instance", valueOf(field, key, fieldContext)));
            } else {
                out.open("if (json.containsKey(" + JavaLiterals.quote(key.getJsonKey()) + "))")
                        .line(field.assignStatement("instance", valueOf(field, key, fieldContext)))
                        .close();
            }
        }
        out.line("return instance;");
        return out.close().toString();
    }

    private static String arguments(ClassModel model, FactoryBinding binding, ConversionContext context) {
        List<FieldDescriptor> arguments = binding.getConstructorArguments();
        if (arguments.isEmpty()) {
            return "()";
        }
        return arguments.stream()
                .map(f -> "            " + valueOf(f, context.getConfig().keyFor(f.getName()),
                        forField(context, model, f)))
                .collect(Collectors.joining(",\n", "(\n", ")"));
    }

    /**
     * Converted value of one key, falling back to the configured default when the key is
     * missing or null.
     */
    private static String valueOf(FieldDescriptor field, KeyConfig key, ConversionContext context) {
        String raw = "json.get(" + JavaLiterals.quote(key.getJsonKey()) + ")";
        String converted = context.getRegistry().decode(field.getType(), raw, context);
        if (!key.hasDefaultValue()) {
            return converted;
        }
        return raw + " == null ? " + key.getDefaultValue() + " : " + parenthesize(converted);
    }

    private static Optional<String> checkKeys(FieldSelection selection, FactoryBinding binding,
                                                        ResolvedConfig config, ConversionContext context) {
        List<FieldDescriptor> decoded = new ArrayList<>(binding.getConstructorArguments());
        decoded.addAll(binding.getAssignedFields());
        List<String> required = new ArrayList<>();
        List<String> disallowNull = new ArrayList<>();
        for (FieldDescriptor field : decoded) {
            KeyConfig key = config.keyFor(field.getName());
            if (key.isRequired()) {
                required.add(key.getJsonKey());
            }
            if (key.isDisallowNullValue()) {
                disallowNull.add(key.getJsonKey());
            }
        }
        if (!config.isDisallowUnrecognizedKeys() && required.isEmpty() && disallowNull.isEmpty()) {
            return Optional.empty();
        }

        String allowed = "null";
        if (config.isDisallowUnrecognizedKeys()) {
            Set<String> keys = new LinkedHashSet<>();
            selection.getDecodable().forEach(f -> keys.add(config.keyFor(f.getName()).getJsonKey()));
            selection.getUsable().forEach(f -> keys.add(config.keyFor(f.getName()).getJsonKey()));
            allowed = listOf(new ArrayList<>(keys));
        }
        context.getHelpers().require(HelperFragments.CHECK_KEYS);
        return Optional.of("checkKeys(json, " + allowed + ", " + listOf(required) + ", "
                + listOf(disallowNull) + ");");
    }

    private static String listOf(List<String> keys) {
        return keys.stream().map(JavaLiterals::quote).collect(Collectors.joining(", ", "List.of(", ")"));
    }

    private static String parameters(ClassModel model, ConversionContext context) {
        StringBuilder sb = new StringBuilder("Map<String, ?> json");
        if (context.usesArgumentFactories()) {
            for (String typeParameter : model.getTypeParameters()) {
                sb.append(", Function<Object, ").append(typeParameter).append("> ")
                        .append(TypeVariableConverter.decodeFactoryName(typeParameter));
            }
        }
        return sb.toString();
    }

    /**
     * Type parameters of a generated generic method, bounds included.
     */
    static String typeParameters(ClassModel model, ConversionContext context) {
        return model.typeParameterDeclaration(bound -> context.getTypeIndex().qualify(bound, model).render());
    }

    static ConversionContext forField(ConversionContext context, ClassModel model, FieldDescriptor field) {
        return context.toBuilder().element(model.getName() + "." + field.getName()).build();
    }

    static String parenthesize(String expression) {
        return expression.contains(" ? ") ? "(" + expression + ")" : expression;
    }
}
