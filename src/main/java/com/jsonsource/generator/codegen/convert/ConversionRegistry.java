package com.jsonsource.generator.codegen.convert;

import java.util.List;

import com.jsonsource.generator.codegen.exception.UnsupportedTypeException;
import com.jsonsource.generator.config.ConfigMerger;
import com.jsonsource.generator.model.TypeRef;

/**
 * Ordered list of {@link TypeConverter}s; the first one supporting a type wins.
 */
public class ConversionRegistry {

    private final List<TypeConverter> converters;

    public ConversionRegistry(List<TypeConverter> converters) {
        this.converters = List.copyOf(converters);
    }

    public static ConversionRegistry defaults() {
        return defaults(new ConfigMerger());
    }

    public static ConversionRegistry defaults(ConfigMerger configMerger) {
        return new ConversionRegistry(List.of(
                new PrimitiveConverter(),
                new NativeValueConverter(),
                new BigNumberConverter(),
                new TextValueConverter(),
                new EnumConverter(configMerger),
                new CollectionConverter(),
                new MapConverter(),
                new TypeVariableConverter(),
                new ConvertibleClassConverter(configMerger)));
    }

    public String decode(TypeRef type, String expression, ConversionContext context) {
        return find(type, context).decode(type, expression, context);
    }

    public String encode(TypeRef type, String expression, ConversionContext context) {
        return find(type, context).encode(type, expression, context);
    }

    private TypeConverter find(TypeRef type, ConversionContext context) {
        if (type.isArray()) {
            throw new UnsupportedTypeException(context.getElement(),
                    "Array type " + type.render() + " of " + context.getElement()
                            + " is not supported; use a List instead.");
        }
        return converters.stream()
                .filter(c -> c.supports(type, context))
                .findFirst()
                .orElseThrow(() -> new UnsupportedTypeException(context.getElement(),
                        "No converter for type " + type.render() + " of " + context.getElement() + "."));
    }
}
