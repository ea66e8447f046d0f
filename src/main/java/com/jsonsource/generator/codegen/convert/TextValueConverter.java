package com.jsonsource.generator.codegen.convert;

import java.util.Map;

import com.jsonsource.generator.model.TypeRef;

/**
 * Value types with a canonical string form: {@code java.time} types, {@code URI} and
 * {@code UUID}. Encoded with {@code toString()}.
 */
public class TextValueConverter implements TypeConverter {

    private static final Map<String, String> FACTORIES = Map.of(
            "Instant", "java.time.Instant.parse",
            "LocalDate", "java.time.LocalDate.parse",
            "LocalDateTime", "java.time.LocalDateTime.parse",
            "LocalTime", "java.time.LocalTime.parse",
            "OffsetDateTime", "java.time.OffsetDateTime.parse",
            "ZonedDateTime", "java.time.ZonedDateTime.parse",
            "Duration", "java.time.Duration.parse",
            "URI", "java.net.URI.create",
            "UUID", "java.util.UUID.fromString");

    @Override
    public boolean supports(TypeRef type, ConversionContext context) {
        String factory = FACTORIES.get(type.getSimpleName());
        if (factory == null || type.isTypeVariable()) {
            return false;
        }
        String qualified = factory.substring(0, factory.lastIndexOf('.'));
        return type.getName().equals(type.getSimpleName()) || type.getName().equals(qualified);
    }

    @Override
    public String decode(TypeRef type, String expression, ConversionContext context) {
        return expression + " == null ? null : " + FACTORIES.get(type.getSimpleName()) + "((String) " + expression
                + ")";
    }

    @Override
    public String encode(TypeRef type, String expression, ConversionContext context) {
        return expression + " == null ? null : " + expression + ".toString()";
    }
}
