package com.jsonsource.generator.codegen.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import com.jsonsource.annotation.FieldRename;

/**
 * Utility for consistent naming of output keys and generated members.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Applies a rename strategy to a Java field name.
     */
    public static String rename(FieldRename strategy, String fieldName) {
        return switch (strategy) {
            case NONE -> fieldName;
            case KEBAB -> String.join("-", words(fieldName));
            case SNAKE -> String.join("_", words(fieldName));
            case SCREAMING_SNAKE -> toScreamingSnakeCase(fieldName);
            case PASCAL -> capitalizeFirst(fieldName);
        };
    }

    /**
     * Converts someField or some-field to SomeField.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("[-_]"))
                .filter(part -> !part.isEmpty())
                .map(NamingUtil::capitalizeFirst)
                .collect(Collectors.joining(""));
    }

    /**
     * Converts SomeName to someName.
     */
    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal == null || pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase(Locale.ROOT) + pascal.substring(1);
    }

    /**
     * Converts name to SCREAMING_SNAKE_CASE for constants.
     */
    public static String toScreamingSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return String.join("_", words(name)).toUpperCase(Locale.ROOT);
    }

    /**
     * Companion class generated for a unit: {@code Point} gives {@code PointJson}.
     */
    public static String companionClassName(String unitName) {
        return unitName + "Json";
    }

    /**
     * {@code Point} gives {@code pointFromJson}, {@code Request.Item} gives {@code requestItemFromJson}.
     */
    public static String decodeFunctionName(String referenceName) {
        return toCamelCase(referenceName.replace('.', '_')) + "FromJson";
    }

    /**
     * {@code Point} gives {@code pointToJson}, {@code Request.Item} gives {@code requestItemToJson}.
     */
    public static String encodeFunctionName(String referenceName) {
        return toCamelCase(referenceName.replace('.', '_')) + "ToJson";
    }

    /**
     * Upper-cases the first character, as in bean accessor names.
     */
    public static String capitalize(String name) {
        return capitalizeFirst(name);
    }

    /**
     * Lower-case words of a camelCase, PascalCase or separator-delimited name.
     */
    static List<String> words(String name) {
        String spaced = name
                .replaceAll("([a-z0-9])([A-Z])", "$1 $2")
                .replaceAll("([A-Z]+)([A-Z][a-z])", "$1 $2")
                .replaceAll("[-_\\s]+", " ")
                .trim();
        return Arrays.stream(spaced.split(" "))
                .filter(w -> !w.isEmpty())
                .map(w -> w.toLowerCase(Locale.ROOT))
                .toList();
    }

    private static String capitalizeFirst(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1);
    }
}
