package com.jsonsource.generator.codegen.emit;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.jsonsource.generator.codegen.convert.HelperFragments;
import com.jsonsource.generator.codegen.util.JavaLiterals;

/**
 * Writes a parsed JSON document as a Java constant built from unmodifiable maps and lists.
 *
 * Integers become {@code int}, {@code long} or {@code BigInteger} depending on their size;
 * other numbers become {@code double}, or {@code BigDecimal} when out of range.
 */
public class JsonLiteralEmitter {

    private static final String CONTINUATION = "        ";

    /**
     * The constant declaration followed by the helper methods it calls.
     */
    public List<String> emit(String constantName, JsonElement json) {
        List<String> fragments = new ArrayList<>();
        fragments.add("public static final " + javaType(json) + " " + constantName + " = " + value(json, "") + ";");
        if (uses(json, JsonObject.class)) {
            fragments.add(HelperFragments.JSON_OBJECT);
        }
        if (uses(json, JsonArray.class)) {
            fragments.add(HelperFragments.JSON_ARRAY);
        }
        return fragments;
    }

    static String javaType(JsonElement json) {
        if (json.isJsonObject()) {
            return "Map<String, Object>";
        }
        if (json.isJsonArray()) {
            return "List<Object>";
        }
        return "Object";
    }

    private String value(JsonElement json, String indent) {
        if (json.isJsonNull()) {
            return "null";
        }
        if (json.isJsonPrimitive()) {
            return primitive(json.getAsJsonPrimitive());
        }
        String inner = indent + CONTINUATION;
        List<String> items = new ArrayList<>();
        if (json.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : json.getAsJsonObject().entrySet()) {
                items.add(inner + JavaLiterals.quote(entry.getKey()) + ", " + value(entry.getValue(), inner));
            }
            return call("jsonObject", items);
        }
        JsonArray array = json.getAsJsonArray();
        if (array.size() == 1 && array.get(0).isJsonNull()) {
            // a lone null would be taken as the varargs array itself
            return "jsonArray((Object) null)";
        }
        for (JsonElement element : array) {
            items.add(inner + value(element, inner));
        }
        return call("jsonArray", items);
    }

    private static String call(String helper, List<String> items) {
        if (items.isEmpty()) {
            return helper + "()";
        }
        return helper + "(\n" + String.join(",\n", items) + ")";
    }

    private static String primitive(JsonPrimitive primitive) {
        if (primitive.isBoolean()) {
            return String.valueOf(primitive.getAsBoolean());
        }
        if (primitive.isNumber()) {
            return number(primitive.getAsString());
        }
        return JavaLiterals.quote(primitive.getAsString());
    }

    static String number(String text) {
        if (text.contains(".") || text.contains("e") || text.contains("E")) {
            double value = Double.parseDouble(text);
            return Double.isFinite(value) ? Double.toString(value) : "new java.math.BigDecimal(\"" + text + "\")";
        }
        BigInteger value = new BigInteger(text);
        if (value.bitLength() < Integer.SIZE) {
            return value.toString();
        }
        if (value.bitLength() < Long.SIZE) {
            return value + "L";
        }
        return "new java.math.BigInteger(\"" + text + "\")";
    }

    private static boolean uses(JsonElement json, Class<? extends JsonElement> kind) {
        if (kind.isInstance(json)) {
            return true;
        }
        if (json.isJsonObject()) {
            return json.getAsJsonObject().entrySet().stream().anyMatch(e -> uses(e.getValue(), kind));
        }
        if (json.isJsonArray()) {
            for (JsonElement element : json.getAsJsonArray()) {
                if (uses(element, kind)) {
                    return true;
                }
            }
        }
        return false;
    }
}
