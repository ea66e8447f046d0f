package com.jsonsource.generator.codegen.emit;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.jsonsource.generator.codegen.convert.HelperFragments;

class JsonLiteralEmitterTest {

    private final JsonLiteralEmitter emitter = new JsonLiteralEmitter();

    @Test
    void testNumbersPickTheSmallestFittingType() {
        assertThat(JsonLiteralEmitter.number("42")).isEqualTo("42");
        assertThat(JsonLiteralEmitter.number("-2147483648")).isEqualTo("-2147483648");
        assertThat(JsonLiteralEmitter.number("2147483648")).isEqualTo("2147483648L");
        assertThat(JsonLiteralEmitter.number("123456789012345678901234567890"))
                .isEqualTo("new java.math.BigInteger(\"123456789012345678901234567890\")");
        assertThat(JsonLiteralEmitter.number("1.5e3")).isEqualTo("1500.0");
        assertThat(JsonLiteralEmitter.number("1e400")).isEqualTo("new java.math.BigDecimal(\"1e400\")");
    }

    @Test
    void testTopLevelArrayNeedsOnlyTheArrayHelper() {
        assertThat(emitter.emit("TAGS", json("[\"a\\\"b\", true, null]"))).containsExactly("""
                public static final List<Object> TAGS = jsonArray(
                        "a\\"b",
                        true,
                        null);""", HelperFragments.JSON_ARRAY);
    }

    @Test
    void testLoneNullElementIsCast() {
        assertThat(emitter.emit("NOTHING", json("[null]")))
                .containsExactly("public static final List<Object> NOTHING = jsonArray((Object) null);",
                        HelperFragments.JSON_ARRAY);
    }

    @Test
    void testScalarDocument() {
        assertThat(emitter.emit("GREETING", json("\"hi\""))).containsExactly(
                "public static final Object GREETING = \"hi\";");
    }

    private static JsonElement json(String text) {
        return JsonParser.parseString(text);
    }
}
