package com.jsonsource.generator.codegen;

import static org.assertj.core.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import javax.tools.JavaFileObject;
import javax.tools.StandardLocation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.google.testing.compile.Compilation;
import com.google.testing.compile.Compiler;
import com.google.testing.compile.JavaFileObjects;
import com.jsonsource.annotation.JsonSerializable;
import com.jsonsource.generator.codegen.compose.ComposedUnit;
import com.jsonsource.generator.codegen.compose.GeneratorComposer;
import com.jsonsource.generator.codegen.output.CompanionFileRenderer;
import com.jsonsource.generator.codegen.output.GeneratedFile;
import com.jsonsource.generator.config.GenerationOptions;
import com.jsonsource.generator.model.SourceUnit;
import com.jsonsource.generator.model.TypeIndex;
import com.jsonsource.generator.parser.SourceUnitParser;

/**
 * Compiles generated companions together with their sources and runs them on real JSON.
 */
class RoundTripTest {

    private static final Gson GSON = new Gson();
    private static final Type JSON_OBJECT = new TypeToken<Map<String, Object>>() {
    }.getType();

    @Test
    void testPointRoundTrip() throws Exception {
        ClassLoader loader = generateAndCompile("demo", "Point", """
                package demo;

                import com.jsonsource.annotation.JsonSerializable;

                @JsonSerializable
                public class Point {
                    private final int x;
                    private final int y;

                    public Point(int x, int y) {
                        this.x = x;
                        this.y = y;
                    }

                    public int getX() { return x; }
                    public int getY() { return y; }

                    @Override
                    public boolean equals(Object o) {
                        return o instanceof Point p && p.x == x && p.y == y;
                    }

                    @Override
                    public int hashCode() {
                        return 31 * x + y;
                    }
                }
                """);
        Class<?> pointClass = loader.loadClass("demo.Point");
        Class<?> companion = loader.loadClass("demo.PointJson");

        Object point = companion.getMethod("pointFromJson", Map.class).invoke(null, parse("{\"x\":1,\"y\":2}"));
        assertThat(point).isEqualTo(pointClass.getConstructor(int.class, int.class).newInstance(1, 2));

        Object encoded = companion.getMethod("pointToJson", pointClass).invoke(null, point);
        assertThat(GSON.toJson(encoded)).isEqualTo("{\"x\":1,\"y\":2}");
    }

    @Test
    void testFieldExcludedFromDecodeIsStillEncoded() throws Exception {
        ClassLoader loader = generateAndCompile("demo", "Point", """
                package demo;

                import com.jsonsource.annotation.JsonKey;
                import com.jsonsource.annotation.JsonSerializable;

                @JsonSerializable
                public class Point {
                    public int x;
                    @JsonKey(includeFromJson = false, includeToJson = true)
                    public int y;
                }
                """);
        Class<?> pointClass = loader.loadClass("demo.Point");
        Class<?> companion = loader.loadClass("demo.PointJson");

        Object point = companion.getMethod("pointFromJson", Map.class).invoke(null, parse("{\"x\":1,\"y\":2}"));
        assertThat(pointClass.getField("x").getInt(point)).isEqualTo(1);
        assertThat(pointClass.getField("y").getInt(point)).isZero();

        pointClass.getField("y").setInt(point, 5);
        Object encoded = companion.getMethod("pointToJson", pointClass).invoke(null, point);
        assertThat(GSON.toJson(encoded)).isEqualTo("{\"x\":1,\"y\":5}");
    }

    @Test
    void testNestedListsEnumsAndRenames() throws Exception {
        ClassLoader loader = generateAndCompile("shop", "Order", """
                package shop;

                import java.util.List;

                import com.jsonsource.annotation.FieldRename;
                import com.jsonsource.annotation.JsonEnum;
                import com.jsonsource.annotation.JsonSerializable;

                @JsonSerializable(fieldRename = FieldRename.SNAKE, includeIfNull = false, explicitToJson = true)
                public class Order {
                    public String orderId;
                    public List<Line> lines;
                    public Status status;
                    public String note;
                }

                @JsonSerializable
                class Line {
                    public String sku;
                    public int quantity;
                }

                @JsonEnum(fieldRename = FieldRename.KEBAB)
                enum Status { NEW_ORDER, SHIPPED }
                """);
        Class<?> orderClass = loader.loadClass("shop.Order");
        Class<?> companion = loader.loadClass("shop.OrderJson");
        String input = "{\"order_id\":\"A1\",\"lines\":[{\"sku\":\"X\",\"quantity\":2}],\"status\":\"new-order\"}";

        Object order = companion.getMethod("orderFromJson", Map.class).invoke(null, parse(input));
        assertThat(orderClass.getField("orderId").get(order)).isEqualTo("A1");
        assertThat(orderClass.getField("status").get(order)).hasToString("NEW_ORDER");
        assertThat(orderClass.getField("note").get(order)).isNull();

        Object encoded = companion.getMethod("orderToJson", orderClass).invoke(null, order);
        assertThat(GSON.toJson(encoded)).isEqualTo(input);
    }

    @Test
    void testUnrecognizedKeysAreRejected() throws Exception {
        ClassLoader loader = generateAndCompile("demo", "Login", """
                package demo;

                import com.jsonsource.annotation.JsonKey;
                import com.jsonsource.annotation.JsonSerializable;

                @JsonSerializable(disallowUnrecognizedKeys = true)
                public class Login {
                    @JsonKey(required = true)
                    public String user;
                }
                """);
        Class<?> companion = loader.loadClass("demo.LoginJson");

        assertThatThrownBy(() -> companion.getMethod("loginFromJson", Map.class)
                .invoke(null, parse("{\"user\":\"ann\",\"admin\":true}")))
                .hasRootCauseInstanceOf(IllegalArgumentException.class)
                .rootCause().hasMessageContaining("Unrecognized keys: [admin]");
        assertThatThrownBy(() -> companion.getMethod("loginFromJson", Map.class).invoke(null, parse("{}")))
                .rootCause().hasMessageContaining("Required keys are missing: user");
    }

    @Test
    void testNestedEnumRoundTrip() throws Exception {
        ClassLoader loader = generateAndCompile("cars", "Car", """
                package cars;

                import com.jsonsource.annotation.JsonSerializable;

                @JsonSerializable(createPerFieldToJson = true)
                public class Car {
                    public enum Kind { SEDAN, VAN }

                    public String model;
                    public Kind kind;
                }
                """);
        Class<?> carClass = loader.loadClass("cars.Car");
        Class<?> companion = loader.loadClass("cars.CarJson");
        String input = "{\"model\":\"T\",\"kind\":\"VAN\"}";

        Object car = companion.getMethod("carFromJson", Map.class).invoke(null, parse(input));
        assertThat(carClass.getField("kind").get(car)).hasToString("VAN");

        Object encoded = companion.getMethod("carToJson", carClass).invoke(null, car);
        assertThat(GSON.toJson(encoded)).isEqualTo(input);
    }

    @Test
    void testBoundedGenericRoundTrip() throws Exception {
        ClassLoader loader = generateAndCompile("demo", "Measure", """
                package demo;

                import com.jsonsource.annotation.JsonSerializable;

                @JsonSerializable
                public class Measure<T extends Number> {
                    public T amount;
                    public String unit;
                }
                """);
        Class<?> measureClass = loader.loadClass("demo.Measure");
        Class<?> companion = loader.loadClass("demo.MeasureJson");
        String input = "{\"amount\":2.5,\"unit\":\"kg\"}";

        Object measure = companion.getMethod("measureFromJson", Map.class).invoke(null, parse(input));
        assertThat(measureClass.getField("amount").get(measure)).isEqualTo(2.5);

        Object encoded = companion.getMethod("measureToJson", measureClass).invoke(null, measure);
        assertThat(GSON.toJson(encoded)).isEqualTo(input);
    }

    @Test
    void testSameNamedNestedClassesRoundTrip() throws Exception {
        ClassLoader loader = generateAndCompile("api", "Api", """
                package api;

                import com.jsonsource.annotation.JsonSerializable;

                @JsonSerializable(explicitToJson = true)
                public class Api {
                    public Request.Item request;
                    public Response.Item response;
                }

                class Request {
                    @JsonSerializable
                    static class Item {
                        public int id;
                    }
                }

                class Response {
                    @JsonSerializable
                    static class Item {
                        public String name;
                    }
                }
                """);
        Class<?> apiClass = loader.loadClass("api.Api");
        Class<?> companion = loader.loadClass("api.ApiJson");
        String input = "{\"request\":{\"id\":7},\"response\":{\"name\":\"seven\"}}";

        Object api = companion.getMethod("apiFromJson", Map.class).invoke(null, parse(input));
        assertThat(apiClass.getField("request").get(api).getClass().getName()).isEqualTo("api.Request$Item");
        assertThat(apiClass.getField("response").get(api).getClass().getName()).isEqualTo("api.Response$Item");
        assertThat(companion.getDeclaredMethod("requestItemFromJson", Map.class)).isNotNull();
        assertThat(companion.getDeclaredMethod("responseItemFromJson", Map.class)).isNotNull();

        Object encoded = companion.getMethod("apiToJson", apiClass).invoke(null, api);
        assertThat(GSON.toJson(encoded)).isEqualTo(input);
    }

    @Test
    void testGenericArgumentFactoriesConvertElements() throws Exception {
        ClassLoader loader = generateAndCompile("shop", "Shelf", """
                package shop;

                import java.util.List;

                import com.jsonsource.annotation.FieldRename;
                import com.jsonsource.annotation.JsonEnum;
                import com.jsonsource.annotation.JsonSerializable;

                @JsonSerializable(explicitToJson = true)
                public class Shelf {
                    public Page<Size> page;
                }

                @JsonSerializable(genericArgumentFactories = true)
                class Page<T> {
                    public List<T> items;
                    public int total;
                }

                @JsonEnum(fieldRename = FieldRename.KEBAB)
                enum Size { EXTRA_SMALL, LARGE }
                """);
        Class<?> shelfClass = loader.loadClass("shop.Shelf");
        Class<?> pageClass = loader.loadClass("shop.Page");
        Class<?> companion = loader.loadClass("shop.ShelfJson");
        String input = "{\"page\":{\"items\":[\"extra-small\",\"large\"],\"total\":2}}";

        Object shelf = companion.getMethod("shelfFromJson", Map.class).invoke(null, parse(input));
        Object page = shelfClass.getField("page").get(shelf);
        assertThat((List<?>) pageClass.getField("items").get(page))
                .extracting(Object::toString)
                .containsExactly("EXTRA_SMALL", "LARGE");
        assertThat(pageClass.getField("total").getInt(page)).isEqualTo(2);

        Object encoded = companion.getMethod("shelfToJson", shelfClass).invoke(null, shelf);
        assertThat(GSON.toJson(encoded)).isEqualTo(input);
    }

    @Test
    void testJsonLiteralConstantInitializesField(@TempDir Path dir) throws Exception {
        String glossary = "{\"title\":\"Glossary\",\"ids\":[1,2147483648,null],\"nested\":{\"on\":true}}";
        Files.writeString(dir.resolve("glossary.json"), glossary);
        ClassLoader loader = generateAndCompile(dir.resolve("Data.java"), "data", "Data", """
                package data;

                import java.util.Map;

                import com.jsonsource.annotation.JsonLiteral;

                public class Data {
                    @JsonLiteral("glossary.json")
                    public static final Map<String, Object> GLOSSARY = DataJson.DATA_GLOSSARY_JSON_LITERAL;
                }
                """);

        Object value = loader.loadClass("data.Data").getField("GLOSSARY").get(null);
        assertThat(GSON.toJson(value)).isEqualTo(glossary);
        assertThatThrownBy(() -> ((Map<?, ?>) value).clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    private static Map<String, Object> parse(String json) {
        return GSON.fromJson(json, JSON_OBJECT);
    }

    private static ClassLoader generateAndCompile(String packageName, String unitName, String source)
            throws Exception {
        return generateAndCompile(Path.of(packageName, unitName + ".java"), packageName, unitName, source);
    }

    private static ClassLoader generateAndCompile(Path path, String packageName, String unitName, String source)
            throws Exception {
        SourceUnit unit = new SourceUnitParser().parse(path, source);
        ComposedUnit composed = new GeneratorComposer().compose(unit, TypeIndex.of(List.of(unit)),
                GenerationOptions.defaults());
        GeneratedFile companion = new CompanionFileRenderer(null).render(composed);

        List<JavaFileObject> sources = new ArrayList<>();
        sources.add(JavaFileObjects.forSourceString(packageName + "." + unitName, source));
        sources.add(JavaFileObjects.forSourceString(packageName + "." + unitName + "Json", companion.getContents()));

        Compilation compilation = Compiler.javac()
                .withClasspath(List.of(annotationClasspath()))
                .compile(sources);
        assertThat(compilation.status())
                .as("compilation of\n%s\n%s", companion.getContents(), compilation.diagnostics())
                .isEqualTo(Compilation.Status.SUCCESS);
        return new CompiledClassLoader(compilation, RoundTripTest.class.getClassLoader());
    }

    private static File annotationClasspath() throws Exception {
        return new File(JsonSerializable.class.getProtectionDomain().getCodeSource().getLocation().toURI());
    }

    private static final class CompiledClassLoader extends ClassLoader {
        private final Compilation compilation;

        CompiledClassLoader(Compilation compilation, ClassLoader parent) {
            super(parent);
            this.compilation = compilation;
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            JavaFileObject file = compilation.generatedFile(StandardLocation.CLASS_OUTPUT,
                    name.replace('.', '/') + ".class")
                    .orElseThrow(() -> new ClassNotFoundException(name));
            try (InputStream in = file.openInputStream()) {
                byte[] bytes = in.readAllBytes();
                return defineClass(name, bytes, 0, bytes.length);
            } catch (IOException e) {
                throw new ClassNotFoundException(name, e);
            }
        }
    }
}
