package com.jsonsource.generator.codegen.compose;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.jsonsource.generator.codegen.convert.HelperFragments;
import com.jsonsource.generator.codegen.diagnostics.Severity;
import com.jsonsource.generator.codegen.exception.ConfigurationException;
import com.jsonsource.generator.codegen.exception.DuplicateKeyException;
import com.jsonsource.generator.codegen.patch.PatchInstruction;
import com.jsonsource.generator.config.GenerationOptions;
import com.jsonsource.generator.model.SourceUnit;
import com.jsonsource.generator.model.TypeIndex;
import com.jsonsource.generator.parser.SourceUnitParser;

/**
 * Unit tests for GeneratorComposer and its passes.
 */
class GeneratorComposerTest {

    private static final String DATA = """
            package data;

            import java.util.Map;

            public class Data {
                @JsonLiteral("glossary.json")
                static final Map<String, Object> GLOSSARY = DataJson.DATA_GLOSSARY_JSON_LITERAL;
            }
            """;

    private final SourceUnitParser parser = new SourceUnitParser();
    private final GeneratorComposer composer = new GeneratorComposer();

    @Test
    void testSharedEnumMapIsEmittedOnce() {
        ComposedUnit composed = compose("Palette.java", """
                package art;

                @JsonSerializable
                public class Palette {
                    public Color primary;
                }

                @JsonSerializable
                class Brush {
                    public Color color;
                }

                @JsonEnum
                enum Color { RED, GREEN }
                """);

        List<String> fragments = composed.getGenerated().getFragments();
        assertThat(fragments).filteredOn(f -> f.contains("COLOR_ENUM_MAP = ")).hasSize(1);
        assertThat(fragments).filteredOn(f -> f.contains("E decodeEnum(")).hasSize(1);
        assertThat(fragments).anySatisfy(f -> assertThat(f).contains("paletteFromJson("));
        assertThat(fragments).anySatisfy(f -> assertThat(f).contains("brushFromJson("));
        assertThat(composed.hasCompanion()).isTrue();
        assertThat(composed.getPatches()).isEmpty();
    }

    @Test
    void testFragmentsKeepPassOrder() {
        ComposedUnit composed = compose("Status.java", """
                @JsonEnum(fieldRename = FieldRename.KEBAB)
                public enum Status { IN_PROGRESS, DONE }
                """);

        assertThat(composed.getGenerated().getFragments()).containsExactly("""
                private static final Map<Status, String> STATUS_ENUM_MAP = Map.ofEntries(
                        Map.entry(Status.IN_PROGRESS, "in-progress"),
                        Map.entry(Status.DONE, "done"));""");
    }

    @Test
    void testFirstErrorAbortsTheUnit() {
        assertThatThrownBy(() -> compose("Pair.java", """
                @JsonSerializable
                public class Pair {
                    @JsonKey(name = "v")
                    public int a;
                    @JsonKey(name = "v")
                    public int b;
                }
                """))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void testNonStaticInnerClassIsRejected() {
        assertThatThrownBy(() -> compose("Outer.java", """
                public class Outer {
                    @JsonSerializable
                    public class Inner {
                        public int value;
                    }
                }
                """))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Outer.Inner must be static");
    }

    @Test
    void testSerializableEnumIsRejected() {
        assertThatThrownBy(() -> compose("Mode.java", """
                @JsonSerializable
                public enum Mode { ON, OFF }
                """))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("use @JsonEnum instead");
    }

    @Test
    void testGenericArgumentFactoriesOnPlainClassWarns() {
        ComposedUnit composed = compose("Plain.java", """
                @JsonSerializable(genericArgumentFactories = true)
                public class Plain {
                    public int value;
                }
                """);

        assertThat(composed.getDiagnostics()).anySatisfy(d -> {
            assertThat(d.getSeverity()).isEqualTo(Severity.WARNING);
            assertThat(d.getMessage()).contains("genericArgumentFactories");
        });
    }

    @Test
    void testPatchSourceAddsDelegatingMembers() {
        String source = """
                package geo;

                @JsonSerializable(patchSource = true)
                public class Point {
                    public int x;
                    public int y;
                }
                """;
        ComposedUnit composed = compose("Point.java", source);

        assertThat(composed.getPatches()).singleElement().satisfies(patch -> {
            assertThat(patch.getStartOffset()).isEqualTo(source.indexOf("@JsonSerializable"));
            assertThat(patch.getEndOffset()).isEqualTo(source.lastIndexOf('}') + 1);
            assertThat(patch.getReplacementText())
                    .startsWith("@JsonSerializable(patchSource = true)")
                    .contains("""
                                public static Point fromJson(java.util.Map<String, ?> json) {
                                    return PointJson.pointFromJson(json);
                                }
                            """)
                    .contains("""
                                public java.util.Map<String, Object> toJson() {
                                    return PointJson.pointToJson(this);
                                }
                            }""");
        });
    }

    @Test
    void testExistingMembersAreNotPatchedAgain() {
        ComposedUnit composed = compose("Point.java", """
                @JsonSerializable(patchSource = true)
                public class Point {
                    public int x;

                    public static Point fromJson(java.util.Map<String, ?> json) {
                        return PointJson.pointFromJson(json);
                    }

                    public java.util.Map<String, Object> toJson() {
                        return PointJson.pointToJson(this);
                    }
                }
                """);

        assertThat(composed.getPatches()).isEmpty();
        assertThat(composed.hasCompanion()).isTrue();
    }

    @Test
    void testNestedPatchedClassesFoldIntoOnePatch() {
        String source = """
                @JsonSerializable(patchSource = true)
                public class Order {
                    public Line line;

                    @JsonSerializable(patchSource = true)
                    public static class Line {
                        public int quantity;
                    }
                }
                """;
        ComposedUnit composed = compose("Order.java", source);

        assertThat(composed.getPatches()).singleElement().satisfies(patch -> {
            assertThat(patch.getStartOffset()).isZero();
            assertThat(patch.getReplacementText())
                    .contains("return OrderJson.orderFromJson(json);")
                    .contains("return OrderJson.orderLineFromJson(json);")
                    .contains("public static Order.Line fromJson(");
        });
    }

    @Test
    void testSameNamedNestedClassesGetSeparateMembers() {
        String source = """
                package api;

                public class Api {
                    public static class Request {
                        @JsonSerializable(patchSource = true, createJsonKeys = true)
                        public static class Item {
                            public int id;
                        }
                    }

                    public static class Response {
                        @JsonSerializable(patchSource = true, createJsonKeys = true)
                        public static class Item {
                            public String name;
                        }
                    }
                }
                """;
        ComposedUnit composed = compose("Api.java", source);

        List<String> fragments = composed.getGenerated().getFragments();
        assertThat(fragments).anySatisfy(f -> assertThat(f)
                .contains("public static Api.Request.Item apiRequestItemFromJson(Map<String, ?> json) {"));
        assertThat(fragments).anySatisfy(f -> assertThat(f)
                .contains("public static Api.Response.Item apiResponseItemFromJson(Map<String, ?> json) {"));
        assertThat(fragments).anySatisfy(f -> assertThat(f).contains("class ApiRequestItemJsonKeys {"));
        assertThat(fragments).anySatisfy(f -> assertThat(f).contains("class ApiResponseItemJsonKeys {"));

        List<PatchInstruction> patches = composed.getPatches();
        assertThat(patches).hasSize(2);
        assertThat(patches.get(0).getReplacementText())
                .contains("public int id;")
                .contains("return ApiJson.apiRequestItemFromJson(json);");
        assertThat(patches.get(1).getReplacementText())
                .contains("public String name;")
                .contains("return ApiJson.apiResponseItemFromJson(json);");
        assertThat(patches.get(0).getEndOffset()).isLessThanOrEqualTo(patches.get(1).getStartOffset());
    }

    @Test
    void testPatchedGenericMembersKeepBounds() {
        ComposedUnit composed = compose("Box.java", """
                @JsonSerializable(patchSource = true)
                public class Box<T extends Number> {
                    public T value;
                }
                """);

        assertThat(composed.getPatches()).singleElement().satisfies(patch -> assertThat(patch.getReplacementText())
                .contains("public static <T extends Number> Box<T> fromJson(java.util.Map<String, ?> json) {")
                .contains("return BoxJson.boxFromJson(json);"));
    }

    @Test
    void testNestedEnumIsReferencedThroughItsOwner() {
        ComposedUnit composed = compose("Car.java", """
                package cars;

                @JsonSerializable(createPerFieldToJson = true)
                public class Car {
                    public enum Kind { SEDAN, VAN }

                    public Kind kind;
                }
                """);

        List<String> fragments = composed.getGenerated().getFragments();
        assertThat(fragments).anySatisfy(f -> assertThat(f)
                .contains("decodeEnum(CAR_KIND_ENUM_MAP, json.get(\"kind\"))"));
        assertThat(fragments).anySatisfy(f -> assertThat(f).contains("public static Object kind(Car.Kind value) {"));
        assertThat(fragments).anySatisfy(f -> assertThat(f)
                .startsWith("private static final Map<Car.Kind, String> CAR_KIND_ENUM_MAP = Map.ofEntries(")
                .contains("Map.entry(Car.Kind.SEDAN, \"SEDAN\")"));
        assertThat(fragments).noneSatisfy(f -> assertThat(f).contains("Map<Kind, String>"));
    }

    @Test
    void testJsonLiteralIsEmbedded(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("glossary.json"),
                "{\"title\":\"Glossary\",\"count\":3,\"ratio\":0.5,\"tags\":[\"a\",null],\"empty\":{}}");

        ComposedUnit composed = compose(dir.resolve("Data.java"), DATA);

        assertThat(composed.getGenerated().getFragments()).containsExactly("""
                public static final Map<String, Object> DATA_GLOSSARY_JSON_LITERAL = jsonObject(
                        "title", "Glossary",
                        "count", 3,
                        "ratio", 0.5,
                        "tags", jsonArray(
                                "a",
                                null),
                        "empty", jsonObject());""", HelperFragments.JSON_OBJECT, HelperFragments.JSON_ARRAY);
        assertThat(composed.hasCompanion()).isTrue();
        assertThat(composed.getPatches()).isEmpty();
    }

    @Test
    void testUnreadableJsonLiteralIsRejected(@TempDir Path dir) throws IOException {
        assertThatThrownBy(() -> compose(dir.resolve("Data.java"), DATA))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Could not read")
                .hasMessageContaining("Data.GLOSSARY");

        Files.writeString(dir.resolve("glossary.json"), "{\"title\": }");
        assertThatThrownBy(() -> compose(dir.resolve("Data.java"), DATA))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("is not valid JSON");
    }

    @Test
    void testMissingDeclarationBecomesDiagnostic() {
        SourceUnit parsed = parser.parse(Path.of("Point.java"), """
                @JsonSerializable(patchSource = true)
                public class Point {
                    public int x;
                }
                """);
        SourceUnit unit = parsed.toBuilder().clearDeclarations().build();

        ComposedUnit composed = composer.compose(unit, TypeIndex.of(List.of(unit)), GenerationOptions.defaults());

        assertThat(composed.getPatches()).isEmpty();
        assertThat(composed.hasCompanion()).isTrue();
        assertThat(composed.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.getSeverity()).isEqualTo(Severity.ERROR);
            assertThat(d.getElement()).isEqualTo("Point");
        });
    }

    @Test
    void testUnitWithoutAnnotationsProducesNothing() {
        ComposedUnit composed = compose("Plain.java", """
                public class Plain {
                    public int value;
                }
                """);

        assertThat(composed.hasCompanion()).isFalse();
        assertThat(composed.getPatches()).isEmpty();
        assertThat(composed.getDiagnostics()).isEmpty();
    }

    private ComposedUnit compose(String file, String source) {
        return compose(Path.of(file), source);
    }

    private ComposedUnit compose(Path file, String source) {
        SourceUnit unit = parser.parse(file, source);
        return composer.compose(unit, TypeIndex.of(List.of(unit)), GenerationOptions.defaults());
    }
}
