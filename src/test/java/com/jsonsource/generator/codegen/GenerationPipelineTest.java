package com.jsonsource.generator.codegen;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.jsonsource.generator.config.GenerationOptions;
import com.jsonsource.generator.parser.SourceDiscovery;

/**
 * Integration tests for the complete generation process.
 */
class GenerationPipelineTest {

    private static final String POINT = """
            package geo;

            import com.jsonsource.annotation.JsonSerializable;

            @JsonSerializable
            public class Point {
                public int x;
                public int y;
            }
            """;

    @TempDir
    Path tempDir;

    @Test
    void testGeneratesCompanionNextToSource() throws IOException {
        Path source = write("geo/Point.java", POINT);
        write("geo/Plain.java", "package geo;\n\npublic class Plain {\n}\n");

        GeneratorResult result = run(config());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFilesScanned()).isEqualTo(2);
        assertThat(result.getUnitsGenerated()).isEqualTo(1);
        assertThat(result.getCompanionFilesWritten()).isEqualTo(1);

        Path companion = source.resolveSibling("PointJson.java");
        String contents = Files.readString(companion, StandardCharsets.UTF_8);
        assertThat(contents)
                .startsWith(SourceDiscovery.GENERATED_MARKER + "\npackage geo;\n")
                .contains("import java.util.LinkedHashMap;")
                .contains("public final class PointJson {")
                .contains("    public static Point pointFromJson(Map<String, ?> json) {")
                .contains("    public static Map<String, Object> pointToJson(Point instance) {")
                .endsWith("    private PointJson() {\n    }\n}\n");
        assertThat(Files.readString(source, StandardCharsets.UTF_8)).isEqualTo(POINT);
    }

    @Test
    void testSecondRunChangesNothing() throws IOException {
        write("geo/Point.java", POINT);
        run(config());
        Path companion = tempDir.resolve("geo/PointJson.java");
        String first = Files.readString(companion, StandardCharsets.UTF_8);

        GeneratorResult second = run(config());

        assertThat(second.isSuccess()).isTrue();
        // the companion is scanned but skipped as generated
        assertThat(second.getFilesScanned()).isEqualTo(2);
        assertThat(second.getCompanionFilesWritten()).isZero();
        assertThat(Files.readString(companion, StandardCharsets.UTF_8)).isEqualTo(first);
    }

    @Test
    void testPatchSourceIsIdempotent() throws IOException {
        Path source = write("geo/Point.java", POINT.replace("@JsonSerializable", "@JsonSerializable(patchSource = true)"));

        GeneratorResult first = run(config());
        String patched = Files.readString(source, StandardCharsets.UTF_8);

        assertThat(first.isSuccess()).isTrue();
        assertThat(first.getFilesPatched()).isEqualTo(1);
        assertThat(patched)
                .contains("    public static Point fromJson(java.util.Map<String, ?> json) {\n"
                        + "        return PointJson.pointFromJson(json);\n"
                        + "    }")
                .contains("    public java.util.Map<String, Object> toJson() {\n"
                        + "        return PointJson.pointToJson(this);\n"
                        + "    }\n}\n");

        GeneratorResult second = run(config());

        assertThat(second.isSuccess()).isTrue();
        assertThat(second.getFilesPatched()).isZero();
        assertThat(Files.readString(source, StandardCharsets.UTF_8)).isEqualTo(patched);
    }

    @Test
    void testFailingUnitDoesNotStopSiblings() throws IOException {
        write("geo/Point.java", POINT);
        write("geo/Pair.java", """
                package geo;

                @JsonSerializable
                public class Pair {
                    @JsonKey(name = "v")
                    public int a;
                    @JsonKey(name = "v")
                    public int b;
                }
                """);

        GeneratorResult result = run(config());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailedUnits()).singleElement().satisfies(unit -> {
            assertThat(unit.getSource().getFileName()).hasToString("Pair.java");
            assertThat(unit.getError()).contains("Pair").contains("\"v\"");
        });
        assertThat(tempDir.resolve("geo/PointJson.java")).exists();
        assertThat(tempDir.resolve("geo/PairJson.java")).doesNotExist();
    }

    @Test
    void testUnparsableFileIsReported() throws IOException {
        write("geo/Point.java", POINT);
        write("geo/Broken.java", "package geo;\n\npublic class Broken {\n");

        GeneratorResult result = run(config());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailedUnits()).singleElement()
                .satisfies(unit -> assertThat(unit.getError()).contains("Broken.java"));
        assertThat(tempDir.resolve("geo/PointJson.java")).exists();
    }

    @Test
    void testOutputDirMirrorsPackages() throws IOException {
        Path sources = tempDir.resolve("src");
        Path output = tempDir.resolve("generated");
        Files.createDirectories(sources.resolve("geo"));
        Files.writeString(sources.resolve("geo/Point.java"), POINT, StandardCharsets.UTF_8);

        GeneratorResult result = run(GeneratorConfig.builder()
                .sourceDir(sources)
                .outputDir(output)
                .threads(2)
                .build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(output.resolve("geo/PointJson.java")).exists();
        assertThat(sources.resolve("geo/PointJson.java")).doesNotExist();
    }

    @Test
    void testDryRunWritesNothing() throws IOException {
        Path source = write("geo/Point.java", POINT.replace("@JsonSerializable", "@JsonSerializable(patchSource = true)"));

        GeneratorResult result = run(GeneratorConfig.builder()
                .sourceDir(tempDir)
                .dryRun(true)
                .build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCompanionFilesWritten()).isEqualTo(1);
        assertThat(result.getFilesPatched()).isEqualTo(1);
        assertThat(tempDir.resolve("geo/PointJson.java")).doesNotExist();
        assertThat(Files.readString(source, StandardCharsets.UTF_8)).doesNotContain("fromJson");
    }

    @Test
    void testGlobalOptionsApply() throws IOException {
        write("geo/Point.java", POINT);

        run(GeneratorConfig.builder()
                .sourceDir(tempDir)
                .options(GenerationOptions.builder().createFactory(false).createJsonKeys(true).build())
                .build());

        String contents = Files.readString(tempDir.resolve("geo/PointJson.java"), StandardCharsets.UTF_8);
        assertThat(contents)
                .doesNotContain("pointFromJson")
                .contains("public static final class PointJsonKeys {");
    }

    @Test
    void testEmptySourceDirFails() {
        GeneratorResult result = run(config());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).startsWith("No Java sources found");
    }

    private GeneratorConfig config() {
        return GeneratorConfig.builder()
                .sourceDir(tempDir)
                .threads(2)
                .build();
    }

    private static GeneratorResult run(GeneratorConfig config) {
        return new GenerationPipeline(config).generate();
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
