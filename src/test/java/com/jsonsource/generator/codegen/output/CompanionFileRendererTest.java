package com.jsonsource.generator.codegen.output;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.jsonsource.generator.codegen.compose.ComposedUnit;
import com.jsonsource.generator.codegen.compose.GeneratedUnit;
import com.jsonsource.generator.model.SourceUnit;

class CompanionFileRendererTest {

    @Test
    void testRenderWrapsFragmentsInCompanionClass() {
        SourceUnit unit = SourceUnit.builder()
                .path(Path.of("src", "geo", "Point.java"))
                .text("")
                .packageName("geo")
                .importDeclaration("java.util.List")
                .importDeclaration("geo.Shape")
                .importDeclaration("static java.util.Objects.requireNonNull")
                .build();
        GeneratedUnit generated = new GeneratedUnit();
        generated.add("public static final int A = 1;");
        generated.add("public static final int B = 2;");

        GeneratedFile file = new CompanionFileRenderer(null)
                .render(new ComposedUnit(unit, generated, List.of(), List.of()));

        assertThat(file.getPath()).isEqualTo(Path.of("src", "geo", "PointJson.java"));
        assertThat(file.getContents()).isEqualTo("""
                // GENERATED CODE - DO NOT MODIFY BY HAND
                package geo;

                import java.util.ArrayList;
                import java.util.LinkedHashMap;
                import java.util.LinkedHashSet;
                import java.util.List;
                import java.util.Map;
                import java.util.Set;
                import java.util.function.Function;
                import static java.util.Objects.requireNonNull;

                /**
                 * JSON encode and decode functions for the classes of {@code Point}.
                 */
                public final class PointJson {

                    public static final int A = 1;

                    public static final int B = 2;

                    private PointJson() {
                    }
                }
                """);
    }

    @Test
    void testOutputDirMirrorsPackage() {
        CompanionFileRenderer renderer = new CompanionFileRenderer(Path.of("out"));
        SourceUnit unit = SourceUnit.builder()
                .path(Path.of("src", "a", "b", "Item.java"))
                .text("")
                .packageName("a.b")
                .build();

        assertThat(renderer.companionPath(unit, "ItemJson")).isEqualTo(Path.of("out", "a", "b", "ItemJson.java"));
    }

    @Test
    void testIndentLeavesBlankLinesEmpty() {
        assertThat(CompanionFileRenderer.indent("a {\n    b;\n\n}")).isEqualTo("    a {\n        b;\n\n    }");
    }
}
