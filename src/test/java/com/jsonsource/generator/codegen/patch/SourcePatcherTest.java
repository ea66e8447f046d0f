package com.jsonsource.generator.codegen.patch;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.jsonsource.generator.codegen.exception.PatchIoException;
import com.jsonsource.generator.codegen.exception.PatchRangeException;

/**
 * Unit tests for SourcePatcher.
 */
class SourcePatcherTest {

    @TempDir
    Path tempDir;

    private final SourcePatcher patcher = new SourcePatcher();

    @Test
    void testBatchIsAppliedAgainstTheOriginalOffsets() throws IOException {
        String original = "0123456789".repeat(10);
        Path file = write("Numbers.java", original);

        PatchResult result = patcher.apply(file, List.of(
                new PatchInstruction(file, 10, 12, "<A>"),
                new PatchInstruction(file, 50, 50, "<B>"),
                new PatchInstruction(file, 90, 100, "")));

        String expected = original.substring(0, 10) + "<A>" + original.substring(12, 50) + "<B>"
                + original.substring(50, 90);
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(expected);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isChanged()).isTrue();
        assertThat(result.getInstructionCount()).isEqualTo(3);
    }

    @Test
    void testInstructionOrderDoesNotMatter() {
        Path file = tempDir.resolve("A.java");
        String text = "abcdefghij";
        List<PatchInstruction> ascending = List.of(
                new PatchInstruction(file, 1, 2, "B"),
                new PatchInstruction(file, 5, 7, "FG"),
                new PatchInstruction(file, 9, 10, "J!"));
        List<PatchInstruction> shuffled = List.of(ascending.get(2), ascending.get(0), ascending.get(1));

        assertThat(SourcePatcher.splice(file, text, ascending))
                .isEqualTo(SourcePatcher.splice(file, text, shuffled))
                .isEqualTo("aBcdeFGhiJ!");
    }

    @Test
    void testReversedRangeFails() {
        Path file = tempDir.resolve("A.java");

        assertThatThrownBy(() -> SourcePatcher.splice(file, "abcdef", List.of(new PatchInstruction(file, 4, 2, "x"))))
                .isInstanceOf(PatchRangeException.class)
                .hasMessageContaining("Invalid range [4, 2)");
    }

    @Test
    void testRangeBeyondTextFails() {
        Path file = tempDir.resolve("A.java");

        assertThatThrownBy(() -> SourcePatcher.splice(file, "abcdef", List.of(new PatchInstruction(file, 2, 7, "x"))))
                .isInstanceOf(PatchRangeException.class)
                .hasMessageContaining("exceeds the 6 chars");
    }

    @Test
    void testOverlappingRangesFail() {
        Path file = tempDir.resolve("A.java");

        assertThatThrownBy(() -> SourcePatcher.splice(file, "abcdefghij", List.of(
                new PatchInstruction(file, 2, 6, "x"),
                new PatchInstruction(file, 4, 8, "y"))))
                .isInstanceOf(PatchRangeException.class)
                .hasMessageContaining("overlaps");
    }

    @Test
    void testFailedBatchLeavesFileUntouched() throws IOException {
        Path file = write("Keep.java", "class Keep {}\n");

        PatchResult result = patcher.applyAll(List.of(
                new PatchInstruction(file, 0, 5, "record"),
                new PatchInstruction(file, 3, 200, "x"))).get(0);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("exceeds");
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo("class Keep {}\n");
    }

    @Test
    void testMissingFileFailsOnlyItsBatch() throws IOException {
        Path missing = tempDir.resolve("Missing.java");
        Path present = write("Present.java", "class Present {}\n");

        assertThatThrownBy(() -> patcher.apply(missing, List.of(new PatchInstruction(missing, 0, 0, "x"))))
                .isInstanceOf(PatchIoException.class)
                .hasMessageContaining("Missing.java");

        List<PatchResult> results = patcher.applyAll(List.of(
                new PatchInstruction(missing, 0, 0, "// a\n"),
                new PatchInstruction(present, 0, 0, "// b\n")));

        assertThat(results).hasSize(2);
        assertThat(results.get(0).isSuccess()).isFalse();
        assertThat(results.get(1).isSuccess()).isTrue();
        assertThat(Files.readString(present, StandardCharsets.UTF_8)).isEqualTo("// b\nclass Present {}\n");
    }

    @Test
    void testUnchangedFileIsNotRewritten() throws IOException {
        Path file = write("Same.java", "class Same {}\n");
        FileTime before = FileTime.fromMillis(1_000_000L);
        Files.setLastModifiedTime(file, before);

        PatchResult result = patcher.apply(file, List.of(new PatchInstruction(file, 0, 5, "class")));

        assertThat(result.isChanged()).isFalse();
        assertThat(Files.getLastModifiedTime(file)).isEqualTo(before);
    }

    @Test
    void testDryRunWritesNothing() throws IOException {
        Path file = write("Dry.java", "class Dry {}\n");

        PatchResult result = new SourcePatcher(true).apply(file, List.of(new PatchInstruction(file, 0, 0, "// x\n")));

        assertThat(result.isChanged()).isTrue();
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo("class Dry {}\n");
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
