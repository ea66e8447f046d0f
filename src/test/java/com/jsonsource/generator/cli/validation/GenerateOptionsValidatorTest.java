package com.jsonsource.generator.cli.validation;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.jsonsource.annotation.FieldRename;
import com.jsonsource.generator.cli.exception.OptionsValidationException;
import com.jsonsource.generator.cli.model.GenerateOptions;
import com.jsonsource.generator.cli.model.ValidatedGenerateOptions;
import com.jsonsource.generator.config.GenerationOptions;

import picocli.CommandLine;

class GenerateOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    @Test
    void testDefaultsWhenNoSwitchIsGiven() {
        ValidatedGenerateOptions validated = validator.validate(parse("-s", tempDir.toString()));

        assertThat(validated.getNormalizedSourceDir()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(validated.getNormalizedOutputDir()).isNull();
        assertThat(validated.getThreads()).isPositive();
        assertThat(validated.getGenerationOptions()).isEqualTo(GenerationOptions.defaults());
    }

    @Test
    void testSwitchesOverrideDefaults() {
        ValidatedGenerateOptions validated = validator.validate(parse(
                "--source-dir", tempDir.toString(),
                "--no-create-factory",
                "--no-include-if-null",
                "--create-json-keys",
                "--patch-source",
                "--field-rename", "snake",
                "--threads", "3"));

        GenerationOptions options = validated.getGenerationOptions();
        assertThat(options.isCreateFactory()).isFalse();
        assertThat(options.isCreateToJson()).isTrue();
        assertThat(options.isIncludeIfNull()).isFalse();
        assertThat(options.isCreateJsonKeys()).isTrue();
        assertThat(options.isPatchSource()).isTrue();
        assertThat(options.getFieldRename()).isEqualTo(FieldRename.SNAKE);
        assertThat(validated.getThreads()).isEqualTo(3);
    }

    @Test
    void testAllErrorsAreReportedTogether() throws IOException {
        Path file = Files.writeString(tempDir.resolve("out.txt"), "x");

        assertThatThrownBy(() -> validator.validate(parse(
                "-s", tempDir.resolve("missing").toString(),
                "-o", file.toString(),
                "--threads", "0")))
                .isInstanceOfSatisfying(OptionsValidationException.class,
                        e -> assertThat(e.getErrors()).hasSize(3))
                .hasMessageContaining("Source directory does not exist")
                .hasMessageContaining("is not a directory: " + file)
                .hasMessageContaining("Thread count must be >= 1");
    }

    @Test
    void testPatchSourceNeedsSomethingToDelegateTo() {
        assertThatThrownBy(() -> validator.validate(parse(
                "-s", tempDir.toString(), "--no-create-factory", "--no-create-to-json", "--patch-source")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--patch-source");
    }

    private static GenerateOptions parse(String... args) {
        GenerateOptions options = new GenerateOptions();
        new CommandLine(options).setCaseInsensitiveEnumValuesAllowed(true).parseArgs(args);
        return options;
    }
}
