package com.jsonsource.generator;

import com.jsonsource.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the JSON source generator.
 * Scans a Java source tree for {@code @JsonSerializable} and {@code @JsonEnum} declarations and
 * writes a companion class with JSON decode/encode code next to each unit.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
