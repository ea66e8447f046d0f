package com.jsonsource.generator.codegen;

import java.nio.file.Path;

import com.jsonsource.generator.config.GenerationOptions;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one generation run.
 */
@Data
@Builder
public class GeneratorConfig {
    private Path sourceDir;

    /**
     * Separate root for companion files; {@code null} writes them next to their units.
     */
    private Path outputDir;

    @Builder.Default
    private int threads = Runtime.getRuntime().availableProcessors();

    private boolean dryRun;

    @Builder.Default
    private GenerationOptions options = GenerationOptions.defaults();
}
