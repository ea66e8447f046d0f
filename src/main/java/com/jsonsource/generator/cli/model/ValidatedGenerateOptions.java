package com.jsonsource.generator.cli.model;

import java.nio.file.Path;

import com.jsonsource.generator.config.GenerationOptions;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path normalizedSourceDir;
    Path normalizedOutputDir;
    int threads;
    GenerationOptions generationOptions;
}
