package com.jsonsource.generator.parser;

import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.file.*;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the Java sources of a tree, leaving out the companion files this tool writes.
 */
@NoArgsConstructor
public class SourceDiscovery {

    /**
     * First line of every file written by the generator.
     */
    public static final String GENERATED_MARKER = "// GENERATED CODE - DO NOT MODIFY BY HAND";

    public List<Path> discoverSourceFiles(Path sourceDir) throws IOException {
        try (Stream<Path> stream = Files.walk(sourceDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isJavaFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Whether {@code text} was produced by a previous run and must not be read as input.
     */
    public static boolean isGenerated(String text) {
        return text.startsWith(GENERATED_MARKER);
    }

    private boolean isJavaFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".java") && !name.equals("package-info.java") && !name.equals("module-info.java");
    }
}
