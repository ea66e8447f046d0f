package com.jsonsource.generator.codegen.patch;

import java.nio.file.Path;

import lombok.NonNull;
import lombok.Value;

/**
 * Replace {@code [startOffset, endOffset)} of a file with {@code replacementText}.
 *
 * Offsets are char offsets into the file text as read by the parser. Created during composition
 * and consumed once by the {@link SourcePatcher}.
 */
@Value
public class PatchInstruction {

    @NonNull
    Path filePath;

    int startOffset;

    int endOffset;

    @NonNull
    String replacementText;
}
