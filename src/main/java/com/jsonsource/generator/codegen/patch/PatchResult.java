package com.jsonsource.generator.codegen.patch;

import java.nio.file.Path;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of one file's patch batch.
 */
@Value
@Builder
public class PatchResult {

    @NonNull
    Path file;

    int instructionCount;

    /**
     * The file content changed (or would have, in a dry run).
     */
    boolean changed;

    /**
     * Set when the batch failed; the file is then left untouched.
     */
    String error;

    public boolean isSuccess() {
        return error == null;
    }
}
