package com.jsonsource.generator.codegen.exception;

/**
 * A patch range does not fit the current file contents. Fatal for that file's batch.
 */
public class PatchRangeException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public PatchRangeException(String file, String message) {
        super(file, message);
    }
}
