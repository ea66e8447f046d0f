package com.jsonsource.generator.codegen.exception;

import java.io.IOException;

/**
 * Reading or writing a patch target failed. Fatal for that file's batch.
 */
public class PatchIoException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public PatchIoException(String file, String message, IOException cause) {
        super(file, message, cause);
    }
}
