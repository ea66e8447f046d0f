package com.jsonsource.generator.codegen.exception;

/**
 * No registered converter handles a field's declared type.
 */
public class UnsupportedTypeException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public UnsupportedTypeException(String element, String message) {
        super(element, message);
    }
}
