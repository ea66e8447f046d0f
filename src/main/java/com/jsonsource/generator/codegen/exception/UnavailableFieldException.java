package com.jsonsource.generator.codegen.exception;

/**
 * Generated code needs a field that selection excluded, or that cannot be reached.
 */
public class UnavailableFieldException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public UnavailableFieldException(String element, String message) {
        super(element, message);
    }
}
