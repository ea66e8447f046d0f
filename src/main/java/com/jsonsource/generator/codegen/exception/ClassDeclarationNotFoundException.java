package com.jsonsource.generator.codegen.exception;

/**
 * The declaration to patch could not be located in the unit text. Only the in-place patch of
 * that element is dropped.
 */
public class ClassDeclarationNotFoundException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public ClassDeclarationNotFoundException(String element, String file) {
        super(element, "Class declaration " + element + " not found in " + file);
    }
}
