package com.jsonsource.generator.codegen.exception;

/**
 * Base class of every error raised while generating code for an element.
 */
public class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String element;

    public GenerationException(String element, String message) {
        super(message);
        this.element = element;
    }

    public GenerationException(String element, String message, Throwable cause) {
        super(message, cause);
        this.element = element;
    }

    /**
     * Element the error originates from.
     */
    public String getElement() {
        return element;
    }
}
