package com.jsonsource.generator.codegen.exception;

/**
 * Malformed or conflicting generation options. Fatal for the class.
 */
public class ConfigurationException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String element, String message) {
        super(element, message);
    }

    public ConfigurationException(String element, String message, Throwable cause) {
        super(element, message, cause);
    }
}
