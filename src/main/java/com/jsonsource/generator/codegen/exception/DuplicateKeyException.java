package com.jsonsource.generator.codegen.exception;

/**
 * Two encoded fields resolve to the same output key.
 */
public class DuplicateKeyException extends GenerationException {

    private static final long serialVersionUID = 1L;

    private final String jsonKey;
    private final String firstField;
    private final String secondField;

    public DuplicateKeyException(String element, String jsonKey, String firstField, String secondField) {
        super(element, "More than one field has the JSON key \"" + jsonKey + "\": "
                + firstField + " and " + secondField + ".");
        this.jsonKey = jsonKey;
        this.firstField = firstField;
        this.secondField = secondField;
    }

    public String getJsonKey() {
        return jsonKey;
    }

    public String getFirstField() {
        return firstField;
    }

    public String getSecondField() {
        return secondField;
    }
}
