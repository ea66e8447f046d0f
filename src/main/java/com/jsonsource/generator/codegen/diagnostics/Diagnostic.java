package com.jsonsource.generator.codegen.diagnostics;

import lombok.NonNull;
import lombok.Value;

/**
 * A warning or error tied to the element it originates from.
 */
@Value
public class Diagnostic {

    @NonNull
    Severity severity;

    /**
     * Originating element, e.g. {@code com.example.Point.x} or a file path.
     */
    @NonNull
    String element;

    @NonNull
    String message;

    public static Diagnostic error(String element, String message) {
        return new Diagnostic(Severity.ERROR, element, message);
    }

    public static Diagnostic warning(String element, String message) {
        return new Diagnostic(Severity.WARNING, element, message);
    }

    public static Diagnostic info(String element, String message) {
        return new Diagnostic(Severity.INFO, element, message);
    }

    @Override
    public String toString() {
        return severity + " " + element + ": " + message;
    }
}
