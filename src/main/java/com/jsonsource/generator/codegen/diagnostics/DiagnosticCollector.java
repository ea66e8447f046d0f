package com.jsonsource.generator.codegen.diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Diagnostics accumulated while processing one unit.
 *
 * Pure structure only: no logging, no formatting, no IO. One collector per unit, so it is never
 * shared between threads.
 */
public class DiagnosticCollector {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void reportAll(Collection<Diagnostic> more) {
        diagnostics.addAll(more);
    }

    public void error(String element, String message) {
        report(Diagnostic.error(element, message));
    }

    public void warning(String element, String message) {
        report(Diagnostic.warning(element, message));
    }

    public void info(String element, String message) {
        report(Diagnostic.info(element, message));
    }

    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }
}
