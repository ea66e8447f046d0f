package com.jsonsource.generator.codegen.exception;

import java.util.List;

/**
 * A source file could not be parsed into a semantic model.
 */
public class SourceParseException extends GenerationException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    public SourceParseException(String file, List<String> problems) {
        super(file, "Failed to parse " + file + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
