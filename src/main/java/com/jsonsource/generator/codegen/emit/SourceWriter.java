package com.jsonsource.generator.codegen.emit;

/**
 * Line-oriented builder for generated members. Indents with four spaces per level and never
 * emits trailing whitespace.
 */
class SourceWriter {

    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();
    private int level;

    SourceWriter line(String text) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        if (!text.isEmpty()) {
            sb.append(INDENT.repeat(level)).append(text);
        }
        return this;
    }

    SourceWriter blank() {
        return line("");
    }

    SourceWriter open(String text) {
        line(text + " {");
        level++;
        return this;
    }

    SourceWriter close() {
        return close("}");
    }

    SourceWriter close(String text) {
        level--;
        return line(text);
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
