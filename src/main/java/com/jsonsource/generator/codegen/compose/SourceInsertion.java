package com.jsonsource.generator.codegen.compose;

import com.jsonsource.generator.model.DeclarationSpan;

import lombok.Value;

/**
 * Members to add inside one declaration, before its closing brace.
 */
@Value
class SourceInsertion {

    DeclarationSpan declaration;

    /**
     * Absolute offset in the unit text.
     */
    int offset;

    String text;

    boolean contains(SourceInsertion other) {
        return declaration.getStartOffset() <= other.declaration.getStartOffset()
                && other.declaration.getEndOffset() <= declaration.getEndOffset()
                && !declaration.equals(other.declaration);
    }
}
