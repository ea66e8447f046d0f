package com.jsonsource.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Location of a type declaration in the unit text, as {@code [startOffset, endOffset)} char offsets.
 */
@Value
public class DeclarationSpan {

    @NonNull
    String name;

    int startOffset;

    int endOffset;

    public String slice(String text) {
        return text.substring(startOffset, endOffset);
    }
}
