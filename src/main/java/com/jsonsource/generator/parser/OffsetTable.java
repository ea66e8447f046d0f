package com.jsonsource.generator.parser;

import java.util.ArrayList;
import java.util.List;

import com.github.javaparser.Position;
import com.github.javaparser.Range;

/**
 * Maps parser positions (1-based line and column) to char offsets in the unit text.
 * Line terminators are {@code \n}, {@code \r\n} and {@code \r}, as the parser counts them.
 */
final class OffsetTable {

    private final int[] lineStarts;
    private final int length;

    OffsetTable(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            } else if (c == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        this.length = text.length();
    }

    int offsetOf(Position position) {
        if (position.line < 1 || position.line > lineStarts.length) {
            throw new IllegalArgumentException("Line " + position.line + " outside of text");
        }
        int offset = lineStarts[position.line - 1] + position.column - 1;
        return Math.min(offset, length);
    }

    /**
     * {@code [start, end)} of a range whose end position is inclusive.
     */
    int[] span(Range range) {
        return new int[] {offsetOf(range.begin), Math.min(offsetOf(range.end) + 1, length)};
    }
}
