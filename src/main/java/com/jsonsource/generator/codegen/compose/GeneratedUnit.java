package com.jsonsource.generator.codegen.compose;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregate generated text of one unit: fragments deduplicated by exact text equality, kept in
 * first-seen order.
 */
public class GeneratedUnit {

    static final String SEPARATOR = "\n\n";

    private final Set<String> fragments = new LinkedHashSet<>();

    /**
     * @return {@code false} when an identical fragment was already present
     */
    public boolean add(String fragment) {
        return fragments.add(fragment);
    }

    public List<String> getFragments() {
        return new ArrayList<>(fragments);
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    /**
     * Fragments joined by a blank line.
     */
    public String render() {
        return String.join(SEPARATOR, fragments);
    }
}
