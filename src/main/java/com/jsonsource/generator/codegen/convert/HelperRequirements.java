package com.jsonsource.generator.codegen.convert;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared helper members requested while emitting one class, in first-request order.
 *
 * Not thread-safe; one instance per emitted class.
 */
public class HelperRequirements {

    private final Set<String> fragments = new LinkedHashSet<>();

    public void require(String fragment) {
        fragments.add(fragment);
    }

    public List<String> getFragments() {
        return new ArrayList<>(fragments);
    }
}
