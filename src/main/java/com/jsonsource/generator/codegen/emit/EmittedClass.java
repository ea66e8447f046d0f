package com.jsonsource.generator.codegen.emit;

import java.util.List;
import java.util.stream.Stream;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Code generated for one class: its own members, then the shared helpers they call.
 */
@Value
@Builder
public class EmittedClass {

    @NonNull
    @Singular("member")
    List<String> members;

    @NonNull
    @Singular("helper")
    List<String> helpers;

    /**
     * Members followed by helpers, in emission order.
     */
    public List<String> getFragments() {
        return Stream.concat(members.stream(), helpers.stream()).toList();
    }
}
