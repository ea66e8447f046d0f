package com.jsonsource.generator.codegen.compose;

import com.jsonsource.generator.model.ClassModel;

/**
 * One independent generator run over every class of a unit.
 */
public interface GenerationPass {

    String getName();

    /**
     * Whether the class carries this pass's trigger annotation.
     */
    boolean appliesTo(ClassModel model, UnitContext context);

    void generate(ClassModel model, UnitContext context, PassOutput output);

    /**
     * Called once after every class of the unit went through {@link #generate}.
     */
    default void complete(UnitContext context, PassOutput output) {
    }
}
