package com.jsonsource.generator.codegen.compose;

import java.util.List;

import com.jsonsource.generator.codegen.diagnostics.Diagnostic;
import com.jsonsource.generator.codegen.patch.PatchInstruction;
import com.jsonsource.generator.model.SourceUnit;

import lombok.NonNull;
import lombok.Value;

/**
 * Result of composing every pass over one unit.
 */
@Value
public class ComposedUnit {

    @NonNull
    SourceUnit unit;

    @NonNull
    GeneratedUnit generated;

    @NonNull
    List<PatchInstruction> patches;

    @NonNull
    List<Diagnostic> diagnostics;

    /**
     * Whether a companion file is produced.
     */
    public boolean hasCompanion() {
        return !generated.isEmpty();
    }
}
