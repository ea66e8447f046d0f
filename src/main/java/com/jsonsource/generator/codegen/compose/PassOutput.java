package com.jsonsource.generator.codegen.compose;

import java.util.ArrayList;
import java.util.List;

import com.jsonsource.generator.codegen.patch.PatchInstruction;

/**
 * Everything the passes contribute for one unit.
 */
public class PassOutput {

    private final GeneratedUnit generated = new GeneratedUnit();
    private final List<PatchInstruction> patches = new ArrayList<>();
    private final List<SourceInsertion> insertions = new ArrayList<>();

    public void addFragment(String fragment) {
        generated.add(fragment);
    }

    public void addPatch(PatchInstruction patch) {
        patches.add(patch);
    }

    void addInsertion(SourceInsertion insertion) {
        insertions.add(insertion);
    }

    List<SourceInsertion> getInsertions() {
        return insertions;
    }

    public GeneratedUnit getGenerated() {
        return generated;
    }

    public List<PatchInstruction> getPatches() {
        return List.copyOf(patches);
    }
}
