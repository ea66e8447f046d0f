package com.jsonsource.generator.codegen;

import lombok.Builder;
import lombok.Data;

import java.util.List;

import com.jsonsource.generator.codegen.patch.PatchResult;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;

    private int filesScanned;
    private int unitsGenerated;
    private int companionFilesWritten;
    private int filesPatched;

    @Builder.Default
    private List<UnitResult> units = List.of();

    @Builder.Default
    private List<PatchResult> patchResults = List.of();

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public List<UnitResult> getFailedUnits() {
        return units.stream().filter(UnitResult::hasErrors).toList();
    }

    public List<PatchResult> getFailedPatches() {
        return patchResults.stream().filter(p -> !p.isSuccess()).toList();
    }
}
