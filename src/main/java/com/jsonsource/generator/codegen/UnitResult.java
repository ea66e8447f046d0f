package com.jsonsource.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import com.jsonsource.generator.codegen.diagnostics.Diagnostic;
import com.jsonsource.generator.codegen.diagnostics.Severity;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of generation for one source unit.
 */
@Value
@Builder(toBuilder = true)
public class UnitResult {

    @NonNull
    Path source;

    boolean success;

    /**
     * First terminal error, when {@link #success} is false.
     */
    String error;

    /**
     * Companion file path, {@code null} when the unit produced no companion.
     */
    Path companionFile;

    /**
     * The companion file content changed on disk (or would have, in a dry run).
     */
    boolean companionWritten;

    int fragmentCount;

    int patchCount;

    @NonNull
    @Singular("diagnostic")
    List<Diagnostic> diagnostics;

    public static UnitResult failure(Path source, String error) {
        return UnitResult.builder()
                .source(source)
                .success(false)
                .error(error)
                .diagnostic(Diagnostic.error(source.toString(), error))
                .build();
    }

    public boolean hasErrors() {
        return !success || diagnostics.stream().anyMatch(d -> d.getSeverity() == Severity.ERROR);
    }
}
