package com.jsonsource.generator.codegen;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonsource.generator.codegen.compose.ComposedUnit;
import com.jsonsource.generator.codegen.compose.GeneratorComposer;
import com.jsonsource.generator.codegen.diagnostics.Diagnostic;
import com.jsonsource.generator.codegen.exception.GenerationException;
import com.jsonsource.generator.codegen.output.CompanionFileRenderer;
import com.jsonsource.generator.codegen.output.GeneratedFile;
import com.jsonsource.generator.codegen.patch.PatchInstruction;
import com.jsonsource.generator.codegen.patch.PatchResult;
import com.jsonsource.generator.codegen.patch.SourcePatcher;
import com.jsonsource.generator.codegen.util.FileWriteUtil;
import com.jsonsource.generator.model.SourceUnit;
import com.jsonsource.generator.model.TypeIndex;
import com.jsonsource.generator.parser.SourceDiscovery;
import com.jsonsource.generator.parser.SourceUnitParser;

/**
 * Runs generation over a source tree: discovers and parses units, composes each annotated unit
 * on a fixed thread pool, writes companion files, then applies the merged patch batches file by
 * file.
 *
 * A failing unit is reported in its {@link UnitResult}; sibling units carry on.
 */
public class GenerationPipeline {
    private static final Logger log = LoggerFactory.getLogger(GenerationPipeline.class);

    private final GeneratorConfig config;
    private final SourceDiscovery discovery;
    private final SourceUnitParser parser;
    private final GeneratorComposer composer;
    private final CompanionFileRenderer renderer;
    private final SourcePatcher patcher;

    public GenerationPipeline(GeneratorConfig config) {
        this(config, new GeneratorComposer());
    }

    public GenerationPipeline(GeneratorConfig config, GeneratorComposer composer) {
        this.config = config;
        this.discovery = new SourceDiscovery();
        this.parser = new SourceUnitParser();
        this.composer = composer;
        this.renderer = new CompanionFileRenderer(config.getOutputDir());
        this.patcher = new SourcePatcher(config.isDryRun());
    }

    public GeneratorResult generate() {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, config.getThreads()));
        try {
            log.info("Starting JSON code generation in {}...", config.getSourceDir());

            // Step 1: Discover sources
            log.info("Step 1: Discovering sources...");
            List<Path> files = discovery.discoverSourceFiles(config.getSourceDir());
            if (files.isEmpty()) {
                return GeneratorResult.failure("No Java sources found in " + config.getSourceDir());
            }

            // Step 2: Parse every unit into the shared type index
            log.info("Step 2: Parsing {} files...", files.size());
            Map<Path, UnitResult> results = new LinkedHashMap<>();
            List<SourceUnit> units = parseAll(files, executor, results);
            TypeIndex typeIndex = TypeIndex.of(units);
            log.info("  Indexed {} declarations", typeIndex.size());

            // Step 3: Compose annotated units and write their companions
            List<SourceUnit> annotated = units.stream().filter(SourceUnit::hasAnnotatedElements).toList();
            log.info("Step 3: Generating code for {} units...", annotated.size());
            List<CompletableFuture<UnitOutcome>> futures = new ArrayList<>();
            for (SourceUnit unit : annotated) {
                futures.add(CompletableFuture.supplyAsync(() -> process(unit, typeIndex), executor)
                        .exceptionally(e -> UnitOutcome.failed(unit.getPath(), rootCause(e))));
            }
            List<PatchInstruction> patches = new ArrayList<>();
            for (CompletableFuture<UnitOutcome> future : futures) {
                UnitOutcome outcome = future.join();
                results.put(outcome.result.getSource(), outcome.result);
                patches.addAll(outcome.patches);
            }

            // Step 4: Patch sources in place
            List<PatchResult> patchResults = List.of();
            if (!patches.isEmpty()) {
                log.info("Step 4: Applying {} patches...", patches.size());
                patchResults = patcher.applyAll(patches);
                for (PatchResult patchResult : patchResults) {
                    if (!patchResult.isSuccess()) {
                        results.computeIfPresent(patchResult.getFile(), (path, unitResult) -> unitResult.toBuilder()
                                .diagnostic(Diagnostic.error(path.toString(), patchResult.getError()))
                                .build());
                    }
                }
            }

            List<UnitResult> unitResults = new ArrayList<>(results.values());
            boolean success = unitResults.stream().noneMatch(UnitResult::hasErrors);
            log.info("Generation {}", success ? "complete!" : "finished with errors");

            return GeneratorResult.builder()
                    .success(success)
                    .errorMessage(success ? null : "Generation failed for "
                            + unitResults.stream().filter(UnitResult::hasErrors).count() + " units")
                    .filesScanned(files.size())
                    .unitsGenerated((int) unitResults.stream().filter(r -> r.isSuccess() && r.getFragmentCount() > 0)
                            .count())
                    .companionFilesWritten((int) unitResults.stream().filter(UnitResult::isCompanionWritten).count())
                    .filesPatched((int) patchResults.stream().filter(p -> p.isSuccess() && p.isChanged()).count())
                    .units(unitResults)
                    .patchResults(patchResults)
                    .build();

        } catch (IOException e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        } finally {
            executor.shutdown();
        }
    }

    private List<SourceUnit> parseAll(List<Path> files, ExecutorService executor, Map<Path, UnitResult> results) {
        List<CompletableFuture<Optional<SourceUnit>>> futures = new ArrayList<>();
        for (Path file : files) {
            futures.add(CompletableFuture.supplyAsync(() -> parse(file), executor));
        }
        List<SourceUnit> units = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Path file = files.get(i);
            try {
                futures.get(i).join().ifPresent(units::add);
            } catch (CompletionException e) {
                String message = rootCause(e).getMessage();
                log.error("Failed to read {}: {}", file, message);
                results.put(file, UnitResult.failure(file, message));
            }
        }
        return units;
    }

    private Optional<SourceUnit> parse(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CompletionException(e);
        }
        if (SourceDiscovery.isGenerated(text)) {
            log.debug("Skipping generated file {}", file);
            return Optional.empty();
        }
        return Optional.of(parser.parse(file, text));
    }

    private UnitOutcome process(SourceUnit unit, TypeIndex typeIndex) {
        ComposedUnit composed = composer.compose(unit, typeIndex, config.getOptions());
        UnitResult.UnitResultBuilder result = UnitResult.builder()
                .source(unit.getPath())
                .success(true)
                .fragmentCount(composed.getGenerated().getFragments().size())
                .patchCount(composed.getPatches().size())
                .diagnostics(composed.getDiagnostics());

        if (composed.hasCompanion()) {
            GeneratedFile companion = renderer.render(composed);
            result.companionFile(companion.getPath());
            result.companionWritten(write(companion));
        }
        log.info("  {}: {} fragments, {} patches", unit.getPath().getFileName(),
                composed.getGenerated().getFragments().size(), composed.getPatches().size());
        return new UnitOutcome(result.build(), composed.getPatches());
    }

    private boolean write(GeneratedFile file) {
        try {
            if (config.isDryRun()) {
                return !Files.isRegularFile(file.getPath())
                        || !Files.readString(file.getPath(), StandardCharsets.UTF_8).equals(file.getContents());
            }
            return FileWriteUtil.writeIfChanged(file.getPath(), file.getContents());
        } catch (IOException e) {
            throw new CompletionException(e);
        }
    }

    private static Throwable rootCause(Throwable e) {
        Throwable cause = e;
        while ((cause instanceof CompletionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static final class UnitOutcome {
        private final UnitResult result;
        private final List<PatchInstruction> patches;

        private UnitOutcome(UnitResult result, List<PatchInstruction> patches) {
            this.result = result;
            this.patches = patches;
        }

        static UnitOutcome failed(Path source, Throwable error) {
            String message = error instanceof GenerationException generation
                    ? generation.getElement() + ": " + generation.getMessage()
                    : String.valueOf(error.getMessage());
            log.error("Generation failed for {}: {}", source, message);
            return new UnitOutcome(UnitResult.failure(source, message), List.of());
        }
    }
}
