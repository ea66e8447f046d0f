package com.jsonsource.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonsource.generator.cli.model.GenerateOptions;
import com.jsonsource.generator.cli.model.ValidatedGenerateOptions;
import com.jsonsource.generator.codegen.GeneratorResult;
import com.jsonsource.generator.codegen.UnitResult;
import com.jsonsource.generator.codegen.diagnostics.Diagnostic;
import com.jsonsource.generator.codegen.diagnostics.Severity;
import com.jsonsource.generator.codegen.patch.PatchResult;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("JSON Source Generator");
        log.info("=================================================");
        log.info("Source Directory: {}", v.getNormalizedSourceDir());
        log.info("Output Directory: {}", v.getNormalizedOutputDir() != null
                ? v.getNormalizedOutputDir() : "next to each source unit");
        log.info("Threads: {}", v.getThreads());
        log.info("Dry Run: {}", o.isDryRun());
        log.info("Options: {}", v.getGenerationOptions());
        log.info("=================================================");
    }

    public void printSuccess(GenerateOptions o, GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info(o.isDryRun() ? "DRY RUN SUCCESSFUL" : "GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Files Scanned: {}", result.getFilesScanned());
        log.info("Units Generated: {}", result.getUnitsGenerated());
        log.info("Companion Files {}: {}", o.isDryRun() ? "To Write" : "Written", result.getCompanionFilesWritten());
        log.info("Source Files Patched: {}", result.getFilesPatched());
        printWarnings(result);
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
        for (UnitResult unit : result.getFailedUnits()) {
            for (Diagnostic diagnostic : unit.getDiagnostics()) {
                if (diagnostic.getSeverity() == Severity.ERROR) {
                    log.error("  {}", diagnostic);
                }
            }
        }
        for (PatchResult patch : result.getFailedPatches()) {
            log.error("  Patch of {} failed: {}", patch.getFile(), patch.getError());
        }
        printWarnings(result);
    }

    private void printWarnings(GeneratorResult result) {
        for (UnitResult unit : result.getUnits()) {
            for (Diagnostic diagnostic : unit.getDiagnostics()) {
                if (diagnostic.getSeverity() == Severity.WARNING) {
                    log.warn("  {}", diagnostic);
                } else if (diagnostic.getSeverity() == Severity.INFO) {
                    log.debug("  {}", diagnostic);
                }
            }
        }
    }
}
