package com.jsonsource.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonsource.generator.cli.exception.OptionsValidationException;
import com.jsonsource.generator.cli.model.GenerateOptions;
import com.jsonsource.generator.cli.model.ValidatedGenerateOptions;
import com.jsonsource.generator.cli.output.GenerateResultsPrinter;
import com.jsonsource.generator.cli.validation.GenerateOptionsValidator;
import com.jsonsource.generator.codegen.GenerationPipeline;
import com.jsonsource.generator.codegen.GeneratorConfig;
import com.jsonsource.generator.codegen.GeneratorResult;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command generating JSON companion classes for a Java source tree.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "json-source-generator 1.0.0",
        description = "Generates JSON decode/encode companion classes for @JsonSerializable types and patches the sources on request."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        try {
            if (options.isVerbose()) {
                enableDebugLogging();
            }

            ValidatedGenerateOptions validated = validator.validate(options);

            GeneratorConfig config = GeneratorConfig.builder()
                    .sourceDir(validated.getNormalizedSourceDir())
                    .outputDir(validated.getNormalizedOutputDir())
                    .threads(validated.getThreads())
                    .dryRun(options.isDryRun())
                    .options(validated.getGenerationOptions())
                    .build();

            printer.printBanner(options, validated);

            GeneratorResult result = new GenerationPipeline(config).generate();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            printer.printSuccess(options, result);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
        }
    }
}
