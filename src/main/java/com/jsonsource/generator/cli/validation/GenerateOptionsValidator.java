package com.jsonsource.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import com.jsonsource.generator.cli.exception.OptionsValidationException;
import com.jsonsource.generator.cli.model.GenerateOptions;
import com.jsonsource.generator.cli.model.ValidatedGenerateOptions;
import com.jsonsource.generator.config.GenerationOptions;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getSourceDir() == null) {
			errors.add("Source directory is required (--source-dir / -s).");
		} else if (!existsDirectory(o.getSourceDir())) {
			errors.add("Source directory does not exist or is not a directory: " + o.getSourceDir());
		}

		if (o.getOutputDir() != null && Files.exists(o.getOutputDir()) && !Files.isDirectory(o.getOutputDir())) {
			errors.add("Output path exists and is not a directory: " + o.getOutputDir());
		}

		if (o.getThreads() < 1) {
			errors.add("Thread count must be >= 1. Got: " + o.getThreads());
		}

		if (Boolean.FALSE.equals(o.getCreateFactory()) && Boolean.FALSE.equals(o.getCreateToJson())
				&& Boolean.TRUE.equals(o.getPatchSource())) {
			errors.add("--patch-source has nothing to delegate to with both --no-create-factory and --no-create-to-json.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path normalizedSourceDir = o.getSourceDir().toAbsolutePath().normalize();
		Path normalizedOutputDir = o.getOutputDir() == null ? null : o.getOutputDir().toAbsolutePath().normalize();

		return new ValidatedGenerateOptions(normalizedSourceDir, normalizedOutputDir, o.getThreads(),
				toGenerationOptions(o));
	}

	/**
	 * Built-in defaults, overridden by every switch given on the command line.
	 */
	static GenerationOptions toGenerationOptions(GenerateOptions o) {
		GenerationOptions.GenerationOptionsBuilder b = GenerationOptions.defaults().toBuilder();
		set(o.getCreateFactory(), b::createFactory);
		set(o.getCreateToJson(), b::createToJson);
		set(o.getCreateFieldMap(), b::createFieldMap);
		set(o.getCreateJsonKeys(), b::createJsonKeys);
		set(o.getCreatePerFieldToJson(), b::createPerFieldToJson);
		set(o.getGenericArgumentFactories(), b::genericArgumentFactories);
		set(o.getIncludeIfNull(), b::includeIfNull);
		set(o.getExplicitToJson(), b::explicitToJson);
		set(o.getDisallowUnrecognizedKeys(), b::disallowUnrecognizedKeys);
		set(o.getIgnoreUnannotated(), b::ignoreUnannotated);
		set(o.getPatchSource(), b::patchSource);
		if (o.getFieldRename() != null) {
			b.fieldRename(o.getFieldRename());
		}
		return b.build();
	}

	private static void set(Boolean value, Consumer<Boolean> setter) {
		if (value != null) {
			setter.accept(value);
		}
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}
}
