package com.jsonsource.generator.cli.model;

import java.nio.file.Path;

import com.jsonsource.annotation.FieldRename;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 *
 * Generation switches are tri-state: {@code null} keeps the built-in default.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--source-dir", "-s" }, required = true, description = "Root of the Java source tree to scan")
	private Path sourceDir;

	@Option(names = { "--output-dir",
			"-o" }, description = "Separate root for companion files, mirroring packages (defaults to next to each unit)")
	private Path outputDir;

	@Option(names = { "--threads", "-t" }, description = "Worker threads for parsing and generation (default: available processors)")
	private int threads = Runtime.getRuntime().availableProcessors();

	@Option(names = { "--dry-run" }, description = "Compute everything but write no file")
	private boolean dryRun;

	@Option(names = { "--verbose", "-v" }, description = "Log per-field decisions")
	private boolean verbose;

	// Global generation defaults, overridable per class and per field by annotations

	@Option(names = { "--create-factory" }, negatable = true, description = "Generate the decode factory (default: true)")
	private Boolean createFactory;

	@Option(names = { "--create-to-json" }, negatable = true, description = "Generate the encode function (default: true)")
	private Boolean createToJson;

	@Option(names = { "--create-field-map" }, negatable = true, description = "Generate the field name to key map")
	private Boolean createFieldMap;

	@Option(names = { "--create-json-keys" }, negatable = true, description = "Generate the key constants class")
	private Boolean createJsonKeys;

	@Option(names = {
			"--create-per-field-to-json" }, negatable = true, description = "Generate one encode function per field")
	private Boolean createPerFieldToJson;

	@Option(names = {
			"--generic-argument-factories" }, negatable = true, description = "Pass conversion functions for type parameters")
	private Boolean genericArgumentFactories;

	@Option(names = { "--include-if-null" }, negatable = true, description = "Write null values (default: true)")
	private Boolean includeIfNull;

	@Option(names = { "--explicit-to-json" }, negatable = true, description = "Encode nested objects with their toJson")
	private Boolean explicitToJson;

	@Option(names = {
			"--disallow-unrecognized-keys" }, negatable = true, description = "Reject input keys no field maps to")
	private Boolean disallowUnrecognizedKeys;

	@Option(names = {
			"--ignore-unannotated" }, negatable = true, description = "Only use fields annotated with @JsonKey")
	private Boolean ignoreUnannotated;

	@Option(names = { "--patch-source" }, negatable = true, description = "Add delegating fromJson/toJson members to the sources")
	private Boolean patchSource;

	@Option(names = {
			"--field-rename" }, description = "Key naming for fields: ${COMPLETION-CANDIDATES} (default: NONE)")
	private FieldRename fieldRename;

	// ---- Getters (no setters needed; picocli sets fields reflectively) ----

}
