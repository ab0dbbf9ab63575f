package com.schemaid.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Holds all CLI options for the "fingerprint" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class FingerprintOptions {

	@Option(names = { "--model", "-m" }, required = true, description = "Fully qualified model class name (repeatable)")
	private List<String> models;

	@Option(names = { "--classpath",
			"-cp" }, description = "Extra class path entries holding the models (jars or directories, separated by the path separator or commas)")
	private String classpath;

	@Option(names = { "--track-descriptions" }, description = "Include model and field descriptions in the identifier")
	private boolean trackDescriptions;

	@Option(names = { "--track-field-order" }, description = "Field declaration order changes the identifier")
	private boolean trackFieldOrder;

	@Option(names = {
			"--track-type-order" }, description = "Union member and enum constant order changes the identifier")
	private boolean trackTypeOrder;

	@Option(names = { "--extra-data" }, description = "Extra KEY=VALUE data folded into the identifier (repeatable)")
	private Map<String, String> extraData;

	@Option(names = {
			"--digest-length" }, defaultValue = "64", description = "Hex characters kept from the digest, 8-64 (default: 64)")
	private int digestLength;

	@Option(names = {
			"--max-nodes" }, defaultValue = "10000", description = "Upper bound on schema graph nodes per model (default: 10000)")
	private int maxNodes;

	@Option(names = { "--show-canonical" }, description = "Log the canonical form of each model as hex")
	private boolean showCanonical;

	@Option(names = { "--report-file", "-r" }, description = "Write the identity report to this file")
	private Path reportFile;

	@Option(names = { "--compare" }, description = "Compare exactly two models; exit code 0 when same, 2 when different")
	private boolean compare;

	// ---- Getters (no setters needed; picocli sets fields reflectively) ----

}
