package com.soundbank.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Parameters(arity = "1..*", paramLabel = "BANK_DUMP", description = "Bank dump files (JSON), in load order")
	private List<Path> bankDumps = new ArrayList<>();

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to ./txtp)")
	private Path outputDir;

	@Option(names = { "--unused", "-u" }, description = "Also render objects not referenced by any event")
	private boolean unused;

	@Option(names = { "--bank-order" }, description = "Render objects in bank order instead of named first")
	private boolean bankOrder;

	@Option(names = { "--filter", "-f" }, description = "Render only matching objects (short id, name or type name); repeatable")
	private List<String> filters = new ArrayList<>();

	@Option(names = { "--filter-rest" }, description = "With --filter, render the non-matching objects after the matching ones")
	private boolean filterRest;

	@Option(names = { "--skip-normal" }, description = "Do not write artifacts of the regular pass (they still count for duplicates)")
	private boolean skipNormal;

	@Option(names = { "--skip-unused" }, description = "Do not write artifacts of the unused pass")
	private boolean skipUnused;

	@Option(names = { "--dupes" }, description = "Write artifacts even when identical to an earlier one")
	private boolean dupes;

	@Option(names = { "--dry-run" }, description = "Render everything but write no files")
	private boolean dryRun;

	@Option(names = { "--selector", "-s" }, paramLabel = "GROUP=VALUE", description = "Fix a switch/state group to one value (ids); repeatable")
	private List<String> selectors = new ArrayList<>();

	@Option(names = { "--param", "-p" }, paramLabel = "ID=VALUE", description = "Fix a game parameter to one value; repeatable")
	private List<String> params = new ArrayList<>();

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;
}
