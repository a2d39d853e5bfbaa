package com.soundbank.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.soundbank.generator.cli.exception.OptionsValidationException;
import com.soundbank.generator.cli.model.GenerateOptions;
import com.soundbank.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	public static final String DEFAULT_OUTPUT_DIR = "txtp";

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getBankDumps() == null || o.getBankDumps().isEmpty()) {
			errors.add("At least one bank dump file is required.");
		} else {
			for (Path dump : o.getBankDumps()) {
				if (!Files.isRegularFile(dump)) {
					errors.add("Bank dump does not exist or is not a file: " + dump);
				}
			}
		}

		if (o.isFilterRest() && o.getFilters().isEmpty()) {
			errors.add("--filter-rest requires at least one --filter.");
		}
		if (o.isSkipUnused() && !o.isUnused()) {
			errors.add("--skip-unused requires --unused.");
		}

		// Normalize output dir
		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(DEFAULT_OUTPUT_DIR) : o.getOutputDir())
				.toAbsolutePath().normalize();

		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		Map<Long, Long> fixedSelectors = parseAssignments(o.getSelectors(), "--selector", Long::parseLong, errors);
		Map<Long, Double> fixedParams = parseAssignments(o.getParams(), "--param", Double::parseDouble, errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(normalizedOutputDir, fixedSelectors, fixedParams);
	}

	/**
	 * Parses {@code KEY=VALUE} entries where the key is a numeric id.
	 */
	private static <T> Map<Long, T> parseAssignments(List<String> entries, String option,
			Function<String, T> valueParser, List<String> errors) {
		Map<Long, T> result = new LinkedHashMap<>();
		if (entries == null) {
			return result;
		}

		for (String entry : entries) {
			int eq = entry.indexOf('=');
			if (eq <= 0 || eq == entry.length() - 1) {
				errors.add(option + " must be KEY=VALUE. Got: " + entry);
				continue;
			}
			try {
				long key = Long.parseLong(entry.substring(0, eq).trim());
				T value = valueParser.apply(entry.substring(eq + 1).trim());
				if (result.put(key, value) != null) {
					errors.add(option + " given twice for " + key);
				}
			} catch (NumberFormatException e) {
				errors.add(option + " has a non-numeric id or value: " + entry);
			}
		}
		return result;
	}
}
