package com.soundbank.generator.cli.model;

import java.nio.file.Path;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path normalizedOutputDir;
    Map<Long, Long> fixedSelectors;
    Map<Long, Double> fixedParams;
}
