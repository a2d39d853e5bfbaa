package com.soundbank.generator.cli.output;

import java.util.Collection;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.soundbank.generator.cli.model.GenerateOptions;
import com.soundbank.generator.cli.model.ValidatedGenerateOptions;
import com.soundbank.generator.codegen.GeneratorResult;
import com.soundbank.generator.codegen.model.core.context.GenerationStats;
import com.soundbank.generator.registry.RegistryDiagnostics;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    /** Longest list of ids printed inline before it is cut. */
    private static final int MAX_LISTED = 20;

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Soundbank Artifact Generator");
        log.info("=================================================");
        log.info("Bank Dumps: {}", o.getBankDumps().size());
        o.getBankDumps().forEach(dump -> log.info("  {}", dump.toAbsolutePath()));
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Unused Objects: {}", o.isUnused() ? "yes" : "no");
        if (!o.getFilters().isEmpty()) {
            log.info("Filters: {}{}", o.getFilters(), o.isFilterRest() ? " (+rest)" : "");
        }
        if (!v.getFixedSelectors().isEmpty()) {
            log.info("Fixed Selectors: {}", v.getFixedSelectors());
        }
        if (!v.getFixedParams().isEmpty()) {
            log.info("Fixed Params: {}", v.getFixedParams());
        }
        if (o.isDryRun()) {
            log.info("Dry Run: no files will be written");
        }
        log.info("=================================================");
    }

    public void printSuccess(ValidatedGenerateOptions v, GeneratorResult result, GenerationStats stats) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", v.getNormalizedOutputDir());
        log.info("Banks Loaded: {}", result.getBanksLoaded());
        log.info("Objects Registered: {}", result.getObjectsRegistered());
        log.info("Root Objects: {} (+{} unused)", result.getRootsProcessed(), result.getUnusedRootsProcessed());
        log.info("Artifacts Rendered: {} (+{} secondary)",
                result.getArtifactsPublished(), result.getSecondaryArtifactsPublished());
        log.info("");
        log.info("Output Summary:");
        log.info("  Written: {}", stats.getWritten());
        if (stats.getUnusedWritten() > 0) {
            log.info("  Written (unused): {}", stats.getUnusedWritten());
        }
        log.info("  Duplicates: {}", stats.getDuplicates());
        log.info("  Empty: {}", stats.getEmpty());
        if (stats.getSuppressed() > 0) {
            log.info("  Skipped: {}", stats.getSuppressed());
        }
        log.info("  Time: {} ms", result.getGenerationTimeMillis());

        printDiagnostics(result.getDiagnostics());
        log.info("=================================================");
    }

    private void printDiagnostics(RegistryDiagnostics d) {
        if (d == null || (!d.hasFindings() && d.getTransitionObjects() == 0)) {
            return;
        }

        log.info("");
        log.info("Diagnostics:");
        if (d.getMissingCount() > 0) {
            log.warn("  Missing objects: {}", d.getMissingCount());
            if (!d.getMissingInLoadedBanks().isEmpty()) {
                log.warn("    in loaded banks: {} (probably leftovers from authoring)", d.getMissingInLoadedBanks().size());
            }
            if (!d.getMissingInOtherBanks().isEmpty()) {
                log.warn("    in other banks: {} (load banks {})", d.getMissingInOtherBanks().size(),
                        String.join(", ", d.getMissingBanks()));
            }
            if (!d.getMissingInUnknownBanks().isEmpty()) {
                log.warn("    in unknown banks: {}", d.getMissingInUnknownBanks().size());
            }
        }
        if (!d.getAmbiguousIds().isEmpty()) {
            log.warn("  Ids found in several banks (first loaded bank used): {}", limited(d.getAmbiguousIds()));
        }
        if (!d.getUnsupportedTypes().isEmpty()) {
            log.warn("  Unsupported object types: {}", String.join(", ", d.getUnsupportedTypes()));
        }
        if (!d.getUnknownProps().isEmpty()) {
            log.info("  Unknown properties (ignored): {}", String.join(", ", d.getUnknownProps()));
        }
        if (d.getTransitionObjects() > 0) {
            log.info("  Transition objects: {}", d.getTransitionObjects());
        }
    }

    private static String limited(Collection<?> values) {
        String listed = values.stream()
                .limit(MAX_LISTED)
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
        return values.size() > MAX_LISTED ? listed + ", ..." : listed;
    }
}
