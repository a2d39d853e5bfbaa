package com.soundbank.generator.cli;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.soundbank.generator.cli.exception.OptionsValidationException;
import com.soundbank.generator.cli.model.GenerateOptions;
import com.soundbank.generator.cli.model.ValidatedGenerateOptions;
import com.soundbank.generator.cli.output.GenerateResultsPrinter;
import com.soundbank.generator.cli.validation.GenerateOptionsValidator;
import com.soundbank.generator.codegen.ArtifactGenerator;
import com.soundbank.generator.codegen.GeneratorConfig;
import com.soundbank.generator.codegen.GeneratorResult;
import com.soundbank.generator.codegen.model.core.context.GenerationFlags;
import com.soundbank.generator.codegen.writer.TemplateArtifactWriter;
import com.soundbank.generator.model.LoadedBank;
import com.soundbank.generator.parser.BankDumpParser;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command generating playable text artifacts from sound bank hierarchy dumps.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "soundbank-artifact-gen 1.0.0",
        description = "Renders every event of the given bank dumps into .txtp artifacts, one per distinct state combination."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    private static final String BASE_LOGGER = "com.soundbank.generator";

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
            printer.printBanner(options, validated);

            List<LoadedBank> banks = new BankDumpParser().parseAll(options.getBankDumps());

            GeneratorConfig config = toConfig(validated);
            TemplateArtifactWriter writer = new TemplateArtifactWriter(config.getOutputDir(), config.getFlags());
            GeneratorResult result = new ArtifactGenerator(config, banks, writer).generate();

            printer.printSuccess(validated, result, writer.getStats());
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }

    GeneratorConfig toConfig(ValidatedGenerateOptions validated) {
        GenerationFlags flags = GenerationFlags.builder()
                .generateUnused(options.isUnused())
                .bankOrder(options.isBankOrder())
                .generateRest(options.isFilterRest())
                .skipNormal(options.isSkipNormal())
                .skipUnused(options.isSkipUnused())
                .dupes(options.isDupes())
                .dryRun(options.isDryRun())
                .build();

        return GeneratorConfig.builder()
                .outputDir(validated.getNormalizedOutputDir())
                .filters(List.copyOf(options.getFilters()))
                .fixedSelectors(validated.getFixedSelectors())
                .fixedParams(validated.getFixedParams())
                .flags(flags)
                .build();
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger logger = LoggerFactory.getLogger(BASE_LOGGER);
        if (logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }
}
