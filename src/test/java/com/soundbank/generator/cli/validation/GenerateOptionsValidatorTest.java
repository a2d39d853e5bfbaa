package com.soundbank.generator.cli.validation;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.soundbank.generator.cli.exception.OptionsValidationException;
import com.soundbank.generator.cli.model.GenerateOptions;
import com.soundbank.generator.cli.model.ValidatedGenerateOptions;

import picocli.CommandLine;

/**
 * Tests for GenerateOptionsValidator.
 */
class GenerateOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private Path dump;
    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    @BeforeEach
    void setUp() throws IOException {
        dump = Files.writeString(tempDir.resolve("init.json"), "{ \"bankId\": 1 }");
    }

    @Test
    void testValidOptionsAreNormalized() {
        ValidatedGenerateOptions validated = validator.validate(options(
                dump.toString(), "-o", tempDir.resolve("out/../txtp").toString(),
                "-s", "5=2", "--selector", "7 = 11", "-p", "3=0.5"));

        assertThat(validated.getNormalizedOutputDir()).isEqualTo(tempDir.resolve("txtp").toAbsolutePath());
        assertThat(validated.getFixedSelectors()).containsEntry(5L, 2L).containsEntry(7L, 11L);
        assertThat(validated.getFixedParams()).containsEntry(3L, 0.5);
    }

    @Test
    void testDefaultOutputDir() {
        ValidatedGenerateOptions validated = validator.validate(options(dump.toString()));

        assertThat(validated.getNormalizedOutputDir())
                .isEqualTo(Path.of(GenerateOptionsValidator.DEFAULT_OUTPUT_DIR).toAbsolutePath().normalize());
        assertThat(validated.getFixedSelectors()).isEmpty();
    }

    @Test
    void testCollectsAllErrors() {
        OptionsValidationException e = catchThrowableOfType(() -> validator.validate(options(
                tempDir.resolve("missing.json").toString(),
                "--filter-rest", "--skip-unused",
                "-s", "5", "-s", "x=1", "-p", "3=1", "-p", "3=2")),
                OptionsValidationException.class);

        assertThat(e.getErrors()).containsExactly(
                "Bank dump does not exist or is not a file: " + tempDir.resolve("missing.json"),
                "--filter-rest requires at least one --filter.",
                "--skip-unused requires --unused.",
                "--selector must be KEY=VALUE. Got: 5",
                "--selector has a non-numeric id or value: x=1",
                "--param given twice for 3");
    }

    @Test
    void testOutputPathMustNotBeAFile() {
        assertThatThrownBy(() -> validator.validate(options(dump.toString(), "-o", dump.toString())))
                .isInstanceOf(OptionsValidationException.class);
    }

    @Test
    void testFilterRestWithFilterIsAccepted() {
        assertThatCode(() -> validator.validate(options(dump.toString(), "-f", "play_bgm", "--filter-rest",
                "-u", "--skip-unused"))).doesNotThrowAnyException();
    }

    private static GenerateOptions options(String... args) {
        return CommandLine.populateCommand(new GenerateOptions(), args);
    }
}
