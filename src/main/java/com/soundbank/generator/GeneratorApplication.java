package com.soundbank.generator;

import com.soundbank.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the soundbank artifact generator.
 * Reads hierarchy dumps of one or more sound banks and writes one playable text artifact
 * per distinct state combination of each event.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
