package com.soundbank.generator.parser;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when a bank dump cannot be read or does not have the expected shape.
 */
public class BankLoadException extends IOException {

    private static final long serialVersionUID = 1L;

    private final Path source;

    public BankLoadException(Path source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public BankLoadException(Path source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
