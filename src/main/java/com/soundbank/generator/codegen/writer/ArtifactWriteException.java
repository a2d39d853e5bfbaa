package com.soundbank.generator.codegen.writer;

/**
 * An artifact could not be rendered or written.
 */
public class ArtifactWriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ArtifactWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
