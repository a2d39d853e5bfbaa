package com.soundbank.generator.codegen;

/**
 * Failure while generating the artifacts of one root object. Aborts the run.
 */
public class ArtifactGenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long objectId;
    private final String bankName;

    public ArtifactGenerationException(long objectId, String bankName, Throwable cause) {
        super("Failed to generate object " + objectId + " in " + bankName + ": " + cause.getMessage(), cause);
        this.objectId = objectId;
        this.bankName = bankName;
    }

    public long getObjectId() {
        return objectId;
    }

    public String getBankName() {
        return bankName;
    }
}
