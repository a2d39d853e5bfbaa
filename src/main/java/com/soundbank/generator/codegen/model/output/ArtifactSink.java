package com.soundbank.generator.codegen.model.output;

/**
 * Receives finished artifacts. Deduplication, naming and emission belong to the sink.
 */
public interface ArtifactSink {

    void publish(Artifact artifact);
}
