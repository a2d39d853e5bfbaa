package com.soundbank.generator.codegen;

import com.soundbank.generator.registry.RegistryDiagnostics;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a generation run.
 */
@Data
@Builder
public class GeneratorResult {

    private int banksLoaded;
    private int objectsRegistered;

    private int rootsProcessed;
    private int unusedRootsProcessed;
    private int artifactsPublished;
    private int secondaryArtifactsPublished;

    private long generationTimeMillis;

    private RegistryDiagnostics diagnostics;
}
