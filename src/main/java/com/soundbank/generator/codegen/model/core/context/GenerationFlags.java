package com.soundbank.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Boolean switches that influence generation behavior.
 */
@Value
@Builder(toBuilder = true)
public class GenerationFlags {

    /** Render objects nothing referenced, after the regular pass. */
    boolean generateUnused;

    /** Keep declaration order instead of putting named objects first. */
    boolean bankOrder;

    /** With a filter active, still render non-matching objects after the matching ones. */
    boolean generateRest;

    /** Render the regular pass without writing it (its artifacts still count as seen). */
    boolean skipNormal;

    /** Render the unused pass without writing it. */
    boolean skipUnused;

    /** Write artifacts even when an identical one was already written. */
    boolean dupes;

    /** Do everything except writing files. */
    boolean dryRun;
}
