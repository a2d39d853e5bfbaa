package com.soundbank.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated output statistics for a generation run.
 */
@Value
@Builder(toBuilder = true)
public class GenerationStats {

    int written;
    int unusedWritten;
    int duplicates;
    int empty;
    int suppressed;
}
