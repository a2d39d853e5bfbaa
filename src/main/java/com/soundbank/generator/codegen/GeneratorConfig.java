package com.soundbank.generator.codegen;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.soundbank.generator.codegen.model.core.context.GenerationFlags;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the artifact generator.
 */
@Data
@Builder
public class GeneratorConfig {

    /**
     * Directory receiving the generated artifacts.
     */
    private Path outputDir;

    /**
     * Objects to render first (short id, name or type name). Empty means no filter.
     */
    @Builder.Default
    private List<String> filters = List.of();

    /**
     * Selector group id to value id, applied to every render instead of branching.
     */
    @Builder.Default
    private Map<Long, Long> fixedSelectors = Map.of();

    /**
     * Parameter id to value, applied to every render instead of branching.
     */
    @Builder.Default
    private Map<Long, Double> fixedParams = Map.of();

    @Builder.Default
    private GenerationFlags flags = GenerationFlags.builder().build();
}
