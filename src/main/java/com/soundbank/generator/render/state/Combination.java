package com.soundbank.generator.render.state;

import lombok.Value;

/**
 * Snapshot of the assignments in force when an artifact was finished.
 */
@Value
public class Combination {

    public static final Combination NONE = new Combination(SelectorCombo.EMPTY, null, null);

    SelectorCombo selectors;

    /** Applied state-chunk combo, or null. */
    StateChunkCombo stateChunk;

    /** Applied parameter combo, or null. */
    ParamCombo params;
}
