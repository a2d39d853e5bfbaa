package com.soundbank.generator.render;

import com.soundbank.generator.codegen.model.output.Artifact;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.render.state.GenerationState;
import com.soundbank.generator.render.state.SecondaryObject;

/**
 * One render pass over an object tree. Writes structure into the artifact and, as a side
 * effect, records in the state the combos and secondary objects it meets.
 */
public interface Renderer {

    void begin(Artifact artifact, SourceNode root, GenerationState state);

    void beginSecondary(Artifact artifact, SecondaryObject secondary, GenerationState state);
}
