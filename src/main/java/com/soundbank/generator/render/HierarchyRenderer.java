package com.soundbank.generator.render;

import java.util.Objects;
import java.util.Optional;

import com.soundbank.generator.codegen.model.output.Artifact;
import com.soundbank.generator.model.NodeRef;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.registry.NodeRegistry;
import com.soundbank.generator.registry.hirc.HircObject;
import com.soundbank.generator.render.state.GenerationState;
import com.soundbank.generator.render.state.SecondaryObject;

/**
 * Renders hierarchy objects built by the registry.
 */
public class HierarchyRenderer implements Renderer {

    private final NodeRegistry registry;

    public HierarchyRenderer(NodeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void begin(Artifact artifact, SourceNode root, GenerationState state) {
        HircObject object = registry.build(root);
        artifact.setRoot(object.getRef(), object.getDisplayName());
        new RenderPass(registry, state, artifact).renderObject(object);
    }

    @Override
    public void beginSecondary(Artifact artifact, SecondaryObject secondary, GenerationState state) {
        NodeRef target = secondary.getTarget();
        Optional<HircObject> object = registry.getOrBuild(target.getBankId(), target.getId(), secondary.getOwner(), null);
        if (object.isEmpty()) {
            return;
        }
        artifact.setRoot(object.get().getRef(), object.get().getDisplayName());
        new RenderPass(registry, state, artifact).renderObject(object.get());
    }
}
