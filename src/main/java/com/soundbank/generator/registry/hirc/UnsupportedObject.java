package com.soundbank.generator.registry.hirc;

import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.render.RenderPass;

/**
 * Any hierarchy type without a construction contract. Renders nothing.
 */
public class UnsupportedObject extends HircObject {

    @Override
    protected void parseBody(SourceNode node) {
        if (registry != null) {
            registry.getDiagnostics().getUnsupportedTypes().add(node.getName());
        }
    }

    @Override
    protected void renderBody(RenderPass pass) {
        pass.getArtifact().addInfo("unsupported " + node.getName() + " " + getDisplayName());
    }
}
