package com.soundbank.generator.registry.hirc;

import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.render.RenderPass;

/**
 * Leaf object playing one media source.
 */
public class SoundObject extends HircObject {

    private long sourceId;

    @Override
    protected void parseBody(SourceNode node) {
        sourceId = requiredLong(node, "sourceID");
    }

    public long getSourceId() {
        return sourceId;
    }

    @Override
    public boolean hasChildren() {
        return true;
    }

    @Override
    protected void renderBody(RenderPass pass) {
        pass.getArtifact().addSource(sourceId);
    }
}
