package com.soundbank.generator.registry.hirc;

import java.util.List;

import com.soundbank.generator.codegen.model.output.GroupKind;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.render.RenderPass;

/**
 * Music track: its clips' media sources, played in sequence.
 */
public class MusicTrackObject extends HircObject {

    private List<Long> sourceIds = List.of();

    @Override
    protected void parseBody(SourceNode node) {
        sourceIds = List.copyOf(idList(node, "sources"));
    }

    public List<Long> getSourceIds() {
        return sourceIds;
    }

    @Override
    public boolean hasChildren() {
        return !sourceIds.isEmpty();
    }

    @Override
    protected void renderBody(RenderPass pass) {
        if (sourceIds.isEmpty()) {
            pass.getArtifact().addSilence();
            return;
        }
        if (sourceIds.size() == 1) {
            pass.getArtifact().addSource(sourceIds.get(0));
            return;
        }
        pass.getArtifact().openGroup(GroupKind.SEQUENCE);
        sourceIds.forEach(pass.getArtifact()::addSource);
        pass.getArtifact().closeGroup();
    }
}
