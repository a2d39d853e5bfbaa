package com.soundbank.generator.registry.hirc;

import java.util.List;

import com.soundbank.generator.codegen.model.output.GroupKind;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.render.RenderPass;

/**
 * Music segment: tracks played layered. Segments without tracks are silent placeholders.
 */
public class MusicSegmentObject extends HircObject {

    private List<Long> trackIds = List.of();
    private MusicSecondaries secondaries;

    @Override
    protected void parseBody(SourceNode node) {
        trackIds = List.copyOf(idList(node, "children"));
        secondaries = MusicSecondaries.parse(this, node);
    }

    @Override
    public List<Long> getChildIds() {
        return trackIds;
    }

    @Override
    protected void renderBody(RenderPass pass) {
        if (trackIds.isEmpty()) {
            pass.getArtifact().addSilence();
        } else {
            pass.renderChildren(ref, bankId(), trackIds, GroupKind.LAYERED);
        }
        secondaries.report(pass);
    }
}
