package com.soundbank.generator.registry.hirc;

import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.render.RenderPass;

/**
 * Music switch: a switch container whose transition and stinger segments are published as
 * secondary artifacts.
 */
public class MusicSwitchObject extends SwitchContainerObject {

    private MusicSecondaries secondaries;

    @Override
    protected void parseBody(SourceNode node) {
        super.parseBody(node);
        secondaries = MusicSecondaries.parse(this, node);
        for (int i = 0; i < secondaries.getTransitionCount(); i++) {
            registry.getDiagnostics().reportTransitionObject();
        }
    }

    @Override
    protected void renderBody(RenderPass pass) {
        super.renderBody(pass);
        secondaries.report(pass);
    }
}
