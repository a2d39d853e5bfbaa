package com.soundbank.generator.registry.hirc;

import java.util.List;

import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.render.RenderPass;

/**
 * Event: a list of actions run together.
 */
public class EventObject extends HircObject {

    private List<Long> actionIds = List.of();

    @Override
    protected void parseBody(SourceNode node) {
        actionIds = List.copyOf(idList(node, "actions"));
    }

    @Override
    public List<Long> getChildIds() {
        return actionIds;
    }

    @Override
    protected void renderBody(RenderPass pass) {
        for (long actionId : actionIds) {
            pass.renderRef(ref, bankId(), actionId, null);
        }
    }
}
