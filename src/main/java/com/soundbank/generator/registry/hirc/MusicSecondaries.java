package com.soundbank.generator.registry.hirc;

import java.util.ArrayList;
import java.util.List;

import com.soundbank.generator.model.NodeRef;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.render.RenderPass;
import com.soundbank.generator.render.state.SecondaryObject;

/**
 * Stinger and transition segments declared on a music object. They never play as part of
 * the owner; rendering the owner only reports them as secondary objects.
 */
final class MusicSecondaries {

    private final List<SecondaryObject> items = new ArrayList<>();
    private int transitionCount;

    static MusicSecondaries parse(HircObject owner, SourceNode node) {
        MusicSecondaries result = new MusicSecondaries();
        long bankId = owner.bankId();

        for (SourceNode stinger : owner.list(node, "stingers")) {
            long segmentId = owner.requiredLong(stinger, "segmentID");
            long triggerId = owner.optionalLong(stinger, "triggerID").orElse(0);
            if (segmentId > 0) {
                result.items.add(SecondaryObject.stinger(NodeRef.of(bankId, segmentId), triggerId, owner.getRef()));
            }
        }
        for (SourceNode transition : owner.list(node, "transitions")) {
            long segmentId = owner.requiredLong(transition, "segmentID");
            if (segmentId > 0) {
                result.items.add(SecondaryObject.transition(NodeRef.of(bankId, segmentId), owner.getRef()));
                result.transitionCount++;
            }
        }
        return result;
    }

    int getTransitionCount() {
        return transitionCount;
    }

    void report(RenderPass pass) {
        items.forEach(pass::addSecondary);
    }
}
