package com.soundbank.generator.registry.hirc;

import java.util.List;

import com.soundbank.generator.model.DeclaredBank;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.render.RenderPass;

/**
 * Play action. The target may live in another bank, declared through {@code bankID}.
 */
public class ActionPlayObject extends HircObject {

    private long targetId;
    private DeclaredBank declaredBank;

    @Override
    protected void parseBody(SourceNode node) {
        targetId = requiredLong(node, "idExt");
        declaredBank = node.findChild("bankID").map(DeclaredBank::from).orElse(null);
    }

    @Override
    public List<Long> getChildIds() {
        return List.of(targetId);
    }

    @Override
    protected void renderBody(RenderPass pass) {
        long targetBank = declaredBank != null ? declaredBank.getBankId() : bankId();
        pass.renderRef(ref, targetBank, targetId, declaredBank);
    }
}
