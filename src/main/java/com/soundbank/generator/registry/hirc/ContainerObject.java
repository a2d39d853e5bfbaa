package com.soundbank.generator.registry.hirc;

import java.util.List;

import com.soundbank.generator.codegen.model.output.GroupKind;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.render.RenderPass;

/**
 * Container playing its children layered, randomly or in sequence. Playlists pick random
 * or sequence from their {@code mode} field (0 random, 1 sequence).
 */
public class ContainerObject extends HircObject {

    private final boolean layered;
    private GroupKind kind;
    private List<Long> childIds = List.of();

    private ContainerObject(boolean layered) {
        this.layered = layered;
    }

    public static ContainerObject layered() {
        return new ContainerObject(true);
    }

    public static ContainerObject playlist() {
        return new ContainerObject(false);
    }

    @Override
    protected void parseBody(SourceNode node) {
        childIds = List.copyOf(idList(node, "children"));
        if (layered) {
            kind = GroupKind.LAYERED;
        } else {
            kind = optionalLong(node, "mode").orElse(0) == 1 ? GroupKind.SEQUENCE : GroupKind.RANDOM;
        }
    }

    @Override
    public List<Long> getChildIds() {
        return childIds;
    }

    @Override
    protected void renderBody(RenderPass pass) {
        pass.renderChildren(ref, bankId(), childIds, kind);
    }
}
