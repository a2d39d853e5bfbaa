package com.soundbank.generator.render;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.soundbank.generator.codegen.model.output.Artifact;
import com.soundbank.generator.codegen.model.output.GroupKind;
import com.soundbank.generator.model.DeclaredBank;
import com.soundbank.generator.model.NodeRef;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.registry.NodeRegistry;
import com.soundbank.generator.registry.hirc.HircObject;
import com.soundbank.generator.registry.hirc.RtpcBinding;
import com.soundbank.generator.registry.hirc.StateChunkGroup;
import com.soundbank.generator.render.state.GenerationState;
import com.soundbank.generator.render.state.SecondaryObject;
import com.soundbank.generator.render.state.StateValue;

import lombok.Getter;

/**
 * Context of a single render pass, handed to every {@link HircObject} it reaches.
 */
@Getter
public class RenderPass {
    private static final Logger log = LoggerFactory.getLogger(RenderPass.class);

    private final NodeRegistry registry;
    private final GenerationState state;
    private final Artifact artifact;

    @Getter(lombok.AccessLevel.NONE)
    private final Set<HircObject> active = Collections.newSetFromMap(new IdentityHashMap<>());

    public RenderPass(NodeRegistry registry, GenerationState state, Artifact artifact) {
        this.registry = registry;
        this.state = state;
        this.artifact = artifact;
    }

    public void renderObject(HircObject object) {
        if (!active.add(object)) {
            log.debug("Loop detected at {}", object);
            artifact.addInfo("loop at " + object.getRef());
            return;
        }
        try {
            object.render(this);
        } finally {
            active.remove(object);
        }
    }

    public void renderRef(NodeRef caller, long bankId, long id, DeclaredBank declared) {
        Optional<HircObject> target = registry.getOrBuild(bankId, id, caller, declared);
        if (target.isPresent()) {
            renderObject(target.get());
        } else if (bankId > 0 && id > 0) {
            artifact.addMissing(NodeRef.of(bankId, id));
        }
    }

    /**
     * Render children in a group of the given kind; a single child needs no group.
     */
    public void renderChildren(NodeRef caller, long bankId, List<Long> ids, GroupKind kind) {
        if (ids.isEmpty()) {
            return;
        }
        if (ids.size() == 1) {
            renderRef(caller, bankId, ids.get(0), null);
            return;
        }
        artifact.openGroup(kind);
        for (long id : ids) {
            renderRef(caller, bankId, id, null);
        }
        artifact.closeGroup();
    }

    /**
     * Record the groups for discovery and apply the current states.
     *
     * @return true when a current state mutes the object
     */
    public boolean applyStateChunks(List<StateChunkGroup> groups) {
        boolean muted = false;
        for (StateChunkGroup group : groups) {
            state.discoverStateChunk(group.getGroupId(), group.toStateValues());

            Optional<StateValue> current = state.currentState(group.getGroupId());
            if (current.isEmpty()) {
                continue;
            }
            Optional<StateChunkGroup.ChunkState> chunkState = group.find(current.get().getStateId());
            if (chunkState.isEmpty()) {
                continue;
            }
            if (chunkState.get().isSilent()) {
                muted = true;
            } else if (chunkState.get().getVolume() != 0) {
                artifact.addVolume(chunkState.get().getVolume());
            }
        }
        return muted;
    }

    public void applyRtpcs(List<RtpcBinding> rtpcs) {
        for (RtpcBinding rtpc : rtpcs) {
            state.discoverParam(rtpc.getParamId(), rtpc.toParamValues());

            Optional<Double> current = state.currentParam(rtpc.getParamId());
            if (current.isPresent()) {
                double volume = rtpc.volumeAt(current.get());
                if (volume != 0) {
                    artifact.addVolume(volume);
                }
            }
        }
    }

    /**
     * Report a secondary object. The target is built right away so it does not show up as
     * unused, but it is not rendered here.
     */
    public void addSecondary(SecondaryObject secondary) {
        NodeRef target = secondary.getTarget();
        Optional<SourceNode> node = registry.resolve(target.getBankId(), target.getId());
        if (node.isEmpty()) {
            log.debug("Secondary target {} not found", target);
            return;
        }
        registry.build(node.get());
        state.discoverSecondary(secondary);
    }
}
