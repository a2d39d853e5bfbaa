package com.soundbank.generator.registry.hirc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import com.soundbank.generator.model.NodeRef;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.registry.MalformedNodeException;
import com.soundbank.generator.registry.NodeRegistry;
import com.soundbank.generator.render.RenderPass;

/**
 * Rebuilt form of one hierarchy object, made by {@link NodeRegistry#build(SourceNode)}.
 *
 * Construction is two-phase: {@link #bind(NodeRegistry, NodeRef)} then
 * {@link #parse(SourceNode)}. Parsing reads the fields every object may carry
 * ({@code stateChunk}, {@code rtpcs}, {@code props}) and then the type-specific ones.
 * Children are resolved lazily while rendering, never while parsing.
 *
 * Subclasses throw {@link MalformedNodeException} for data they cannot interpret.
 */
public abstract class HircObject {

    private static final Set<String> KNOWN_PROPS = Set.of(
            "Volume", "Pitch", "LPF", "HPF", "MakeUpGain", "Priority", "InitialDelay", "BusVolume");

    protected NodeRegistry registry;
    protected NodeRef ref;
    protected SourceNode node;

    private String displayName;
    private double volume;
    private final List<StateChunkGroup> stateChunks = new ArrayList<>();
    private final List<RtpcBinding> rtpcs = new ArrayList<>();

    public final void bind(NodeRegistry registry, NodeRef ref) {
        this.registry = registry;
        this.ref = ref;
    }

    public final void parse(SourceNode node) {
        this.node = node;
        Optional<SourceNode> sid = node.findSid();
        this.displayName = sid.flatMap(SourceNode::getHashName)
                .orElseGet(() -> sid.map(s -> String.valueOf(s.longValue())).orElse(node.getName()));

        parseProps(node);
        for (SourceNode group : list(node, "stateChunk")) {
            stateChunks.add(StateChunkGroup.parse(this, group));
        }
        for (SourceNode rtpc : list(node, "rtpcs")) {
            rtpcs.add(RtpcBinding.parse(this, rtpc));
        }
        parseBody(node);
    }

    protected abstract void parseBody(SourceNode node);

    /**
     * Ids of the objects this one may play; used to tell silent objects apart.
     */
    public List<Long> getChildIds() {
        return List.of();
    }

    public boolean hasChildren() {
        return !getChildIds().isEmpty();
    }

    public final void render(RenderPass pass) {
        if (pass.applyStateChunks(stateChunks)) {
            pass.getArtifact().addSilence();
            return;
        }
        pass.applyRtpcs(rtpcs);
        if (volume != 0) {
            pass.getArtifact().addVolume(volume);
        }
        renderBody(pass);
    }

    protected abstract void renderBody(RenderPass pass);

    public NodeRef getRef() {
        return ref;
    }

    public SourceNode getNode() {
        return node;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Bank the object was registered in; references without a declared bank look here first.
     */
    protected long bankId() {
        return ref != null ? ref.getBankId() : 0;
    }

    private void parseProps(SourceNode node) {
        List<String> unknown = new ArrayList<>();
        for (SourceNode prop : list(node, "props")) {
            String name = prop.getName();
            if (!KNOWN_PROPS.contains(name)) {
                unknown.add(name);
            } else if ("Volume".equals(name)) {
                volume = number(prop);
            }
        }
        if (!unknown.isEmpty() && registry != null) {
            registry.getDiagnostics().reportUnknownProps(unknown);
        }
    }

    // ---- field helpers ----

    protected SourceNode required(SourceNode parent, String name) {
        return parent.findChild(name)
                .orElseThrow(() -> new MalformedNodeException(ref,
                        "Missing field '" + name + "' in " + parent.getName()));
    }

    protected long requiredLong(SourceNode parent, String name) {
        return integer(required(parent, name));
    }

    protected OptionalLong optionalLong(SourceNode parent, String name) {
        Optional<SourceNode> field = parent.findChild(name);
        return field.isPresent() ? OptionalLong.of(integer(field.get())) : OptionalLong.empty();
    }

    protected List<SourceNode> list(SourceNode parent, String listName) {
        return parent.findChild(listName).map(SourceNode::getChildren).orElse(List.of());
    }

    protected List<Long> idList(SourceNode parent, String listName) {
        List<Long> ids = new ArrayList<>();
        for (SourceNode item : list(parent, listName)) {
            ids.add(integer(item));
        }
        return ids;
    }

    long integer(SourceNode field) {
        try {
            return field.longValue();
        } catch (IllegalStateException e) {
            throw new MalformedNodeException(ref, e.getMessage(), e);
        }
    }

    double number(SourceNode field) {
        try {
            return field.doubleValue();
        } catch (IllegalStateException e) {
            throw new MalformedNodeException(ref, e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + ref + " " + displayName + "]";
    }
}
