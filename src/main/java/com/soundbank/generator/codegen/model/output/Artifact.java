package com.soundbank.generator.codegen.model.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.soundbank.generator.model.NodeRef;
import com.soundbank.generator.render.state.Combination;
import com.soundbank.generator.render.state.SecondaryObject;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * Output accumulator for one state combination: the rendered structure, informational
 * notes, and the tags the sink needs to name and file it.
 */
@Getter
public class Artifact {

    private static final String INDENT = "  ";

    private final List<String> lines = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private int depth;
    private int sourceCount;
    private boolean silent;

    private NodeRef rootRef;
    private String rootName;

    @Setter
    private Combination combination = Combination.NONE;
    @Setter
    private NodeRef caller;
    @Setter
    private String callerName;
    @Setter
    private SecondaryObject secondary;
    @Setter
    private boolean defaultStateChunk;
    @Setter
    private boolean unused;
    @Setter
    private boolean suppressed;

    public void setRoot(NodeRef ref, String name) {
        this.rootRef = ref;
        this.rootName = name;
    }

    // ---- structure ----

    public void openGroup(GroupKind kind) {
        line(kind.getKeyword() + " {");
        depth++;
    }

    public void closeGroup() {
        if (depth == 0) {
            throw new IllegalStateException("closeGroup() without open group");
        }
        depth--;
        line("}");
    }

    public void addSource(long mediaId) {
        line(mediaId + ".wem");
        sourceCount++;
    }

    public void addSilence() {
        line("silence");
        silent = true;
    }

    public void addVolume(double db) {
        line("volume " + db);
    }

    // ---- notes ----

    public void addInfo(String info) {
        infos.add(info);
    }

    public void addMissing(NodeRef ref) {
        infos.add("missing " + ref);
    }

    private void line(String text) {
        lines.add(INDENT.repeat(depth) + text);
    }

    public List<String> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public List<String> getInfos() {
        return Collections.unmodifiableList(infos);
    }

    public boolean isEmpty() {
        return sourceCount == 0 && !silent;
    }

    /**
     * Name built from the root object and the combination, e.g.
     * {@code play_bgm (bgm=m01) {s}=(layer=hi) {rank=2.0}}.
     */
    public String getDisplayName() {
        StringBuilder sb = new StringBuilder();
        if (secondary != null && callerName != null) {
            sb.append(callerName).append(" [").append(secondary).append("]");
        } else {
            sb.append(rootName != null ? rootName : "?");
        }

        if (!combination.getSelectors().isEmpty()) {
            sb.append(" (").append(combination.getSelectors()).append(")");
        }
        if (combination.getStateChunk() != null) {
            sb.append(" {s}=(").append(combination.getStateChunk()).append(")");
        } else if (defaultStateChunk) {
            sb.append(" {s}=-");
        }
        if (combination.getParams() != null) {
            sb.append(" {").append(combination.getParams()).append("}");
        }
        if (unused) {
            sb.append(" {unused}");
        }
        return sb.toString();
    }
}
