package com.soundbank.generator.support;

import java.util.ArrayList;
import java.util.List;

import com.soundbank.generator.model.LoadedBank;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.model.TreeNode;

/**
 * Builders for source trees shaped like parsed bank dumps.
 */
public final class Nodes {

    private Nodes() {
    }

    public static LoadedBank bank(long bankId, String filename, SourceNode... items) {
        return LoadedBank.builder()
                .bankId(bankId)
                .filename(filename)
                .items(List.of(items))
                .build();
    }

    // ---- fields ----

    public static SourceNode sid(long id) {
        return TreeNode.builder().name("ulID").type(SourceNode.TYPE_SID).value(id).build();
    }

    public static SourceNode sid(long id, String hashName) {
        return TreeNode.builder().name("ulID").type(SourceNode.TYPE_SID).value(id)
                .attr(SourceNode.ATTR_HASHNAME, hashName).build();
    }

    public static SourceNode field(String name, Object value) {
        return TreeNode.builder().name(name).value(value).build();
    }

    public static SourceNode named(String name, long value, String hashName) {
        return TreeNode.builder().name(name).type(SourceNode.TYPE_TID).value(value)
                .attr(SourceNode.ATTR_HASHNAME, hashName).build();
    }

    public static SourceNode list(String name, SourceNode... items) {
        return TreeNode.builder().name(name).children(List.of(items)).build();
    }

    public static SourceNode ids(String name, long... ids) {
        List<SourceNode> items = new ArrayList<>();
        for (long id : ids) {
            items.add(TreeNode.builder().name("id").type(SourceNode.TYPE_TID).value(id).build());
        }
        return TreeNode.builder().name(name).children(items).build();
    }

    public static SourceNode object(String type, SourceNode... fields) {
        return TreeNode.builder().name(type).children(List.of(fields)).build();
    }

    // ---- hierarchy objects ----

    public static SourceNode event(long id, String name, long... actionIds) {
        return object("CAkEvent", name != null ? sid(id, name) : sid(id), ids("actions", actionIds));
    }

    public static SourceNode play(long id, long targetId) {
        return object("CAkActionPlay", sid(id), field("idExt", targetId));
    }

    public static SourceNode play(long id, long targetId, long bankId, String bankName) {
        return object("CAkActionPlay", sid(id), field("idExt", targetId), named("bankID", bankId, bankName));
    }

    public static SourceNode sound(long id, long sourceId, SourceNode... extra) {
        List<SourceNode> fields = new ArrayList<>(List.of(sid(id), field("sourceID", sourceId)));
        fields.addAll(List.of(extra));
        return TreeNode.builder().name("CAkSound").children(fields).build();
    }

    public static SourceNode randomContainer(long id, long... children) {
        return object("CAkRanSeqCntr", sid(id), field("mode", 0L), ids("children", children));
    }

    public static SourceNode layerContainer(long id, long... children) {
        return object("CAkLayerCntr", sid(id), ids("children", children));
    }

    /**
     * @param groupType 0 switch, 1 state
     */
    public static SourceNode switchContainer(long id, long groupType, long groupId, long defaultValue,
            SourceNode... entries) {
        return object("CAkSwitchCntr", sid(id),
                field("groupType", groupType),
                field("groupID", groupId),
                field("defaultSwitch", defaultValue),
                list("switches", entries));
    }

    public static SourceNode switchEntry(long valueId, long... nodeIds) {
        return object("switch", field("switchID", valueId), ids("nodes", nodeIds));
    }

    public static SourceNode stateChunk(long groupId, SourceNode... states) {
        return list("stateChunk", object("group", field("groupID", groupId), list("states", states)));
    }

    public static SourceNode state(long stateId, double volume) {
        return object("state", field("stateID", stateId), field("volume", volume));
    }

    public static SourceNode rtpc(long paramId, double[][] points) {
        List<SourceNode> items = new ArrayList<>();
        for (double[] point : points) {
            items.add(object("point", field("x", point[0]), field("y", point[1])));
        }
        return list("rtpcs", object("rtpc", field("rtpcID", paramId),
                TreeNode.builder().name("points").children(items).build()));
    }

    public static SourceNode musicSegment(long id, long[] tracks, SourceNode... extra) {
        List<SourceNode> fields = new ArrayList<>(List.of(sid(id), ids("children", tracks)));
        fields.addAll(List.of(extra));
        return TreeNode.builder().name("CAkMusicSegment").children(fields).build();
    }

    public static SourceNode stingers(long... segmentAndTrigger) {
        List<SourceNode> items = new ArrayList<>();
        for (int i = 0; i + 1 < segmentAndTrigger.length; i += 2) {
            items.add(object("stinger", field("segmentID", segmentAndTrigger[i]), field("triggerID", segmentAndTrigger[i + 1])));
        }
        return TreeNode.builder().name("stingers").children(items).build();
    }

    public static SourceNode musicTrack(long id, long... sources) {
        return object("CAkMusicTrack", sid(id), ids("sources", sources));
    }
}
