package com.soundbank.generator.registry.hirc;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.soundbank.generator.codegen.model.output.GroupKind;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.render.RenderPass;
import com.soundbank.generator.render.state.GenerationState;
import com.soundbank.generator.render.state.GroupType;
import com.soundbank.generator.render.state.SelectorPaths;
import com.soundbank.generator.render.state.SelectorValue;

import lombok.Value;

/**
 * Plays the children assigned to the current value of a switch or state group.
 *
 * With no value assigned during a base render every value is explored, which is how
 * selector combos are discovered. Outside exploration an unassigned group falls back to the
 * default value.
 */
public class SwitchContainerObject extends HircObject {

    private GroupType groupType;
    private long groupId;
    private String groupName;
    private long defaultValue;
    private final List<SwitchEntry> entries = new ArrayList<>();

    @Value
    public static class SwitchEntry {
        long valueId;
        String valueName;
        List<Long> nodeIds;
    }

    @Override
    protected void parseBody(SourceNode node) {
        groupType = GroupType.fromCode(optionalLong(node, "groupType").orElse(0));
        SourceNode group = required(node, "groupID");
        groupId = integer(group);
        groupName = group.getHashName().orElse(null);
        defaultValue = optionalLong(node, "defaultSwitch").orElse(0);

        for (SourceNode entry : list(node, "switches")) {
            SourceNode value = required(entry, "switchID");
            entries.add(new SwitchEntry(integer(value), value.getHashName().orElse(null),
                    List.copyOf(idList(entry, "nodes"))));
        }
    }

    public GroupType getGroupType() {
        return groupType;
    }

    public long getGroupId() {
        return groupId;
    }

    @Override
    public List<Long> getChildIds() {
        Set<Long> ids = new LinkedHashSet<>();
        entries.forEach(entry -> ids.addAll(entry.getNodeIds()));
        return List.copyOf(ids);
    }

    @Override
    protected void renderBody(RenderPass pass) {
        GenerationState state = pass.getState();

        Optional<Long> selected = state.selectedValue(groupType, groupId);
        if (selected.isPresent()) {
            renderValue(pass, selected.get());
            return;
        }

        if (!state.isExploringSelectors()) {
            renderValue(pass, defaultValue);
            return;
        }

        SelectorPaths paths = state.getSelectorPaths();
        for (SwitchEntry entry : entries) {
            paths.enter(SelectorValue.of(groupType, groupId, entry.getValueId(), groupName, entry.getValueName()));
            try {
                renderEntry(pass, entry);
            } finally {
                paths.leave();
            }
        }
    }

    private void renderValue(RenderPass pass, long valueId) {
        Optional<SwitchEntry> entry = find(valueId);
        if (entry.isEmpty() && valueId != defaultValue) {
            entry = find(defaultValue);
        }
        if (entry.isEmpty()) {
            pass.getArtifact().addInfo("no children for " + describe(valueId));
            return;
        }
        renderEntry(pass, entry.get());
    }

    private void renderEntry(RenderPass pass, SwitchEntry entry) {
        pass.renderChildren(ref, bankId(), entry.getNodeIds(), GroupKind.LAYERED);
    }

    private Optional<SwitchEntry> find(long valueId) {
        return entries.stream().filter(entry -> entry.getValueId() == valueId).findFirst();
    }

    private String describe(long valueId) {
        return (groupName != null ? groupName : String.valueOf(groupId)) + "=" + valueId;
    }
}
