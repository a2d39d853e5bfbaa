package com.soundbank.generator.registry.hirc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.render.state.StateValue;

import lombok.Value;

/**
 * A state group an object reacts to, with the volume each state applies.
 */
@Value
public class StateChunkGroup {

    /** Volumes at or below this are treated as muting the object. */
    public static final double SILENCE_DB = -96.0;

    long groupId;
    String groupName;
    List<ChunkState> states;

    @Value
    public static class ChunkState {
        long stateId;
        String stateName;
        double volume;

        public boolean isSilent() {
            return volume <= SILENCE_DB;
        }
    }

    public Optional<ChunkState> find(long stateId) {
        return states.stream().filter(state -> state.getStateId() == stateId).findFirst();
    }

    public List<StateValue> toStateValues() {
        return states.stream()
                .map(state -> StateValue.of(groupId, state.getStateId(), groupName, state.getStateName()))
                .toList();
    }

    static StateChunkGroup parse(HircObject owner, SourceNode group) {
        SourceNode groupField = owner.required(group, "groupID");
        List<ChunkState> states = new ArrayList<>();
        for (SourceNode state : owner.list(group, "states")) {
            SourceNode stateField = owner.required(state, "stateID");
            double volume = state.findChild("volume").map(owner::number).orElse(0.0);
            states.add(new ChunkState(owner.integer(stateField), stateField.getHashName().orElse(null), volume));
        }
        return new StateChunkGroup(owner.integer(groupField), groupField.getHashName().orElse(null), List.copyOf(states));
    }
}
