package com.soundbank.generator.render.state;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * One state per discovered state-chunk group, tagged with its reachability under the
 * selector assignment that was active when the combos were listed.
 */
@Value
public class StateChunkCombo {

    List<StateValue> values;
    boolean reachable;

    public StateChunkCombo(List<StateValue> values, boolean reachable) {
        this.values = List.copyOf(values);
        this.reachable = reachable;
    }

    public Optional<StateValue> find(long groupId) {
        return values.stream()
                .filter(value -> value.getGroupId() == groupId)
                .findFirst();
    }

    @Override
    public String toString() {
        return values.stream().map(StateValue::toString).collect(Collectors.joining(" "));
    }
}
