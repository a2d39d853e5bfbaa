package com.soundbank.generator.render.state;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.Value;

/**
 * A full selector assignment applied for one render pass.
 */
@Value
public class SelectorCombo {

    public static final SelectorCombo EMPTY = new SelectorCombo(List.of());

    @NonNull
    List<SelectorValue> values;

    public SelectorCombo(List<SelectorValue> values) {
        this.values = List.copyOf(values);
    }

    public Optional<SelectorValue> find(GroupType type, long groupId) {
        return values.stream()
                .filter(value -> value.sameGroup(type, groupId))
                .findFirst();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return values.stream().map(SelectorValue::toString).collect(Collectors.joining(" "));
    }
}
