package com.soundbank.generator.render.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State-chunk groups (and their states) met during a render pass.
 */
public class StateChunkPaths {

    private final Map<Long, Set<StateValue>> groups = new LinkedHashMap<>();

    public void add(long groupId, Collection<StateValue> states) {
        if (states.isEmpty()) {
            return;
        }
        groups.computeIfAbsent(groupId, key -> new LinkedHashSet<>()).addAll(states);
    }

    /**
     * Every combination of one state per group. A combination is unreachable when one of its
     * states contradicts a state selector (or fixed selector) for the same group.
     */
    public List<StateChunkCombo> getCombos(SelectorCombo selectors, Map<Long, Long> fixedSelectors) {
        if (groups.isEmpty()) {
            return List.of();
        }

        List<List<StateValue>> dimensions = new ArrayList<>();
        for (Set<StateValue> states : groups.values()) {
            dimensions.add(new ArrayList<>(states));
        }

        List<StateChunkCombo> combos = new ArrayList<>();
        for (List<StateValue> values : Combinations.cartesian(dimensions)) {
            boolean reachable = values.stream().noneMatch(value -> contradicts(value, selectors, fixedSelectors));
            combos.add(new StateChunkCombo(values, reachable));
        }
        return combos;
    }

    public void reset() {
        groups.clear();
    }

    private static boolean contradicts(StateValue value, SelectorCombo selectors, Map<Long, Long> fixedSelectors) {
        Long fixed = fixedSelectors.get(value.getGroupId());
        if (fixed != null && fixed != value.getStateId()) {
            return true;
        }
        return selectors.find(GroupType.STATE, value.getGroupId())
                .map(selected -> selected.getValueId() != value.getStateId())
                .orElse(false);
    }
}
