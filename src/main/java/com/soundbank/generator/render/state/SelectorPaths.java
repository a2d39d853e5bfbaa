package com.soundbank.generator.render.state;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Value;

/**
 * Selector combinations discovered while exploring every branch of a base render.
 *
 * Exploration builds a tree: each node lists the selector groups met at that point, and each
 * group value leads to the node holding whatever is only reachable through that value.
 * Groups met side by side combine as a cartesian product; a group met under a value only
 * combines with that value.
 */
public class SelectorPaths {

    private PathNode root = new PathNode();
    private final Deque<PathNode> nodes = new ArrayDeque<>();
    private final Deque<SelectorValue> trail = new ArrayDeque<>();

    public SelectorPaths() {
        nodes.push(root);
    }

    /**
     * Enter the branch selected by {@code value}; must be paired with {@link #leave()}.
     */
    public void enter(SelectorValue value) {
        PathNode next = nodes.peek().branch(value);
        nodes.push(next);
        trail.addLast(value);
    }

    public void leave() {
        if (trail.isEmpty()) {
            throw new IllegalStateException("leave() without matching enter()");
        }
        nodes.pop();
        trail.removeLast();
    }

    /**
     * Value chosen for the group by the branch currently being explored, if any.
     */
    public Optional<SelectorValue> findInTrail(GroupType type, long groupId) {
        for (SelectorValue value : trail) {
            if (value.sameGroup(type, groupId)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return root.groups.isEmpty();
    }

    public List<SelectorCombo> getCombos() {
        if (isEmpty()) {
            return List.of();
        }
        Set<SelectorCombo> combos = new LinkedHashSet<>();
        for (List<SelectorValue> values : expand(root)) {
            combos.add(new SelectorCombo(values));
        }
        return List.copyOf(combos);
    }

    public void reset() {
        root = new PathNode();
        nodes.clear();
        nodes.push(root);
        trail.clear();
    }

    private List<List<SelectorValue>> expand(PathNode node) {
        if (node.groups.isEmpty()) {
            return List.of(List.of());
        }

        List<List<List<SelectorValue>>> perGroup = new ArrayList<>();
        for (Map<SelectorValue, PathNode> values : node.groups.values()) {
            List<List<SelectorValue>> options = new ArrayList<>();
            for (Map.Entry<SelectorValue, PathNode> entry : values.entrySet()) {
                for (List<SelectorValue> nested : expand(entry.getValue())) {
                    List<SelectorValue> option = new ArrayList<>();
                    option.add(entry.getKey());
                    option.addAll(nested);
                    options.add(option);
                }
            }
            perGroup.add(options);
        }

        List<List<SelectorValue>> result = new ArrayList<>();
        for (List<List<SelectorValue>> choice : Combinations.cartesian(perGroup)) {
            List<SelectorValue> flat = new ArrayList<>();
            choice.forEach(flat::addAll);
            result.add(flat);
        }
        return result;
    }

    @Value
    private static class GroupKey {
        GroupType type;
        long groupId;
    }

    private static class PathNode {
        private final Map<GroupKey, Map<SelectorValue, PathNode>> groups = new LinkedHashMap<>();

        PathNode branch(SelectorValue value) {
            return groups
                    .computeIfAbsent(new GroupKey(value.getType(), value.getGroupId()), key -> new LinkedHashMap<>())
                    .computeIfAbsent(value, key -> new PathNode());
        }
    }
}
