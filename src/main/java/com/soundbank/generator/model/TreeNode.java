package com.soundbank.generator.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable {@link SourceNode} built by the dump parser (and by tests).
 *
 * Equality is deliberately left to object identity: the registry keys its caches by node
 * instance, and two equal-looking objects from different banks must stay apart.
 */
@Value
@Builder(toBuilder = true)
public class TreeNode implements SourceNode {

    @NonNull
    String name;

    String type;

    Object value;

    @Singular
    Map<String, String> attrs;

    @Singular
    List<SourceNode> children;

    @Override
    public Optional<String> getAttr(String key) {
        return Optional.ofNullable(attrs.get(key));
    }

    @Override
    public boolean equals(Object other) {
        return this == other;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return type == null ? name : name + "(" + type + "=" + value + ")";
    }
}
