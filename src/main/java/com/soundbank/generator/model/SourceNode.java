package com.soundbank.generator.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * One node of a parsed bank tree. Top-level nodes are hierarchy objects (their name is the
 * type name, e.g. {@code CAkSound}); nested nodes are fields and lists of fields.
 *
 * Implementations are immutable. Identity matters: two structurally equal nodes loaded from
 * different banks are distinct objects.
 */
public interface SourceNode {

    String TYPE_SID = "sid";
    String TYPE_TID = "tid";
    String TYPE_BANK = "bank";
    String ATTR_HASHNAME = "hashname";

    /**
     * Object type name for hierarchy objects, field name for everything else.
     */
    String getName();

    /**
     * Field type tag ({@code sid}, {@code tid}, {@code bank}, ...), or null for plain nodes.
     */
    String getType();

    /**
     * Scalar value of a field node, or null.
     */
    Object getValue();

    Optional<String> getAttr(String key);

    List<SourceNode> getChildren();

    default Optional<SourceNode> findChild(String name) {
        for (SourceNode child : getChildren()) {
            if (name.equals(child.getName())) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * Depth-first search (this node excluded) for the first node with the given type tag.
     */
    default Optional<SourceNode> findFirst(String type) {
        Deque<SourceNode> pending = new ArrayDeque<>(getChildren());
        while (!pending.isEmpty()) {
            SourceNode current = pending.pollFirst();
            if (type.equals(current.getType())) {
                return Optional.of(current);
            }
            List<SourceNode> children = current.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.addFirst(children.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * The self-identifying sub-node carrying the short id and optional display name.
     */
    default Optional<SourceNode> findSid() {
        return findFirst(TYPE_SID);
    }

    default Optional<String> getHashName() {
        return getAttr(ATTR_HASHNAME).filter(name -> !name.isBlank());
    }

    default long longValue() {
        Object value = getValue();
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Field " + getName() + " is not numeric: " + text, e);
            }
        }
        throw new IllegalStateException("Field " + getName() + " has no numeric value");
    }

    default double doubleValue() {
        Object value = getValue();
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Field " + getName() + " is not numeric: " + text, e);
            }
        }
        throw new IllegalStateException("Field " + getName() + " has no numeric value");
    }
}
