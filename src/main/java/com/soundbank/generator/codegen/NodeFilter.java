package com.soundbank.generator.codegen;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.soundbank.generator.model.SourceNode;

/**
 * Allow-list of objects to render. An entry matches an object's short id, its name
 * (case-insensitive) or its type name.
 */
public class NodeFilter {

    private final List<String> entries;
    private final boolean generateRest;

    public NodeFilter(List<String> entries, boolean generateRest) {
        this.entries = entries == null ? List.of() : entries.stream()
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .toList();
        this.generateRest = generateRest;
    }

    public boolean isActive() {
        return !entries.isEmpty();
    }

    public boolean isGenerateRest() {
        return generateRest;
    }

    /**
     * Whether a candidate root object of the regular pass is explicitly allowed.
     */
    public boolean allowOuter(SourceNode node) {
        return matches(node);
    }

    /**
     * Whether an unused object may be rendered while the filter is active.
     */
    public boolean allowUnused(SourceNode node) {
        return generateRest || matches(node);
    }

    private boolean matches(SourceNode node) {
        Optional<SourceNode> sid = node.findSid();
        String id = sid.map(s -> String.valueOf(s.longValue())).orElse(null);
        String name = sid.flatMap(SourceNode::getHashName).map(n -> n.toLowerCase(Locale.ROOT)).orElse(null);

        for (String entry : entries) {
            if (entry.equals(id) || entry.equals(node.getName())
                    || entry.toLowerCase(Locale.ROOT).equals(name)) {
                return true;
            }
        }
        return false;
    }
}
