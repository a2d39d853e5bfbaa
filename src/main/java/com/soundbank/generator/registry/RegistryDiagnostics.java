package com.soundbank.generator.registry;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import com.soundbank.generator.model.NodeRef;

import lombok.Getter;

/**
 * Data-quality findings accumulated over a run. Nothing here aborts generation.
 *
 * Pure structure only: no logging, no formatting.
 */
@Getter
public class RegistryDiagnostics {

    /** Target bank is loaded but the id is absent (stale authoring leftovers). */
    private final Set<NodeRef> missingInLoadedBanks = new LinkedHashSet<>();

    /** Target bank is known but was not loaded. */
    private final Set<NodeRef> missingInOtherBanks = new LinkedHashSet<>();

    /** No target bank could be identified. */
    private final Set<NodeRef> missingInUnknownBanks = new LinkedHashSet<>();

    private final SortedSet<String> missingBanks = new TreeSet<>();

    /** Ids resolved through the any-bank fallback while present in several banks. */
    private final Set<Long> ambiguousIds = new LinkedHashSet<>();

    private final SortedSet<String> unknownProps = new TreeSet<>();

    private final SortedSet<String> unsupportedTypes = new TreeSet<>();

    private int transitionObjects;

    public void reportUnknownProps(Collection<String> names) {
        unknownProps.addAll(names);
    }

    public void reportTransitionObject() {
        transitionObjects++;
    }

    /**
     * True when the reference already sits in one of the missing buckets.
     */
    public boolean isMissing(NodeRef ref) {
        return missingInLoadedBanks.contains(ref) || missingInOtherBanks.contains(ref)
                || missingInUnknownBanks.contains(ref);
    }

    public int getMissingCount() {
        return missingInLoadedBanks.size() + missingInOtherBanks.size() + missingInUnknownBanks.size();
    }

    public boolean hasFindings() {
        return getMissingCount() > 0 || !ambiguousIds.isEmpty() || !unknownProps.isEmpty()
                || !unsupportedTypes.isEmpty();
    }
}
