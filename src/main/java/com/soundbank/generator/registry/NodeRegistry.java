package com.soundbank.generator.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.soundbank.generator.model.DeclaredBank;
import com.soundbank.generator.model.NodeRef;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.registry.hirc.HircObject;
import com.soundbank.generator.registry.hirc.UnsupportedObject;

/**
 * Cross-bank registry of hierarchy objects for one generation run.
 *
 * Objects are registered per (bank, short id) during a single setup pass; after
 * {@link #seal()} the registrations are read-only and only the build cache and the
 * diagnostics keep changing. Identity is by source node instance: the same short id may be a
 * clone in another bank or a genuinely different object, so each node gets its own
 * {@link HircObject}.
 *
 * Missing, duplicate and ambiguous references are expected in loosely authored banks and are
 * recorded in {@link RegistryDiagnostics}, never thrown. Only construction contracts throw.
 */
public class NodeRegistry {
    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    private final Map<NodeRef, SourceNode> refToNode = new HashMap<>();
    private final Map<Long, List<NodeRef>> idToRefs = new HashMap<>();
    private final Map<SourceNode, NodeRef> nodeToRef = new IdentityHashMap<>();
    private final Map<String, List<SourceNode>> typeToNodes = new LinkedHashMap<>();

    private final Map<SourceNode, HircObject> built = new IdentityHashMap<>();
    private final Set<SourceNode> used = Collections.newSetFromMap(new IdentityHashMap<>());

    private final Map<Long, String> loadedBanks = new LinkedHashMap<>();
    private final RegistryDiagnostics diagnostics = new RegistryDiagnostics();

    private boolean sealed;

    // ---- setup phase ----

    public void registerBank(long bankId, String bankName) {
        checkNotSealed();
        loadedBanks.put(bankId, bankName);
    }

    /**
     * Register a hierarchy object. The first registration of a (bank, id) pair wins; repeats
     * are assumed to be clones and dropped.
     */
    public void register(long bankId, long id, SourceNode node) {
        checkNotSealed();
        Objects.requireNonNull(node, "node");

        NodeRef ref = NodeRef.of(bankId, id);
        if (refToNode.containsKey(ref)) {
            log.debug("Ignored repeated bank {} + id {}", bankId, id);
            return;
        }
        refToNode.put(ref, node);
        nodeToRef.put(node, ref);
        idToRefs.computeIfAbsent(id, key -> new ArrayList<>()).add(ref);
        typeToNodes.computeIfAbsent(node.getName(), key -> new ArrayList<>()).add(node);
    }

    /**
     * End of the setup pass. Registrations are rejected afterwards.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkNotSealed() {
        if (sealed) {
            throw new IllegalStateException("Registry is sealed; register all banks before rendering");
        }
    }

    // ---- lookups ----

    public boolean isBankLoaded(long bankId) {
        return loadedBanks.containsKey(bankId);
    }

    public Optional<String> getBankName(long bankId) {
        return Optional.ofNullable(loadedBanks.get(bankId));
    }

    public Optional<NodeRef> refOf(SourceNode node) {
        return Optional.ofNullable(nodeToRef.get(node));
    }

    /**
     * Exact (bank, id) lookup, falling back to the same id in any bank. When the fallback has
     * several candidates the first registered one wins and the id is flagged ambiguous.
     */
    public Optional<SourceNode> resolve(long bankId, long id) {
        SourceNode node = refToNode.get(NodeRef.of(bankId, id));
        if (node != null) {
            return Optional.of(node);
        }

        List<NodeRef> refs = idToRefs.get(id);
        if (refs == null || refs.isEmpty()) {
            return Optional.empty();
        }
        if (refs.size() > 1) {
            if (diagnostics.getAmbiguousIds().add(id)) {
                log.debug("Id {} found in multiple banks, not found in bank {}", id, bankId);
            }
        }
        return Optional.ofNullable(refToNode.get(refs.get(0)));
    }

    /**
     * Resolve and build a referenced object. An absent target is a valid outcome: it is
     * classified into exactly one missing bucket and an empty result is returned.
     *
     * @param bankId bank to look in (the declared bank when there is one)
     * @param id short id of the target
     * @param caller object holding the reference, for diagnostics; may be null
     * @param declared target bank declared on the reference; may be null
     */
    public Optional<HircObject> getOrBuild(long bankId, long id, NodeRef caller, DeclaredBank declared) {
        if (bankId <= 0 || id <= 0) {
            return Optional.empty();
        }

        Optional<SourceNode> node = resolve(bankId, id);
        if (node.isPresent()) {
            return Optional.of(build(node.get()));
        }

        NodeRef missing = NodeRef.of(bankId, id);
        if (diagnostics.isMissing(missing)) {
            // first classification wins, the buckets stay disjoint
            return Optional.empty();
        }
        if (declared == null) {
            if (diagnostics.getMissingInUnknownBanks().add(missing)) {
                log.debug("Missing node {} in unknown bank, called by {}", id, caller);
            }
        } else if (isBankLoaded(bankId)) {
            if (diagnostics.getMissingInLoadedBanks().add(missing)) {
                log.debug("Missing node {} in loaded bank {}, called by {}", id, loadedBanks.get(bankId), caller);
            }
        } else {
            if (diagnostics.getMissingInOtherBanks().add(missing)) {
                log.debug("Missing node {} in non-loaded bank {}, called by {}", id, declared.getDisplayName(), caller);
            }
            diagnostics.getMissingBanks().add(declared.getDisplayName());
        }
        return Optional.empty();
    }

    /**
     * Build (or fetch from cache) the object for a source node and mark it used.
     */
    public HircObject build(SourceNode node) {
        HircObject object = buildInternal(node);
        used.add(node);
        return object;
    }

    private HircObject buildInternal(SourceNode node) {
        Objects.requireNonNull(node, "node");

        HircObject cached = built.get(node);
        if (cached != null) {
            return cached;
        }

        String typeName = node.getName();
        HircObject object = HircType.fromName(typeName)
                .map(HircType::create)
                .orElseGet(UnsupportedObject::new);

        object.bind(this, nodeToRef.get(node));
        object.parse(node);

        built.put(node, object);
        return object;
    }

    public boolean isUsed(SourceNode node) {
        return used.contains(node);
    }

    // ---- unused detection ----

    public boolean hasUnused(List<String> typeNames) {
        for (String typeName : typeNames) {
            if (!listUnused(typeName).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Registered objects of a type whose built form was never requested, in registration
     * order. Peeking at an object for the silent-segment check does not mark it used.
     */
    public List<SourceNode> listUnused(String typeName) {
        List<SourceNode> results = new ArrayList<>();
        boolean ignoreEmpty = HircType.fromName(typeName).map(HircType::isIgnoredWhenEmpty).orElse(false);

        for (SourceNode node : typeToNodes.getOrDefault(typeName, List.of())) {
            if (used.contains(node)) {
                continue;
            }
            if (ignoreEmpty && !buildInternal(node).hasChildren()) {
                continue;
            }
            results.add(node);
        }
        return results;
    }

    public int getRegisteredCount() {
        return refToNode.size();
    }

    public RegistryDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
