package com.soundbank.generator.render.state;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import lombok.Getter;

/**
 * Scratch state for one root object: the assignments applied for the current render pass,
 * and what that pass discovered for each of the three nested dimensions plus secondary
 * objects.
 *
 * Single-threaded and owned by one traversal. Resets follow the nesting: applying a selector
 * combo requires {@link #resetStateChunks()} and {@link #resetParams()}, applying a
 * state-chunk combo requires {@link #resetParams()}.
 */
public class GenerationState {

    private final Map<Long, Long> fixedSelectors;
    private final Map<Long, Double> fixedParams;

    @Getter
    private SelectorCombo selectors = SelectorCombo.EMPTY;
    private boolean selectorsApplied;
    @Getter
    private final SelectorPaths selectorPaths = new SelectorPaths();

    private StateChunkCombo stateChunk;
    private final StateChunkPaths stateChunkPaths = new StateChunkPaths();

    private ParamCombo params;
    private final ParamPaths paramPaths = new ParamPaths();

    private final SecondaryObjects secondaryObjects = new SecondaryObjects();

    public GenerationState() {
        this(Map.of(), Map.of());
    }

    /**
     * @param fixedSelectors selector group id to value id, never branched on
     * @param fixedParams parameter id to value, never branched on
     */
    public GenerationState(Map<Long, Long> fixedSelectors, Map<Long, Double> fixedParams) {
        this.fixedSelectors = Map.copyOf(Objects.requireNonNull(fixedSelectors, "fixedSelectors"));
        this.fixedParams = Map.copyOf(Objects.requireNonNull(fixedParams, "fixedParams"));
    }

    // ---- resets ----

    /**
     * Start over for a new root object.
     */
    public void reset() {
        selectors = SelectorCombo.EMPTY;
        selectorsApplied = false;
        selectorPaths.reset();
        resetStateChunks();
        secondaryObjects.clear();
    }

    public void resetStateChunks() {
        stateChunk = null;
        stateChunkPaths.reset();
        resetParams();
    }

    public void resetParams() {
        params = null;
        paramPaths.reset();
    }

    // ---- engine side ----

    public List<SelectorCombo> getSelectorCombos() {
        return selectorPaths.getCombos();
    }

    public void applySelectors(SelectorCombo combo) {
        selectors = Objects.requireNonNull(combo, "combo");
        selectorsApplied = true;
    }

    public List<StateChunkCombo> getStateChunkCombos() {
        return stateChunkPaths.getCombos(selectors, fixedSelectors);
    }

    public boolean hasUnreachableStateChunks() {
        return getStateChunkCombos().stream().anyMatch(combo -> !combo.isReachable());
    }

    /**
     * A state-chunk-free artifact is needed when nothing reachable would be emitted for the
     * current selector assignment.
     */
    public boolean needsDefaultStateChunk(List<StateChunkCombo> combos) {
        return !combos.isEmpty() && combos.stream().noneMatch(StateChunkCombo::isReachable);
    }

    /**
     * @param combo combo to apply, or null to clear
     */
    public void applyStateChunk(StateChunkCombo combo) {
        stateChunk = combo;
    }

    public List<ParamCombo> getParamCombos() {
        return paramPaths.getCombos();
    }

    public void applyParams(ParamCombo combo) {
        params = Objects.requireNonNull(combo, "combo");
    }

    public List<SecondaryObject> getSecondaryObjects() {
        return secondaryObjects.getItems();
    }

    public Combination snapshot() {
        return new Combination(selectors, stateChunk, params);
    }

    // ---- renderer side ----

    /**
     * True during a base render, where every selector branch is walked to discover combos.
     */
    public boolean isExploringSelectors() {
        return !selectorsApplied;
    }

    public Optional<Long> selectedValue(GroupType type, long groupId) {
        Optional<SelectorValue> applied = selectors.find(type, groupId);
        if (applied.isPresent()) {
            return Optional.of(applied.get().getValueId());
        }
        Long fixed = fixedSelectors.get(groupId);
        if (fixed != null) {
            return Optional.of(fixed);
        }
        return selectorPaths.findInTrail(type, groupId).map(SelectorValue::getValueId);
    }

    public void discoverStateChunk(long groupId, Collection<StateValue> states) {
        stateChunkPaths.add(groupId, states);
    }

    public Optional<StateValue> currentState(long groupId) {
        return stateChunk == null ? Optional.empty() : stateChunk.find(groupId);
    }

    public void discoverParam(long paramId, Collection<ParamValue> values) {
        if (fixedParams.containsKey(paramId)) {
            return;
        }
        paramPaths.add(paramId, values);
    }

    public Optional<Double> currentParam(long paramId) {
        Double fixed = fixedParams.get(paramId);
        if (fixed != null) {
            return Optional.of(fixed);
        }
        return params == null
                ? Optional.empty()
                : params.find(paramId).map(ParamValue::getValue);
    }

    public void discoverSecondary(SecondaryObject secondary) {
        secondaryObjects.add(secondary);
    }
}
