package com.soundbank.generator.render.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parameter buckets met during a render pass; values are kept sorted per parameter.
 */
public class ParamPaths {

    private final Map<Long, TreeMap<Double, ParamValue>> params = new LinkedHashMap<>();

    public void add(long paramId, Collection<ParamValue> values) {
        if (values.isEmpty()) {
            return;
        }
        TreeMap<Double, ParamValue> buckets = params.computeIfAbsent(paramId, key -> new TreeMap<>());
        for (ParamValue value : values) {
            buckets.putIfAbsent(value.getValue(), value);
        }
    }

    public List<ParamCombo> getCombos() {
        if (params.isEmpty()) {
            return List.of();
        }

        List<List<ParamValue>> dimensions = new ArrayList<>();
        for (TreeMap<Double, ParamValue> buckets : params.values()) {
            dimensions.add(new ArrayList<>(buckets.values()));
        }

        List<ParamCombo> combos = new ArrayList<>();
        for (List<ParamValue> values : Combinations.cartesian(dimensions)) {
            combos.add(new ParamCombo(values));
        }
        return combos;
    }

    public void reset() {
        params.clear();
    }
}
