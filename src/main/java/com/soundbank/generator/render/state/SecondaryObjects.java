package com.soundbank.generator.render.state;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Secondary objects collected for the current root object, in discovery order and without
 * repeats.
 */
public class SecondaryObjects {

    private final Set<SecondaryObject> items = new LinkedHashSet<>();

    public void add(SecondaryObject item) {
        items.add(item);
    }

    public List<SecondaryObject> getItems() {
        return List.copyOf(items);
    }

    public void clear() {
        items.clear();
    }
}
