package com.soundbank.generator.render.state;

import java.util.ArrayList;
import java.util.List;

final class Combinations {

    private Combinations() {
        // Utility class
    }

    /**
     * Ordered cartesian product; the first dimension varies slowest. An empty input yields a
     * single empty combination.
     */
    static <T> List<List<T>> cartesian(List<List<T>> dimensions) {
        List<List<T>> result = new ArrayList<>();
        result.add(List.of());
        for (List<T> options : dimensions) {
            List<List<T>> next = new ArrayList<>();
            for (List<T> prefix : result) {
                for (T option : options) {
                    List<T> combo = new ArrayList<>(prefix);
                    combo.add(option);
                    next.add(combo);
                }
            }
            result = next;
        }
        return result;
    }
}
