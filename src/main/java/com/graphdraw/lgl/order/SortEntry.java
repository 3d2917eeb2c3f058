package com.graphdraw.lgl.order;

import java.util.ArrayList;
import java.util.List;

/**
 * A run of nodes that moves as one unit while a layer is sorted, with the
 * positional value it is sorted by. A null value means the unit has no
 * ordered neighbours and keeps its index {@code i}.
 */
final class SortEntry {
    List<String> vs;
    Double value;
    double weight;
    int i;

    SortEntry(List<String> vs) {
        this.vs = vs;
    }

    static SortEntry of(String v) {
        List<String> vs = new ArrayList<>();
        vs.add(v);
        return new SortEntry(vs);
    }

    String v() {
        return vs.get(0);
    }

    boolean hasValue() {
        return value != null;
    }

    /** Folds {@code other}'s value into this one as a weighted average. */
    void mergeValue(SortEntry other) {
        if (value != null && weight + other.weight > 0) {
            value = (value * weight + other.value * other.weight) / (weight + other.weight);
            weight += other.weight;
        } else if (value == null) {
            value = other.value;
            weight = other.weight;
        }
    }
}
