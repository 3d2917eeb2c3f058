package com.graphdraw.lgl.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies an edge by tail, head and an optional multi-edge discriminator.
 *
 * The natural ordering (tail, head, name with null first) is what every
 * deterministic tie-break in the pipeline uses.
 */
public record EdgeKey(String v, String w, String name) implements Comparable<EdgeKey> {

    public static final Comparator<EdgeKey> ORDER = Comparator
            .comparing(EdgeKey::v)
            .thenComparing(EdgeKey::w)
            .thenComparing(EdgeKey::name, Comparator.nullsFirst(Comparator.naturalOrder()));

    public EdgeKey {
        Objects.requireNonNull(v, "v");
        Objects.requireNonNull(w, "w");
    }

    public static EdgeKey of(String v, String w) {
        return new EdgeKey(v, w, null);
    }

    public static EdgeKey of(String v, String w, String name) {
        return new EdgeKey(v, w, name);
    }

    /** The other endpoint of this edge as seen from {@code node}. */
    public String other(String node) {
        return v.equals(node) ? w : v;
    }

    public boolean isSelfLoop() {
        return v.equals(w);
    }

    @Override
    public int compareTo(EdgeKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return name == null ? v + "->" + w : v + "->" + w + "[" + name + "]";
    }
}
