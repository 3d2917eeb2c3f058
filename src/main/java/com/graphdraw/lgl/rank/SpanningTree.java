package com.graphdraw.lgl.rank;

import com.graphdraw.lgl.core.EdgeKey;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Undirected spanning tree used by network simplex.
 *
 * Tree edges are stored under a canonical key with the smaller endpoint first
 * and carry a cut value. The low/lim/parent numbering is a side table keyed by
 * node id. The tree only lives for the duration of one ranking call.
 */
public final class SpanningTree {

    /** Post-order numbering of one tree node. */
    static final class Numbering {
        int low;
        int lim;
        String parent;
    }

    private final Map<String, Set<String>> adjacency = new LinkedHashMap<>();
    private final Map<EdgeKey, Double> cutValues = new LinkedHashMap<>();
    private final Map<String, Numbering> numbering = new LinkedHashMap<>();

    static EdgeKey key(String v, String w) {
        return v.compareTo(w) <= 0 ? EdgeKey.of(v, w) : EdgeKey.of(w, v);
    }

    public boolean hasNode(String v) {
        return adjacency.containsKey(v);
    }

    public void addNode(String v) {
        adjacency.computeIfAbsent(v, k -> new LinkedHashSet<>());
    }

    public List<String> nodes() {
        return new ArrayList<>(adjacency.keySet());
    }

    public int nodeCount() {
        return adjacency.size();
    }

    public List<String> neighbors(String v) {
        Set<String> n = adjacency.get(v);
        return n == null ? new ArrayList<>() : new ArrayList<>(n);
    }

    /** Adds the undirected edge, creating missing endpoints. */
    public void addEdge(String v, String w) {
        addNode(v);
        addNode(w);
        adjacency.get(v).add(w);
        adjacency.get(w).add(v);
        cutValues.putIfAbsent(key(v, w), 0.0);
    }

    public void removeEdge(String v, String w) {
        if (cutValues.remove(key(v, w)) == null)
            return;
        adjacency.get(v).remove(w);
        adjacency.get(w).remove(v);
    }

    public boolean hasEdge(String v, String w) {
        return cutValues.containsKey(key(v, w));
    }

    /** Tree edges in canonical orientation, in insertion order. */
    public List<EdgeKey> edges() {
        return new ArrayList<>(cutValues.keySet());
    }

    public double cutValue(String v, String w) {
        Double value = cutValues.get(key(v, w));
        if (value == null)
            throw new IllegalArgumentException("Not a tree edge: " + v + " - " + w);
        return value;
    }

    public void setCutValue(String v, String w, double value) {
        EdgeKey k = key(v, w);
        if (!cutValues.containsKey(k))
            throw new IllegalArgumentException("Not a tree edge: " + v + " - " + w);
        cutValues.put(k, value);
    }

    Numbering numbering(String v) {
        return numbering.computeIfAbsent(v, k -> new Numbering());
    }

    public int low(String v) {
        return numbering(v).low;
    }

    public int lim(String v) {
        return numbering(v).lim;
    }

    /** Parent in the rooted tree, null for the root. */
    public String parent(String v) {
        return numbering(v).parent;
    }

    /** True when {@code v} lies in the subtree rooted at {@code root}. */
    public boolean isDescendant(String v, String root) {
        Numbering r = numbering(root);
        int lim = numbering(v).lim;
        return r.low <= lim && lim <= r.lim;
    }
}
