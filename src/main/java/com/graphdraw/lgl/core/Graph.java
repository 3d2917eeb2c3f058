package com.graphdraw.lgl.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Directed graph with optional multi-edges and an optional compound
 * (parent/child) hierarchy.
 *
 * Nodes are string identifiers with a mutable label each, edges are keyed by
 * {@link EdgeKey}. Every iteration follows insertion order so that two runs
 * over the same input visit the same elements in the same sequence.
 *
 * The parent relation is kept in side tables keyed by node id; nodes never
 * hold references to each other.
 *
 * @param <G> Graph label type.
 * @param <N> Node label type.
 * @param <E> Edge label type.
 */
public class Graph<G, N, E> {
    private static final String ROOT = "\u0000root";

    private final boolean multigraph;
    private final boolean compound;

    private G label;
    private Supplier<N> defaultNodeLabel;
    private Supplier<E> defaultEdgeLabel;

    private final Map<String, N> nodes = new LinkedHashMap<>();
    private final Map<EdgeKey, E> edges = new LinkedHashMap<>();
    private final Map<String, Set<EdgeKey>> in = new LinkedHashMap<>();
    private final Map<String, Set<EdgeKey>> out = new LinkedHashMap<>();

    // Compound bookkeeping. Top-level nodes are children of ROOT.
    private final Map<String, String> parent = new LinkedHashMap<>();
    private final Map<String, Set<String>> children = new LinkedHashMap<>();

    public Graph(boolean multigraph, boolean compound) {
        this.multigraph = multigraph;
        this.compound = compound;
        if (compound)
            children.put(ROOT, new LinkedHashSet<>());
    }

    public boolean isMultigraph() {
        return multigraph;
    }

    public boolean isCompound() {
        return compound;
    }

    public G graph() {
        return label;
    }

    public void setGraph(G label) {
        this.label = label;
    }

    /**
     * Installs a supplier for labels of nodes created implicitly by
     * {@link #setNode(String)} or by adding an edge to an unknown endpoint. Without
     * one, edges to unknown nodes are rejected.
     */
    public void setDefaultNodeLabel(Supplier<N> supplier) {
        this.defaultNodeLabel = supplier;
    }

    public void setDefaultEdgeLabel(Supplier<E> supplier) {
        this.defaultEdgeLabel = supplier;
    }

    // ---------------------------------------------------------------- nodes

    public int nodeCount() {
        return nodes.size();
    }

    public List<String> nodes() {
        return new ArrayList<>(nodes.keySet());
    }

    public boolean hasNode(String v) {
        return nodes.containsKey(v);
    }

    /** Returns the label of {@code v}, or null when there is no such node. */
    public N node(String v) {
        return nodes.get(v);
    }

    /** Creates {@code v} with the default label if it does not exist yet. */
    public Graph<G, N, E> setNode(String v) {
        if (nodes.containsKey(v))
            return this;
        if (defaultNodeLabel == null)
            throw new IllegalArgumentException("No label for node: " + v);
        return setNode(v, defaultNodeLabel.get());
    }

    /** Creates {@code v} or replaces its label. */
    public Graph<G, N, E> setNode(String v, N nodeLabel) {
        if (v == null)
            throw new IllegalArgumentException("Node id must not be null");
        if (nodes.containsKey(v)) {
            nodes.put(v, nodeLabel);
            return this;
        }
        nodes.put(v, nodeLabel);
        in.put(v, new LinkedHashSet<>());
        out.put(v, new LinkedHashSet<>());
        if (compound) {
            parent.put(v, ROOT);
            children.put(v, new LinkedHashSet<>());
            children.get(ROOT).add(v);
        }
        return this;
    }

    /**
     * Removes {@code v} and every edge incident to it. Children of a removed
     * cluster move up to the top level.
     */
    public Graph<G, N, E> removeNode(String v) {
        if (!nodes.containsKey(v))
            return this;
        if (compound) {
            children.get(parent.remove(v)).remove(v);
            for (String child : new ArrayList<>(children.get(v)))
                setParent(child, null);
            children.remove(v);
        }
        for (EdgeKey e : new ArrayList<>(in.get(v)))
            removeEdge(e);
        for (EdgeKey e : new ArrayList<>(out.get(v)))
            removeEdge(e);
        in.remove(v);
        out.remove(v);
        nodes.remove(v);
        return this;
    }

    /** Node ids matching the predicate, in insertion order. */
    public List<String> filterNodes(Predicate<String> predicate) {
        List<String> result = new ArrayList<>();
        for (String v : nodes.keySet()) {
            if (predicate.test(v))
                result.add(v);
        }
        return result;
    }

    // ------------------------------------------------------------- compound

    /**
     * Moves {@code v} under {@code p}; a null {@code p} makes it top-level. Both
     * nodes must exist and the move must not make {@code v} its own ancestor.
     */
    public Graph<G, N, E> setParent(String v, String p) {
        if (!compound)
            throw new IllegalArgumentException("Cannot set parent in a non-compound graph");
        if (!nodes.containsKey(v))
            throw new IllegalArgumentException("Unknown node: " + v);
        String target = ROOT;
        if (p != null) {
            if (!nodes.containsKey(p))
                throw new IllegalArgumentException("Unknown parent: " + p);
            for (String a = p; a != null; a = parent(a)) {
                if (a.equals(v))
                    throw new IllegalArgumentException(
                            "Setting " + p + " as parent of " + v + " would create a cycle");
            }
            target = p;
        }
        children.get(parent.get(v)).remove(v);
        parent.put(v, target);
        children.get(target).add(v);
        return this;
    }

    /** Parent of {@code v}, or null for top-level nodes and non-compound graphs. */
    public String parent(String v) {
        if (!compound)
            return null;
        String p = parent.get(v);
        return p == null || ROOT.equals(p) ? null : p;
    }

    /** Children of {@code v}; a null {@code v} lists the top-level nodes. */
    public List<String> children(String v) {
        if (!compound) {
            if (v == null)
                return nodes();
            return new ArrayList<>();
        }
        Set<String> c = children.get(v == null ? ROOT : v);
        return c == null ? new ArrayList<>() : new ArrayList<>(c);
    }

    public boolean hasChildren(String v) {
        if (!compound)
            return false;
        Set<String> c = children.get(v);
        return c != null && !c.isEmpty();
    }

    // ------------------------------------------------------------ adjacency

    public List<String> sources() {
        return filterNodes(v -> in.get(v).isEmpty());
    }

    public List<String> sinks() {
        return filterNodes(v -> out.get(v).isEmpty());
    }

    public List<String> predecessors(String v) {
        Set<EdgeKey> es = in.get(v);
        if (es == null)
            return null;
        Set<String> result = new LinkedHashSet<>();
        for (EdgeKey e : es)
            result.add(e.v());
        return new ArrayList<>(result);
    }

    public List<String> successors(String v) {
        Set<EdgeKey> es = out.get(v);
        if (es == null)
            return null;
        Set<String> result = new LinkedHashSet<>();
        for (EdgeKey e : es)
            result.add(e.w());
        return new ArrayList<>(result);
    }

    public List<String> neighbors(String v) {
        List<String> preds = predecessors(v);
        if (preds == null)
            return null;
        Set<String> result = new LinkedHashSet<>(preds);
        result.addAll(successors(v));
        return new ArrayList<>(result);
    }

    public List<EdgeKey> inEdges(String v) {
        Set<EdgeKey> es = in.get(v);
        return es == null ? null : new ArrayList<>(es);
    }

    /** In-edges of {@code v} whose tail is {@code u}. */
    public List<EdgeKey> inEdges(String v, String u) {
        List<EdgeKey> all = inEdges(v);
        if (all == null)
            return null;
        all.removeIf(e -> !e.v().equals(u));
        return all;
    }

    public List<EdgeKey> outEdges(String v) {
        Set<EdgeKey> es = out.get(v);
        return es == null ? null : new ArrayList<>(es);
    }

    /** Out-edges of {@code v} whose head is {@code w}. */
    public List<EdgeKey> outEdges(String v, String w) {
        List<EdgeKey> all = outEdges(v);
        if (all == null)
            return null;
        all.removeIf(e -> !e.w().equals(w));
        return all;
    }

    public List<EdgeKey> nodeEdges(String v) {
        List<EdgeKey> result = inEdges(v);
        if (result == null)
            return null;
        for (EdgeKey e : out.get(v)) {
            if (!e.isSelfLoop())
                result.add(e);
        }
        return result;
    }

    /** Edges between {@code v} and {@code w} in either direction. */
    public List<EdgeKey> nodeEdges(String v, String w) {
        List<EdgeKey> all = nodeEdges(v);
        if (all == null)
            return null;
        all.removeIf(e -> !(e.v().equals(w) || e.w().equals(w)));
        return all;
    }

    // ---------------------------------------------------------------- edges

    public int edgeCount() {
        return edges.size();
    }

    public List<EdgeKey> edges() {
        return new ArrayList<>(edges.keySet());
    }

    public Graph<G, N, E> setEdge(String v, String w) {
        return setEdge(new EdgeKey(v, w, null), null);
    }

    public Graph<G, N, E> setEdge(String v, String w, E edgeLabel) {
        return setEdge(new EdgeKey(v, w, null), edgeLabel);
    }

    public Graph<G, N, E> setEdge(String v, String w, E edgeLabel, String name) {
        return setEdge(new EdgeKey(v, w, name), edgeLabel);
    }

    /**
     * Adds the edge or replaces its label. A null label keeps an existing label
     * or falls back to the default edge label for a new edge.
     */
    public Graph<G, N, E> setEdge(EdgeKey key, E edgeLabel) {
        if (key.name() != null && !multigraph)
            throw new IllegalArgumentException("Cannot set a named edge on a non-multigraph: " + key);
        if (edges.containsKey(key)) {
            if (edgeLabel != null)
                edges.put(key, edgeLabel);
            return this;
        }
        if (edgeLabel == null) {
            if (defaultEdgeLabel == null)
                throw new IllegalArgumentException("No label for edge: " + key);
            edgeLabel = defaultEdgeLabel.get();
        }
        requireEndpoint(key.v());
        requireEndpoint(key.w());
        edges.put(key, edgeLabel);
        out.get(key.v()).add(key);
        in.get(key.w()).add(key);
        return this;
    }

    private void requireEndpoint(String v) {
        if (nodes.containsKey(v))
            return;
        if (defaultNodeLabel == null)
            throw new IllegalArgumentException("Unknown node: " + v);
        setNode(v);
    }

    /** Connects consecutive nodes of the path with default-labelled edges. */
    public Graph<G, N, E> setPath(String... path) {
        for (int i = 1; i < path.length; i++)
            setEdge(path[i - 1], path[i]);
        return this;
    }

    public boolean hasEdge(String v, String w) {
        return edges.containsKey(new EdgeKey(v, w, null));
    }

    public boolean hasEdge(String v, String w, String name) {
        return edges.containsKey(new EdgeKey(v, w, name));
    }

    public boolean hasEdge(EdgeKey key) {
        return edges.containsKey(key);
    }

    public E edge(String v, String w) {
        return edges.get(new EdgeKey(v, w, null));
    }

    public E edge(String v, String w, String name) {
        return edges.get(new EdgeKey(v, w, name));
    }

    public E edge(EdgeKey key) {
        return edges.get(key);
    }

    public Graph<G, N, E> removeEdge(String v, String w) {
        return removeEdge(new EdgeKey(v, w, null));
    }

    public Graph<G, N, E> removeEdge(EdgeKey key) {
        if (edges.remove(key) != null) {
            out.get(key.v()).remove(key);
            in.get(key.w()).remove(key);
        }
        return this;
    }

    public Collection<E> edgeLabels() {
        return new ArrayList<>(edges.values());
    }

    /**
     * Shallow structural copy: same node ids, edges and hierarchy, labels shared
     * with this graph.
     */
    public Graph<G, N, E> copy() {
        Graph<G, N, E> g = new Graph<>(multigraph, compound);
        copyInto(g);
        return g;
    }

    protected void copyInto(Graph<G, N, E> g) {
        g.setGraph(label);
        g.defaultNodeLabel = defaultNodeLabel;
        g.defaultEdgeLabel = defaultEdgeLabel;
        for (Map.Entry<String, N> n : nodes.entrySet())
            g.setNode(n.getKey(), n.getValue());
        if (compound) {
            for (String v : nodes.keySet()) {
                String p = parent(v);
                if (p != null)
                    g.setParent(v, p);
            }
        }
        for (Map.Entry<EdgeKey, E> e : edges.entrySet())
            g.setEdge(e.getKey(), e.getValue());
    }
}
