package com.graphdraw.lgl.order;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.Graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciles positional values with the left-to-right constraints collected
 * from earlier layers.
 *
 * Entries are visited in topological order of the constraint graph. When a
 * constraint {@code u -> v} is contradicted by the values ({@code u} would sort
 * after {@code v}), the two entries are merged into one unit whose value is the
 * weighted average of both (Forster, "A Fast and Simple Heuristic for
 * Constrained Two-Level Crossing Reduction").
 */
final class ConflictResolver {

    private static final class Node {
        final SortEntry entry;
        int indegree;
        final List<Node> in = new ArrayList<>();
        final List<Node> out = new ArrayList<>();
        boolean merged;

        Node(SortEntry entry) {
            this.entry = entry;
        }
    }

    private ConflictResolver() {
    }

    static List<SortEntry> resolve(List<SortEntry> entries, Graph<Object, Object, Object> cg) {
        Map<String, Node> mapped = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            SortEntry source = entries.get(i);
            SortEntry copy = SortEntry.of(source.v());
            copy.i = i;
            if (source.hasValue()) {
                copy.value = source.value;
                copy.weight = source.weight;
            }
            mapped.put(source.v(), new Node(copy));
        }

        for (EdgeKey e : cg.edges()) {
            Node nodeV = mapped.get(e.v());
            Node nodeW = mapped.get(e.w());
            if (nodeV != null && nodeW != null) {
                nodeW.indegree++;
                nodeV.out.add(nodeW);
            }
        }

        List<Node> sourceSet = new ArrayList<>();
        for (Node node : mapped.values()) {
            if (node.indegree == 0)
                sourceSet.add(node);
        }
        return doResolve(sourceSet);
    }

    private static List<SortEntry> doResolve(List<Node> sourceSet) {
        List<Node> visited = new ArrayList<>();
        while (!sourceSet.isEmpty()) {
            Node node = sourceSet.remove(sourceSet.size() - 1);
            visited.add(node);

            List<Node> in = new ArrayList<>(node.in);
            Collections.reverse(in);
            for (Node u : in) {
                if (u.merged)
                    continue;
                if (u.entry.value == null || node.entry.value == null || u.entry.value >= node.entry.value)
                    merge(node, u);
            }

            for (Node w : node.out) {
                w.in.add(node);
                if (--w.indegree == 0)
                    sourceSet.add(w);
            }
        }

        List<SortEntry> result = new ArrayList<>();
        for (Node node : visited) {
            if (!node.merged)
                result.add(node.entry);
        }
        return result;
    }

    private static void merge(Node target, Node source) {
        SortEntry t = target.entry;
        SortEntry s = source.entry;
        double sum = 0;
        double weight = 0;
        if (t.weight > 0) {
            sum += t.value * t.weight;
            weight += t.weight;
        }
        if (s.weight > 0) {
            sum += s.value * s.weight;
            weight += s.weight;
        }
        List<String> vs = new ArrayList<>(s.vs);
        vs.addAll(t.vs);
        t.vs = vs;
        t.value = weight > 0 ? sum / weight : null;
        t.weight = weight;
        t.i = Math.min(s.i, t.i);
        source.merged = true;
    }
}
