package com.graphdraw.lgl.acyclic;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.Graph;
import com.graphdraw.lgl.core.LayoutGraph;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Eades, Lin and Smyth greedy feedback arc set.
 *
 * Nodes are peeled off repeatedly: sinks first, then sources, and otherwise
 * the node with the largest (out - in) weight. The in-edges of nodes taken in
 * the last case form the feedback set. Parallel edges are aggregated into one
 * weighted edge for the decision; every parallel edge of a chosen pair is
 * returned.
 */
public final class GreedyFeedbackArcSet {

    private static final class Entry {
        final String v;
        long in;
        long out;
        int bucket = -1;

        Entry(String v) {
            this.v = v;
        }
    }

    private final Graph<Object, Entry, Long> fas = new Graph<>(false, false);
    private final List<LinkedHashSet<Entry>> buckets = new ArrayList<>();
    private int zeroIdx;

    private GreedyFeedbackArcSet() {
    }

    public static List<EdgeKey> find(LayoutGraph g) {
        if (g.nodeCount() <= 1)
            return new ArrayList<>();
        GreedyFeedbackArcSet state = new GreedyFeedbackArcSet();
        state.build(g);
        List<EdgeKey> result = new ArrayList<>();
        for (EdgeKey pair : state.run())
            result.addAll(g.outEdges(pair.v(), pair.w()));
        return result;
    }

    private void build(LayoutGraph g) {
        long maxIn = 0;
        long maxOut = 0;
        for (String v : g.nodes())
            fas.setNode(v, new Entry(v));
        for (EdgeKey e : g.edges()) {
            if (e.isSelfLoop())
                continue;
            long weight = Math.round(g.edge(e).getWeight());
            Long prev = fas.edge(e.v(), e.w());
            fas.setEdge(e.v(), e.w(), (prev == null ? 0 : prev) + weight);
            Entry tail = fas.node(e.v());
            Entry head = fas.node(e.w());
            tail.out += weight;
            head.in += weight;
            maxOut = Math.max(maxOut, tail.out);
            maxIn = Math.max(maxIn, head.in);
        }
        int count = Math.toIntExact(maxOut + maxIn + 3);
        for (int i = 0; i < count; i++)
            buckets.add(new LinkedHashSet<>());
        zeroIdx = Math.toIntExact(maxIn + 1);
        for (String v : fas.nodes())
            assignBucket(fas.node(v));
    }

    private List<EdgeKey> run() {
        List<EdgeKey> results = new ArrayList<>();
        LinkedHashSet<Entry> sinks = buckets.get(0);
        LinkedHashSet<Entry> sources = buckets.get(buckets.size() - 1);
        while (fas.nodeCount() > 0) {
            Entry entry;
            while ((entry = dequeue(sinks)) != null)
                removeNode(entry, null);
            while ((entry = dequeue(sources)) != null)
                removeNode(entry, null);
            if (fas.nodeCount() > 0) {
                for (int i = buckets.size() - 2; i > 0; --i) {
                    entry = dequeue(buckets.get(i));
                    if (entry != null) {
                        removeNode(entry, results);
                        break;
                    }
                }
            }
        }
        return results;
    }

    private void removeNode(Entry entry, List<EdgeKey> collected) {
        for (EdgeKey e : fas.inEdges(entry.v)) {
            Entry u = fas.node(e.v());
            if (collected != null)
                collected.add(EdgeKey.of(e.v(), e.w()));
            u.out -= fas.edge(e);
            assignBucket(u);
        }
        for (EdgeKey e : fas.outEdges(entry.v)) {
            Entry w = fas.node(e.w());
            w.in -= fas.edge(e);
            assignBucket(w);
        }
        fas.removeNode(entry.v);
    }

    private void assignBucket(Entry entry) {
        int target;
        if (entry.out == 0)
            target = 0;
        else if (entry.in == 0)
            target = buckets.size() - 1;
        else
            target = Math.toIntExact(entry.out - entry.in + zeroIdx);
        if (entry.bucket >= 0)
            buckets.get(entry.bucket).remove(entry);
        entry.bucket = target;
        buckets.get(target).add(entry);
    }

    private static Entry dequeue(LinkedHashSet<Entry> bucket) {
        Iterator<Entry> it = bucket.iterator();
        if (!it.hasNext())
            return null;
        Entry entry = it.next();
        it.remove();
        entry.bucket = -1;
        return entry;
    }
}
