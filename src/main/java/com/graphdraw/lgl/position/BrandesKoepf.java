package com.graphdraw.lgl.position;

import com.graphdraw.lgl.api.Alignment;
import com.graphdraw.lgl.api.DummyKind;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.Graph;
import com.graphdraw.lgl.core.GraphConfig;
import com.graphdraw.lgl.core.Layers;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * X coordinates after Brandes and Koepf, "Fast and Simple Horizontal
 * Coordinate Assignment", with the corrections from Brandes, Walter and
 * Zink, "Erratum: Fast and Simple Horizontal Coordinate Assignment".
 *
 * Four alignments are computed, one per combination of vertical sweep
 * direction and horizontal bias. Each aligns every node with a median
 * neighbour where no marked conflict forbids it, then packs the resulting
 * blocks as far left as the separation rules allow. The alignments are
 * shifted onto the narrowest one and combined either by the configured
 * alignment or by averaging the two middle candidates per node.
 */
public final class BrandesKoepf {

    /** Pairs of nodes whose segments may not be aligned. */
    static final class Conflicts {
        private final Map<String, Set<String>> pairs = new HashMap<>();

        void add(String v, String w) {
            if (v.compareTo(w) > 0) {
                String tmp = v;
                v = w;
                w = tmp;
            }
            pairs.computeIfAbsent(v, k -> new HashSet<>()).add(w);
        }

        boolean has(String v, String w) {
            if (v.compareTo(w) > 0) {
                String tmp = v;
                v = w;
                w = tmp;
            }
            Set<String> set = pairs.get(v);
            return set != null && set.contains(w);
        }

        void addAll(Conflicts other) {
            for (Map.Entry<String, Set<String>> e : other.pairs.entrySet())
                pairs.computeIfAbsent(e.getKey(), k -> new HashSet<>()).addAll(e.getValue());
        }
    }

    record VerticalAlignment(Map<String, String> root, Map<String, String> align) {
    }

    private BrandesKoepf() {
    }

    /** X coordinate of every node of a layered, ordered, non-compound graph. */
    public static Map<String, Double> positionX(LayoutGraph g) {
        List<List<String>> layering = Layers.buildLayerMatrix(g);
        Conflicts conflicts = findType1Conflicts(g, layering);
        conflicts.addAll(findType2Conflicts(g, layering));

        Map<Alignment, Map<String, Double>> xss = new EnumMap<>(Alignment.class);
        for (Alignment alignment : Alignment.values()) {
            List<List<String>> adjusted = new ArrayList<>();
            for (List<String> layer : layering) {
                List<String> copy = new ArrayList<>(layer);
                if (!alignment.isLeft())
                    Collections.reverse(copy);
                adjusted.add(copy);
            }
            if (!alignment.isUp())
                Collections.reverse(adjusted);

            boolean up = alignment.isUp();
            VerticalAlignment va = verticalAlignment(adjusted, conflicts,
                    v -> up ? g.predecessors(v) : g.successors(v));
            Map<String, Double> xs = horizontalCompaction(g, adjusted, va.root(), va.align(), !alignment.isLeft());
            if (!alignment.isLeft())
                xs.replaceAll((v, x) -> -x);
            xss.put(alignment, xs);
        }

        Map<String, Double> smallest = findSmallestWidthAlignment(g, xss);
        alignCoordinates(xss, smallest);
        return balance(xss, g.config().getAlign());
    }

    // ------------------------------------------------------------ conflicts

    /**
     * Type 1 conflicts: a non-inner segment crossing an inner segment (one
     * between two dummies). Inner segments win so long edges stay straight.
     */
    static Conflicts findType1Conflicts(LayoutGraph g, List<List<String>> layering) {
        Conflicts conflicts = new Conflicts();
        for (int r = 1; r < layering.size(); r++) {
            List<String> prevLayer = layering.get(r - 1);
            List<String> layer = layering.get(r);
            int k0 = 0;
            int scanPos = 0;
            int prevLayerLength = prevLayer.size();
            String lastNode = layer.isEmpty() ? null : layer.get(layer.size() - 1);

            for (int i = 0; i < layer.size(); i++) {
                String v = layer.get(i);
                String w = findOtherInnerSegmentNode(g, v);
                int k1 = w != null ? g.node(w).getOrder() : prevLayerLength;

                if (w != null || v.equals(lastNode)) {
                    for (String scanNode : layer.subList(scanPos, i + 1)) {
                        for (String u : g.predecessors(scanNode)) {
                            NodeLabel uLabel = g.node(u);
                            int uPos = uLabel.getOrder();
                            if ((uPos < k0 || k1 < uPos) && !(uLabel.isDummy() && g.node(scanNode).isDummy()))
                                conflicts.add(u, scanNode);
                        }
                    }
                    scanPos = i + 1;
                    k0 = k1;
                }
            }
        }
        return conflicts;
    }

    /**
     * Type 2 conflicts: inner segments crossing a cluster border segment. The
     * border wins.
     */
    static Conflicts findType2Conflicts(LayoutGraph g, List<List<String>> layering) {
        Conflicts conflicts = new Conflicts();
        for (int r = 1; r < layering.size(); r++) {
            List<String> north = layering.get(r - 1);
            List<String> south = layering.get(r);
            int prevNorthPos = -1;
            int nextNorthPos = north.size();
            int southPos = 0;
            for (int southLookahead = 0; southLookahead < south.size(); southLookahead++) {
                String v = south.get(southLookahead);
                if (!g.node(v).isBorder())
                    continue;
                List<String> predecessors = g.predecessors(v);
                if (!predecessors.isEmpty()) {
                    nextNorthPos = g.node(predecessors.get(0)).getOrder();
                    scanType2(g, conflicts, south, southPos, southLookahead, prevNorthPos, nextNorthPos);
                    southPos = southLookahead;
                    prevNorthPos = nextNorthPos;
                }
            }
            scanType2(g, conflicts, south, southPos, south.size(), prevNorthPos, north.size());
        }
        return conflicts;
    }

    private static void scanType2(LayoutGraph g, Conflicts conflicts, List<String> south, int southPos,
            int southEnd, int prevNorthBorder, int nextNorthBorder) {
        for (int i = southPos; i < southEnd; i++) {
            String v = south.get(i);
            if (!g.node(v).isDummy())
                continue;
            for (String u : g.predecessors(v)) {
                NodeLabel uNode = g.node(u);
                if (uNode.isDummy() && (uNode.getOrder() < prevNorthBorder || uNode.getOrder() > nextNorthBorder))
                    conflicts.add(u, v);
            }
        }
    }

    private static String findOtherInnerSegmentNode(LayoutGraph g, String v) {
        if (!g.node(v).isDummy())
            return null;
        for (String u : g.predecessors(v)) {
            if (g.node(u).isDummy())
                return u;
        }
        return null;
    }

    // ------------------------------------------------------------ alignment

    interface NeighborFn {
        List<String> neighbors(String v);
    }

    static VerticalAlignment verticalAlignment(List<List<String>> layering, Conflicts conflicts,
            NeighborFn neighborFn) {
        Map<String, String> root = new LinkedHashMap<>();
        Map<String, String> align = new LinkedHashMap<>();
        Map<String, Integer> pos = new HashMap<>();

        for (List<String> layer : layering) {
            for (int order = 0; order < layer.size(); order++) {
                String v = layer.get(order);
                root.put(v, v);
                align.put(v, v);
                pos.put(v, order);
            }
        }

        for (List<String> layer : layering) {
            int prevIdx = -1;
            for (String v : layer) {
                List<String> ws = new ArrayList<>(neighborFn.neighbors(v));
                ws.removeIf(w -> !pos.containsKey(w));
                if (ws.isEmpty())
                    continue;
                ws.sort((a, b) -> Integer.compare(pos.get(a), pos.get(b)));
                double mp = (ws.size() - 1) / 2.0;
                for (int i = (int) Math.floor(mp), il = (int) Math.ceil(mp); i <= il; ++i) {
                    String w = ws.get(i);
                    if (align.get(v).equals(v) && prevIdx < pos.get(w) && !conflicts.has(v, w)) {
                        align.put(w, v);
                        String r = root.get(w);
                        align.put(v, r);
                        root.put(v, r);
                        prevIdx = pos.get(w);
                    }
                }
            }
        }
        return new VerticalAlignment(root, align);
    }

    // ----------------------------------------------------------- compaction

    static Map<String, Double> horizontalCompaction(LayoutGraph g, List<List<String>> layering,
            Map<String, String> root, Map<String, String> align, boolean reverseSep) {
        Map<String, Double> xs = new HashMap<>();
        Graph<Object, Object, Double> blockG = buildBlockGraph(g, layering, root, reverseSep);
        DummyKind borderType = reverseSep ? DummyKind.BORDER_LEFT : DummyKind.BORDER_RIGHT;

        // Pass 1: smallest coordinates.
        iterate(blockG, true, elem -> {
            double x = 0;
            for (EdgeKey e : blockG.inEdges(elem))
                x = Math.max(x, xs.get(e.v()) + blockG.edge(e));
            xs.put(elem, x);
        });

        // Pass 2: pull right where there is slack, except on the far border.
        iterate(blockG, false, elem -> {
            double min = Double.POSITIVE_INFINITY;
            for (EdgeKey e : blockG.outEdges(elem))
                min = Math.min(min, xs.get(e.w()) - blockG.edge(e));
            NodeLabel node = g.node(elem);
            if (min != Double.POSITIVE_INFINITY && node.getDummy() != borderType)
                xs.put(elem, Math.max(xs.get(elem), min));
        });

        Map<String, Double> result = new LinkedHashMap<>();
        for (String v : align.keySet())
            result.put(v, xs.get(root.get(v)));
        return result;
    }

    private interface BlockVisitor {
        void visit(String elem);
    }

    /** Post-order walk of the block graph along predecessors (or successors). */
    private static void iterate(Graph<Object, Object, Double> blockG, boolean alongPredecessors,
            BlockVisitor setXs) {
        List<String> stack = blockG.nodes();
        Set<String> visited = new HashSet<>();
        while (!stack.isEmpty()) {
            String elem = stack.remove(stack.size() - 1);
            if (visited.contains(elem)) {
                setXs.visit(elem);
            } else {
                visited.add(elem);
                stack.add(elem);
                stack.addAll(alongPredecessors ? blockG.predecessors(elem) : blockG.successors(elem));
            }
        }
    }

    private static Graph<Object, Object, Double> buildBlockGraph(LayoutGraph g, List<List<String>> layering,
            Map<String, String> root, boolean reverseSep) {
        Graph<Object, Object, Double> blockGraph = new Graph<>(false, false);
        GraphConfig config = g.config();
        for (List<String> layer : layering) {
            String u = null;
            for (String v : layer) {
                String vRoot = root.get(v);
                if (!blockGraph.hasNode(vRoot))
                    blockGraph.setNode(vRoot, vRoot);
                if (u != null) {
                    String uRoot = root.get(u);
                    Double prevMax = blockGraph.edge(uRoot, vRoot);
                    double sep = separation(g, config.getNodesep(), config.getEdgesep(), reverseSep, v, u);
                    blockGraph.setEdge(uRoot, vRoot, Math.max(sep, prevMax == null ? 0 : prevMax));
                }
                u = v;
            }
        }
        return blockGraph;
    }

    /** Minimum distance between the centres of neighbours {@code w} (left) and {@code v}. */
    static double separation(LayoutGraph g, double nodeSep, double edgeSep, boolean reverseSep, String v, String w) {
        NodeLabel vLabel = g.node(v);
        NodeLabel wLabel = g.node(w);
        double sum = 0;
        double delta = 0;

        sum += vLabel.getWidth() / 2;
        if (vLabel.getLabelpos() != null) {
            switch (vLabel.getLabelpos()) {
                case L -> delta = -vLabel.getWidth() / 2;
                case R -> delta = vLabel.getWidth() / 2;
                case C -> delta = 0;
            }
        }
        if (delta != 0)
            sum += reverseSep ? delta : -delta;
        delta = 0;

        sum += (vLabel.isDummy() ? edgeSep : nodeSep) / 2;
        sum += (wLabel.isDummy() ? edgeSep : nodeSep) / 2;

        sum += wLabel.getWidth() / 2;
        if (wLabel.getLabelpos() != null) {
            switch (wLabel.getLabelpos()) {
                case L -> delta = wLabel.getWidth() / 2;
                case R -> delta = -wLabel.getWidth() / 2;
                case C -> delta = 0;
            }
        }
        if (delta != 0)
            sum += reverseSep ? delta : -delta;
        return sum;
    }

    // -------------------------------------------------------------- balance

    static Map<String, Double> findSmallestWidthAlignment(LayoutGraph g, Map<Alignment, Map<String, Double>> xss) {
        double best = Double.POSITIVE_INFINITY;
        Map<String, Double> bestXs = null;
        for (Map<String, Double> xs : xss.values()) {
            double max = Double.NEGATIVE_INFINITY;
            double min = Double.POSITIVE_INFINITY;
            for (Map.Entry<String, Double> e : xs.entrySet()) {
                double halfWidth = g.node(e.getKey()).getWidth() / 2;
                max = Math.max(e.getValue() + halfWidth, max);
                min = Math.min(e.getValue() - halfWidth, min);
            }
            if (max - min < best) {
                best = max - min;
                bestXs = xs;
            }
        }
        return bestXs;
    }

    /** Shifts left-biased alignments onto the minimum, right-biased ones onto the maximum of {@code alignTo}. */
    static void alignCoordinates(Map<Alignment, Map<String, Double>> xss, Map<String, Double> alignTo) {
        if (alignTo == null || alignTo.isEmpty())
            return;
        double alignToMin = Collections.min(alignTo.values());
        double alignToMax = Collections.max(alignTo.values());
        for (Alignment alignment : Alignment.values()) {
            Map<String, Double> xs = xss.get(alignment);
            if (xs == alignTo || xs.isEmpty())
                continue;
            double delta = alignment.isLeft()
                    ? alignToMin - Collections.min(xs.values())
                    : alignToMax - Collections.max(xs.values());
            if (delta != 0) {
                final double d = delta;
                xs.replaceAll((v, x) -> x + d);
            }
        }
    }

    static Map<String, Double> balance(Map<Alignment, Map<String, Double>> xss, Alignment align) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (String v : xss.get(Alignment.UL).keySet()) {
            if (align != null) {
                result.put(v, xss.get(align).get(v));
            } else {
                double[] xs = new double[4];
                int i = 0;
                for (Alignment a : Alignment.values())
                    xs[i++] = xss.get(a).get(v);
                Arrays.sort(xs);
                result.put(v, (xs[1] + xs[2]) / 2);
            }
        }
        return result;
    }
}
