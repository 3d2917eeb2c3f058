package com.graphdraw.lgl.rank;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Network simplex rank assignment (Gansner et al., "A Technique for Drawing
 * Directed Graphs").
 *
 * Starting from a feasible tight tree, repeatedly:
 *
 * 1. Leave: pick a tree edge with negative cut value.
 * 2. Enter: pick the non-tree edge with least slack that reconnects the two
 * halves the leaving edge separates.
 * 3. Exchange: swap the two edges and update ranks, cut values and the low/lim
 * numbering.
 *
 * The exchange only touches the subtree under the lowest common ancestor of
 * the entering edge's endpoints: outside it neither the numbering nor any
 * partition changes. Inside it, only the tree edges on the cycle closed by the
 * entering edge change their cut value.
 *
 * Parallel edges are collapsed first (weights summed, largest minlen kept),
 * which gives every multi-edge its own share of every cut value.
 *
 * The pivot loop is capped. Hitting the cap is logged and the current tree is
 * accepted: its ranks are feasible, just not necessarily optimal.
 */
public final class NetworkSimplex {
    private static final Logger log = LogManager.getLogger(NetworkSimplex.class);

    private NetworkSimplex() {
    }

    /**
     * Ranks {@code g} in place. The graph must be connected, acyclic and free of
     * self-loops.
     *
     * @param maxIterations Pivot cap; values below 1 disable pivoting.
     * @return Number of pivots performed.
     */
    public static int run(LayoutGraph g, int maxIterations) {
        LayoutGraph simple = simplify(g);
        RankUtil.longestPath(simple);
        SpanningTree t = FeasibleTree.find(simple);
        if (t.nodeCount() == 0)
            return 0;
        initLowLimValues(t, null);
        initCutValues(t, simple);

        int pivots = 0;
        EdgeKey e;
        while ((e = leaveEdge(t)) != null) {
            if (pivots >= maxIterations) {
                log.warn("Network simplex stopped after {} pivots on {} nodes; keeping current feasible ranking",
                        pivots, simple.nodeCount());
                break;
            }
            EdgeKey f = enterEdge(t, simple, e);
            exchangeEdges(t, simple, e, f);
            pivots++;
        }
        log.debug("Network simplex finished after {} pivots", pivots);
        return pivots;
    }

    static LayoutGraph simplify(LayoutGraph g) {
        LayoutGraph simplified = new LayoutGraph(false, false);
        simplified.setGraph(g.graph());
        for (String v : g.nodes())
            simplified.setNode(v, g.node(v));
        for (EdgeKey e : g.edges()) {
            EdgeLabel label = g.edge(e);
            EdgeLabel simple = simplified.edge(e.v(), e.w());
            if (simple == null) {
                simplified.setEdge(e.v(), e.w(), EdgeLabel.of(label.getMinlen(), label.getWeight()));
            } else {
                simple.setWeight(simple.getWeight() + label.getWeight());
                simple.setMinlen(Math.max(simple.getMinlen(), label.getMinlen()));
            }
        }
        return simplified;
    }

    // ------------------------------------------------------------ numbering

    /**
     * Assigns post-order low/lim numbers and parents, rooted at {@code root} or
     * at the first tree node when {@code root} is null.
     */
    static void initLowLimValues(SpanningTree t, String root) {
        if (t.nodeCount() == 0)
            return;
        String r = root == null ? t.nodes().get(0) : root;
        t.numbering(r).parent = null;
        assignLowLim(t, r, null, 1);
    }

    /**
     * Numbers the subtree under {@code root} starting at {@code nextLim}, never
     * crossing into {@code blocked}. Returns the next free number.
     */
    private static int assignLowLim(SpanningTree t, String root, String blocked, int nextLim) {
        Set<String> visited = new HashSet<>();
        visited.add(root);
        if (blocked != null)
            visited.add(blocked);
        Deque<String> nodes = new ArrayDeque<>();
        Deque<Integer> lows = new ArrayDeque<>();
        Deque<Iterator<String>> stack = new ArrayDeque<>();
        nodes.push(root);
        lows.push(nextLim);
        stack.push(t.neighbors(root).iterator());
        while (!stack.isEmpty()) {
            Iterator<String> it = stack.peek();
            if (it.hasNext()) {
                String w = it.next();
                if (visited.add(w)) {
                    t.numbering(w).parent = nodes.peek();
                    nodes.push(w);
                    lows.push(nextLim);
                    stack.push(t.neighbors(w).iterator());
                }
            } else {
                stack.pop();
                SpanningTree.Numbering n = t.numbering(nodes.pop());
                n.low = lows.pop();
                n.lim = nextLim++;
            }
        }
        return nextLim;
    }

    // ----------------------------------------------------------- cut values

    static void initCutValues(SpanningTree t, LayoutGraph g) {
        List<String> byLim = t.nodes();
        byLim.sort(Comparator.comparingInt(t::lim));
        for (String v : byLim) {
            if (t.parent(v) != null)
                assignCutValue(t, g, v);
        }
    }

    private static void assignCutValue(SpanningTree t, LayoutGraph g, String child) {
        t.setCutValue(child, t.parent(child), calcCutValue(t, g, child));
    }

    /**
     * Cut value of the tree edge between {@code child} and its parent, derived
     * from the cut values of the child's own tree edges. Those must be current.
     */
    static double calcCutValue(SpanningTree t, LayoutGraph g, String child) {
        String parent = t.parent(child);
        boolean childIsTail = true;
        EdgeLabel graphEdge = g.edge(child, parent);
        if (graphEdge == null) {
            childIsTail = false;
            graphEdge = g.edge(parent, child);
        }
        if (graphEdge == null)
            throw new IllegalStateException("Tree edge without graph edge: " + child + " - " + parent);

        double cutValue = graphEdge.getWeight();
        for (EdgeKey e : g.nodeEdges(child)) {
            boolean isOutEdge = e.v().equals(child);
            String other = isOutEdge ? e.w() : e.v();
            if (other.equals(parent))
                continue;
            boolean pointsToHead = isOutEdge == childIsTail;
            double otherWeight = g.edge(e).getWeight();
            cutValue += pointsToHead ? otherWeight : -otherWeight;
            if (t.hasEdge(child, other)) {
                double otherCutValue = t.cutValue(child, other);
                cutValue += pointsToHead ? -otherCutValue : otherCutValue;
            }
        }
        return cutValue;
    }

    // ---------------------------------------------------------------- pivot

    /** Tree edge with a negative cut value and the lowest key, or null. */
    static EdgeKey leaveEdge(SpanningTree t) {
        EdgeKey best = null;
        for (EdgeKey e : t.edges()) {
            if (t.cutValue(e.v(), e.w()) < 0 && (best == null || e.compareTo(best) < 0))
                best = e;
        }
        return best;
    }

    /**
     * Least-slack graph edge crossing the cut induced by removing tree edge
     * {@code edge}, oriented against the tree edge's graph direction.
     */
    static EdgeKey enterEdge(SpanningTree t, LayoutGraph g, EdgeKey edge) {
        String v = edge.v();
        String w = edge.w();
        if (!g.hasEdge(v, w)) {
            v = edge.w();
            w = edge.v();
        }
        String tail = v;
        boolean flip = false;
        if (t.lim(v) > t.lim(w)) {
            tail = w;
            flip = true;
        }

        EdgeKey best = null;
        int bestSlack = Integer.MAX_VALUE;
        for (EdgeKey candidate : g.edges()) {
            if (flip != t.isDescendant(candidate.v(), tail) || flip == t.isDescendant(candidate.w(), tail))
                continue;
            int slack = RankUtil.slack(g, candidate);
            if (slack < bestSlack || (slack == bestSlack && candidate.compareTo(best) < 0)) {
                best = candidate;
                bestSlack = slack;
            }
        }
        if (best == null)
            throw new IllegalStateException("No entering edge for " + edge);
        return best;
    }

    /** Replaces tree edge {@code e} with graph edge {@code f}. */
    static void exchangeEdges(SpanningTree t, LayoutGraph g, EdgeKey e, EdgeKey f) {
        String lca = lowestCommonAncestor(t, f.v(), f.w());
        Set<String> cycle = new LinkedHashSet<>();
        for (String x = f.v(); !x.equals(lca); x = t.parent(x))
            cycle.add(x);
        for (String x = f.w(); !x.equals(lca); x = t.parent(x))
            cycle.add(x);

        t.removeEdge(e.v(), e.w());
        t.addEdge(f.v(), f.w());

        assignLowLim(t, lca, t.parent(lca), t.low(lca));

        List<String> dirty = new ArrayList<>(cycle);
        dirty.sort(Comparator.comparingInt(t::lim));
        for (String v : dirty)
            assignCutValue(t, g, v);

        updateRanks(t, g, lca);
    }

    private static String lowestCommonAncestor(SpanningTree t, String a, String b) {
        String x = a;
        while (!t.isDescendant(b, x)) {
            x = t.parent(x);
            if (x == null)
                throw new IllegalStateException("Nodes are not in the same tree: " + a + ", " + b);
        }
        return x;
    }

    /** Re-derives ranks below {@code root} from the tree edges' minlen. */
    private static void updateRanks(SpanningTree t, LayoutGraph g, String root) {
        Deque<String> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            String parent = stack.pop();
            for (String v : t.neighbors(parent)) {
                if (!parent.equals(t.parent(v)))
                    continue;
                EdgeLabel edge = g.edge(v, parent);
                boolean flipped = false;
                if (edge == null) {
                    edge = g.edge(parent, v);
                    flipped = true;
                }
                int parentRank = g.node(parent).getRank();
                g.node(v).setRank(flipped ? parentRank + edge.getMinlen() : parentRank - edge.getMinlen());
                stack.push(v);
            }
        }
    }
}
