package com.graphdraw.lgl.acyclic;

import com.graphdraw.lgl.api.Acyclicer;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Makes the graph acyclic by reversing a feedback edge set, and puts the
 * edges back afterwards.
 *
 * A reversed edge keeps its label object. The label is flagged
 * {@code reversed} and remembers its original multi-edge name, while the
 * reversed edge itself gets a fresh {@code rev} name so it cannot collide with
 * an existing parallel edge.
 */
@Log4j2
public final class Acyclic {

    private Acyclic() {
    }

    public static void run(LayoutGraph g, LayoutContext ctx) {
        List<EdgeKey> fas = g.config().getAcyclicer() == Acyclicer.GREEDY
                ? GreedyFeedbackArcSet.find(g)
                : dfsFeedbackArcSet(g);
        for (EdgeKey e : fas) {
            EdgeLabel label = g.edge(e);
            g.removeEdge(e);
            label.setForwardName(e.name());
            label.setReversed(true);
            g.setEdge(EdgeKey.of(e.w(), e.v(), ctx.uniqueId("rev")), label);
        }
        log.debug("Reversed {} edges to break cycles", fas.size());
    }

    /**
     * Restores every reversed edge to its original direction and name. Points
     * were computed for the reversed direction, so they are reversed as well.
     */
    public static void undo(LayoutGraph g) {
        for (EdgeKey e : g.edges()) {
            EdgeLabel label = g.edge(e);
            if (!label.isReversed())
                continue;
            g.removeEdge(e);
            String forwardName = label.getForwardName();
            label.setReversed(false);
            label.setForwardName(null);
            if (label.getPoints() != null)
                Collections.reverse(label.getPoints());
            g.setEdge(EdgeKey.of(e.w(), e.v(), forwardName), label);
        }
    }

    /** Back edges of a depth-first search over the nodes in insertion order. */
    static List<EdgeKey> dfsFeedbackArcSet(LayoutGraph g) {
        List<EdgeKey> fas = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        Deque<String> nodes = new ArrayDeque<>();
        Deque<Iterator<EdgeKey>> edges = new ArrayDeque<>();
        for (String start : g.nodes()) {
            if (!visited.add(start))
                continue;
            onStack.add(start);
            nodes.push(start);
            edges.push(g.outEdges(start).iterator());
            while (!edges.isEmpty()) {
                Iterator<EdgeKey> it = edges.peek();
                if (!it.hasNext()) {
                    edges.pop();
                    onStack.remove(nodes.pop());
                    continue;
                }
                EdgeKey e = it.next();
                if (e.isSelfLoop())
                    continue;
                if (onStack.contains(e.w())) {
                    fas.add(e);
                } else if (visited.add(e.w())) {
                    onStack.add(e.w());
                    nodes.push(e.w());
                    edges.push(g.outEdges(e.w()).iterator());
                }
            }
        }
        return fas;
    }
}
