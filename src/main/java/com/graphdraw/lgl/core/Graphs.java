package com.graphdraw.lgl.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Traversals and views over {@link Graph}. All traversals are iterative so
 * long dummy chains cannot overflow the call stack.
 */
public final class Graphs {

    private Graphs() {
    }

    /**
     * Non-compound view of {@code g} holding only leaf nodes. Labels are shared,
     * so ranks written on the view are visible on {@code g}. Edges touching a
     * cluster are not part of the view.
     */
    public static LayoutGraph asNonCompound(LayoutGraph g) {
        LayoutGraph simplified = new LayoutGraph(g.isMultigraph(), false);
        simplified.setGraph(g.graph());
        for (String v : g.nodes()) {
            if (!g.hasChildren(v))
                simplified.setNode(v, g.node(v));
        }
        for (EdgeKey e : g.edges()) {
            if (simplified.hasNode(e.v()) && simplified.hasNode(e.w()))
                simplified.setEdge(e, g.edge(e));
        }
        return simplified;
    }

    /** Weakly connected components, each in discovery order. */
    public static List<List<String>> components(Graph<?, ?, ?> g) {
        Set<String> visited = new HashSet<>();
        List<List<String>> result = new ArrayList<>();
        for (String start : g.nodes()) {
            if (!visited.add(start))
                continue;
            List<String> component = new ArrayList<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                String v = stack.pop();
                component.add(v);
                for (String w : g.neighbors(v)) {
                    if (visited.add(w))
                        stack.push(w);
                }
            }
            result.add(component);
        }
        return result;
    }

    /** Depth-first preorder along out-edges, starting from each root in turn. */
    public static List<String> preorder(Graph<?, ?, ?> g, List<String> roots) {
        List<String> result = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<Iterator<String>> stack = new ArrayDeque<>();
        for (String root : roots) {
            if (!visited.add(root))
                continue;
            result.add(root);
            stack.push(g.successors(root).iterator());
            while (!stack.isEmpty()) {
                Iterator<String> it = stack.peek();
                if (!it.hasNext()) {
                    stack.pop();
                    continue;
                }
                String w = it.next();
                if (visited.add(w)) {
                    result.add(w);
                    stack.push(g.successors(w).iterator());
                }
            }
        }
        return result;
    }

    /**
     * Depth-first postorder along out-edges. On a DAG every node appears after
     * all nodes reachable from it.
     */
    public static List<String> postorder(Graph<?, ?, ?> g, List<String> roots) {
        List<String> result = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> nodeStack = new ArrayDeque<>();
        Deque<Iterator<String>> stack = new ArrayDeque<>();
        for (String root : roots) {
            if (!visited.add(root))
                continue;
            nodeStack.push(root);
            stack.push(g.successors(root).iterator());
            while (!stack.isEmpty()) {
                Iterator<String> it = stack.peek();
                if (it.hasNext()) {
                    String w = it.next();
                    if (visited.add(w)) {
                        nodeStack.push(w);
                        stack.push(g.successors(w).iterator());
                    }
                } else {
                    stack.pop();
                    result.add(nodeStack.pop());
                }
            }
        }
        return result;
    }
}
