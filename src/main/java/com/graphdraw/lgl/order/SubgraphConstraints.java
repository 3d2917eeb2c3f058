package com.graphdraw.lgl.order;

import com.graphdraw.lgl.core.Graph;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Records the left-to-right order of sibling clusters seen in a sorted layer,
 * so later layers keep the same clusters in the same relative order.
 */
final class SubgraphConstraints {

    private SubgraphConstraints() {
    }

    static void add(Graph<String, LayerNode, Double> lg, Graph<Object, Object, Object> cg, List<String> vs) {
        Map<String, String> prev = new HashMap<>();
        String rootPrev = null;

        for (String v : vs) {
            String child = lg.parent(v);
            while (child != null) {
                String parent = lg.parent(child);
                String prevChild;
                if (parent != null) {
                    prevChild = prev.put(parent, child);
                } else {
                    prevChild = rootPrev;
                    rootPrev = child;
                }
                if (prevChild != null && !prevChild.equals(child)) {
                    cg.setEdge(prevChild, child);
                    break;
                }
                child = parent;
            }
        }
    }
}
