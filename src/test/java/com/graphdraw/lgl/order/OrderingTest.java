package com.graphdraw.lgl.order;

import com.graphdraw.lgl.core.Layers;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class OrderingTest {

    private LayoutGraph g;

    @Before
    public void setUp() {
        g = new LayoutGraph();
    }

    private void node(String v, int rank) {
        NodeLabel label = NodeLabel.of(10, 10);
        label.setRank(rank);
        g.setNode(v, label);
    }

    private void assertValidOrders() {
        for (List<String> layer : Layers.buildLayerMatrix(g)) {
            Set<Integer> seen = new HashSet<>();
            for (String v : layer) {
                int order = g.node(v).getOrder();
                assertTrue(order >= 0 && order < layer.size());
                assertTrue("duplicate order " + order, seen.add(order));
            }
        }
    }

    @Test
    public void testEmptyGraphIsNoOp() {
        Ordering.order(g);
        assertEquals(0, g.nodeCount());
    }

    @Test
    public void testSingleRankGetsDistinctOrders() {
        node("a", 0);
        node("b", 0);
        node("c", 0);
        Ordering.order(g);
        assertValidOrders();
    }

    @Test
    public void testDiamondHasNoCrossings() {
        node("a", 0);
        node("b", 1);
        node("c", 1);
        node("d", 2);
        g.setPath("a", "b", "d");
        g.setPath("a", "c", "d");
        Ordering.order(g);
        assertValidOrders();
        assertEquals(0.0, CrossCount.count(g, Layers.buildLayerMatrix(g)), 0.0);
    }

    @Test
    public void testResolvesBipartiteCrossings() {
        for (String v : Arrays.asList("a", "b", "c"))
            node(v, 0);
        for (String v : Arrays.asList("d", "e", "f"))
            node(v, 1);
        g.setEdge("a", "e");
        g.setEdge("b", "d");
        g.setEdge("b", "f");
        g.setEdge("c", "e");

        assertEquals(2.0, CrossCount.count(g, InitOrder.initOrder(g)), 0.0);
        Ordering.order(g);
        assertValidOrders();
        assertEquals(0.0, CrossCount.count(g, Layers.buildLayerMatrix(g)), 0.0);
    }

    @Test
    public void testDisabledHeuristicKeepsInitialOrder() {
        for (String v : Arrays.asList("a", "b", "c"))
            node(v, 0);
        for (String v : Arrays.asList("d", "e", "f"))
            node(v, 1);
        g.setEdge("a", "e");
        g.setEdge("b", "d");
        g.setEdge("b", "f");
        g.setEdge("c", "e");
        g.config().setDisableOptimalOrderHeuristic(true);

        List<List<String>> initial = InitOrder.initOrder(g);
        Ordering.order(g);
        assertEquals(initial, Layers.buildLayerMatrix(g));
    }

    @Test
    public void testNeverWorseThanInitialOrderWithoutTranspose() {
        String[] top = {"t0", "t1", "t2", "t3", "t4"};
        String[] mid = {"m0", "m1", "m2", "m3", "m4"};
        String[] bottom = {"b0", "b1", "b2", "b3", "b4"};
        for (int i = 0; i < 5; i++) {
            node(top[i], 0);
            node(mid[i], 1);
            node(bottom[i], 2);
        }
        for (int i = 0; i < 5; i++) {
            g.setEdge(top[i], mid[(i * 3) % 5]);
            g.setEdge(top[i], mid[(i + 2) % 5]);
            g.setEdge(mid[i], bottom[(i * 2) % 5]);
            g.setEdge(mid[i], bottom[4 - i]);
        }
        g.config().setTranspose(false);

        double initial = CrossCount.count(g, InitOrder.initOrder(g));
        Ordering.order(g);
        assertValidOrders();
        assertTrue(CrossCount.count(g, Layers.buildLayerMatrix(g)) <= initial);
    }
}
