package com.graphdraw.lgl.core;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class GraphTest {

    private LayoutGraph g;

    @Before
    public void setUp() {
        g = new LayoutGraph();
        g.setDefaultNodeLabel(NodeLabel::new);
    }

    @Test
    public void testNodesKeepInsertionOrder() {
        g.setNode("c");
        g.setNode("a");
        g.setNode("b");
        assertEquals(Arrays.asList("c", "a", "b"), g.nodes());
        assertEquals(3, g.nodeCount());
    }

    @Test
    public void testSetEdgeCreatesEndpointsWithDefaultLabel() {
        g.setEdge("a", "b");
        assertTrue(g.hasNode("a"));
        assertTrue(g.hasNode("b"));
        assertEquals(1, g.edge("a", "b").getMinlen());
        assertEquals(1.0, g.edge("a", "b").getWeight(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEdgeToUnknownNodeRejectedWithoutDefault() {
        LayoutGraph strict = new LayoutGraph();
        strict.setNode("a", NodeLabel.of(10, 10));
        strict.setEdge("a", "missing");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNamedEdgeRejectedOnSimpleGraph() {
        LayoutGraph simple = new LayoutGraph(false, false);
        simple.setDefaultNodeLabel(NodeLabel::new);
        simple.setEdge("a", "b", new EdgeLabel(), "x");
    }

    @Test
    public void testMultiEdgesAreDistinct() {
        g.setEdge("a", "b");
        g.setEdge("a", "b", EdgeLabel.of(2, 3), "second");
        assertEquals(2, g.edgeCount());
        assertEquals(2, g.outEdges("a", "b").size());
        assertEquals(Arrays.asList("b"), g.successors("a"));
        assertEquals(2, g.edge("a", "b", "second").getMinlen());
    }

    @Test
    public void testSetEdgeWithNullLabelKeepsExistingLabel() {
        EdgeLabel label = EdgeLabel.of(4, 1);
        g.setEdge("a", "b", label);
        g.setEdge("a", "b");
        assertSame(label, g.edge("a", "b"));
    }

    @Test
    public void testRemoveNodeRemovesIncidentEdges() {
        g.setPath("a", "b", "c");
        g.removeNode("b");
        assertFalse(g.hasNode("b"));
        assertEquals(0, g.edgeCount());
        assertTrue(g.successors("a").isEmpty());
    }

    @Test
    public void testSourcesSinksAndNeighbors() {
        g.setPath("a", "b", "c");
        g.setEdge("a", "c");
        assertEquals(Arrays.asList("a"), g.sources());
        assertEquals(Arrays.asList("c"), g.sinks());
        assertEquals(Arrays.asList("a", "c"), g.neighbors("b"));
        assertEquals(2, g.nodeEdges("c").size());
        assertEquals(1, g.nodeEdges("a", "c").size());
    }

    @Test
    public void testHierarchy() {
        g.setNode("cluster");
        g.setNode("a");
        g.setNode("b");
        g.setParent("a", "cluster");
        g.setParent("b", "cluster");
        assertEquals("cluster", g.parent("a"));
        assertEquals(Arrays.asList("a", "b"), g.children("cluster"));
        assertTrue(g.hasChildren("cluster"));
        assertEquals(Arrays.asList("cluster"), g.children(null));

        g.setParent("b", null);
        assertNull(g.parent("b"));
        assertEquals(Arrays.asList("cluster", "b"), g.children(null));
    }

    @Test
    public void testRemovingClusterLiftsChildren() {
        g.setNode("cluster");
        g.setNode("a");
        g.setParent("a", "cluster");
        g.removeNode("cluster");
        assertNull(g.parent("a"));
        assertEquals(Arrays.asList("a"), g.children(null));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParentCycleRejected() {
        g.setNode("a");
        g.setNode("b");
        g.setParent("b", "a");
        g.setParent("a", "b");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParentOnFlatGraphRejected() {
        LayoutGraph flat = new LayoutGraph(true, false);
        flat.setNode("a", new NodeLabel());
        flat.setNode("b", new NodeLabel());
        flat.setParent("a", "b");
    }

    @Test
    public void testCopySharesLabelsButNotStructure() {
        g.setPath("a", "b");
        LayoutGraph copy = g.copy();
        copy.removeEdge("a", "b");
        assertTrue(g.hasEdge("a", "b"));
        assertSame(g.node("a"), copy.node("a"));
    }

    @Test
    public void testEdgeKeyOrderingPutsUnnamedFirst() {
        List<EdgeKey> keys = Arrays.asList(EdgeKey.of("a", "b", "z"), EdgeKey.of("a", "b"), EdgeKey.of("a", "a"));
        keys.sort(EdgeKey.ORDER);
        assertEquals(EdgeKey.of("a", "a"), keys.get(0));
        assertEquals(EdgeKey.of("a", "b"), keys.get(1));
        assertEquals("a->b[z]", keys.get(2).toString());
    }
}
