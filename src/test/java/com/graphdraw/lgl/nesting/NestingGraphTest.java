package com.graphdraw.lgl.nesting;

import com.graphdraw.lgl.api.DummyKind;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class NestingGraphTest {

    private LayoutGraph g;
    private LayoutContext ctx;

    @Before
    public void setUp() {
        g = new LayoutGraph();
        g.setDefaultNodeLabel(NodeLabel::new);
        ctx = new LayoutContext(1);
    }

    @Test
    public void testFlatGraphGetsRootConnectorsOnly() {
        g.setPath("a", "b");
        NestingGraph.run(g, ctx);

        String root = ctx.nestingRoot();
        assertNotNull(root);
        assertEquals(DummyKind.NESTING_ROOT, g.node(root).getDummy());
        assertTrue(g.hasEdge(root, "a"));
        assertTrue(g.hasEdge(root, "b"));
        assertEquals(0.0, g.edge(root, "a").getWeight(), 0.0);
        assertEquals(1, g.edge("a", "b").getMinlen());
        assertEquals(1, ctx.nodeRankFactor());
    }

    @Test
    public void testClusterGetsBorderNodes() {
        g.setNode("sg");
        g.setNode("a");
        g.setParent("a", "sg");
        NestingGraph.run(g, ctx);

        NodeLabel sg = g.node("sg");
        assertNotNull(sg.getBorderTop());
        assertNotNull(sg.getBorderBottom());
        assertEquals(DummyKind.BORDER_TOP, g.node(sg.getBorderTop()).getDummy());
        assertEquals(DummyKind.BORDER_BOTTOM, g.node(sg.getBorderBottom()).getDummy());
        assertEquals("sg", g.parent(sg.getBorderTop()));
        assertTrue(g.hasEdge(sg.getBorderTop(), "a"));
        assertTrue(g.hasEdge("a", sg.getBorderBottom()));
        assertTrue(g.hasEdge(ctx.nestingRoot(), sg.getBorderTop()));
    }

    @Test
    public void testMinlenScaledByNodeSeparation() {
        g.setNode("sg");
        g.setNode("a");
        g.setNode("b");
        g.setParent("a", "sg");
        g.setEdge("a", "b");
        NestingGraph.run(g, ctx);
        // depth 2 hierarchy: height 1, node separation 3
        assertEquals(3, ctx.nodeRankFactor());
        assertEquals(3, g.edge("a", "b").getMinlen());
    }

    @Test
    public void testCleanupRemovesRootAndNestingEdges() {
        g.setNode("sg");
        g.setNode("a");
        g.setParent("a", "sg");
        g.setNode("b");
        g.setEdge("a", "b");
        NestingGraph.run(g, ctx);
        String root = ctx.nestingRoot();
        String top = g.node("sg").getBorderTop();

        NestingGraph.cleanup(g, ctx);
        assertFalse(g.hasNode(root));
        assertNull(ctx.nestingRoot());
        assertTrue(g.hasNode(top));
        for (EdgeKey e : g.edges())
            assertFalse(g.edge(e).isNestingEdge());
        assertTrue(g.hasEdge("a", "b"));
    }
}
