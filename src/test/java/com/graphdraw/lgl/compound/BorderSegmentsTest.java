package com.graphdraw.lgl.compound;

import com.graphdraw.lgl.api.DummyKind;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class BorderSegmentsTest {

    private LayoutGraph g;
    private LayoutContext ctx;

    @Before
    public void setUp() {
        g = new LayoutGraph();
        ctx = new LayoutContext(1);
    }

    private NodeLabel cluster(String v, int minRank, int maxRank) {
        NodeLabel label = new NodeLabel();
        label.setMinRank(minRank);
        label.setMaxRank(maxRank);
        g.setNode(v, label);
        return label;
    }

    @Test
    public void testLeafNodesGetNoBorders() {
        g.setNode("a", NodeLabel.of(10, 10));
        BorderSegments.add(g, ctx);
        assertEquals(1, g.nodeCount());
        assertNull(g.node("a").getBorderLeft());
    }

    @Test
    public void testAddsOneBorderPairPerRank() {
        NodeLabel sg = cluster("sg", 1, 3);
        g.setNode("a", NodeLabel.of(10, 10));
        g.setParent("a", "sg");
        BorderSegments.add(g, ctx);

        Map<Integer, String> left = sg.getBorderLeft();
        Map<Integer, String> right = sg.getBorderRight();
        assertEquals(3, left.size());
        assertEquals(3, right.size());
        for (int rank = 1; rank <= 3; rank++) {
            NodeLabel l = g.node(left.get(rank));
            NodeLabel r = g.node(right.get(rank));
            assertEquals(DummyKind.BORDER_LEFT, l.getDummy());
            assertEquals(DummyKind.BORDER_RIGHT, r.getDummy());
            assertEquals(rank, l.getRank().intValue());
            assertEquals(rank, r.getRank().intValue());
            assertEquals("sg", g.parent(left.get(rank)));
            assertEquals("sg", g.parent(right.get(rank)));
        }
        assertTrue(g.hasEdge(left.get(1), left.get(2)));
        assertTrue(g.hasEdge(left.get(2), left.get(3)));
        assertTrue(g.hasEdge(right.get(1), right.get(2)));
        assertTrue(g.hasEdge(right.get(2), right.get(3)));
    }

    @Test
    public void testNestedClustersGetTheirOwnBorders() {
        NodeLabel outer = cluster("outer", 0, 4);
        NodeLabel inner = cluster("inner", 1, 2);
        g.setNode("a", NodeLabel.of(10, 10));
        g.setParent("inner", "outer");
        g.setParent("a", "inner");
        BorderSegments.add(g, ctx);

        assertEquals(5, outer.getBorderLeft().size());
        assertEquals(2, inner.getBorderLeft().size());
        assertEquals("inner", g.parent(inner.getBorderRight().get(2)));
    }

    @Test
    public void testRemoveDerivesClusterBox() {
        NodeLabel sg = cluster("sg", 1, 2);
        g.setNode("a", NodeLabel.of(10, 10));
        g.setParent("a", "sg");
        BorderSegments.add(g, ctx);

        NodeLabel top = NodeLabel.dummy(DummyKind.BORDER_TOP);
        top.setX(60.0);
        top.setY(0.0);
        g.setNode("_bt", top);
        g.setParent("_bt", "sg");
        NodeLabel bottom = NodeLabel.dummy(DummyKind.BORDER_BOTTOM);
        bottom.setX(60.0);
        bottom.setY(100.0);
        g.setNode("_bb", bottom);
        g.setParent("_bb", "sg");
        sg.setBorderTop("_bt");
        sg.setBorderBottom("_bb");
        for (int rank = 1; rank <= 2; rank++) {
            g.node(sg.getBorderLeft().get(rank)).setX(10.0);
            g.node(sg.getBorderRight().get(rank)).setX(110.0);
        }

        BorderSegments.remove(g);

        assertEquals(100.0, sg.getWidth(), 0.0);
        assertEquals(100.0, sg.getHeight(), 0.0);
        assertEquals(60.0, sg.getX(), 0.0);
        assertEquals(50.0, sg.getY(), 0.0);
        assertEquals(2, g.nodeCount());
        assertTrue(g.hasNode("a"));
        assertTrue(g.hasNode("sg"));
    }
}
