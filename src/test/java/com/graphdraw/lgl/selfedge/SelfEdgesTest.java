package com.graphdraw.lgl.selfedge;

import com.graphdraw.lgl.api.Direction;
import com.graphdraw.lgl.api.DummyKind;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;
import com.graphdraw.lgl.core.Point;

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class SelfEdgesTest {

    private LayoutGraph g;
    private LayoutContext ctx;

    @Before
    public void setUp() {
        g = new LayoutGraph();
        ctx = new LayoutContext(1);
    }

    private NodeLabel node(String v, int rank, int order) {
        NodeLabel label = NodeLabel.of(10, 20);
        label.setRank(rank);
        label.setOrder(order);
        g.setNode(v, label);
        return label;
    }

    private String selfEdgeDummy() {
        List<String> dummies = g.filterNodes(v -> g.node(v).getDummy() == DummyKind.SELF_EDGE);
        assertEquals(1, dummies.size());
        return dummies.get(0);
    }

    @Test
    public void testRemoveParksLoopsOnOwner() {
        node("a", 0, 0);
        node("b", 1, 0);
        g.setEdge("a", "a", EdgeLabel.labelled(20, 5), "loop");
        g.setEdge("a", "b");
        SelfEdges.remove(g);

        assertEquals(1, g.edgeCount());
        assertTrue(g.hasEdge("a", "b"));
        assertEquals(1, g.node("a").getSelfEdges().size());
        assertEquals(EdgeKey.of("a", "a", "loop"), g.node("a").getSelfEdges().get(0).edge());
        assertEquals(20.0, g.node("a").getSelfEdges().get(0).label().getWidth(), 0.0);
    }

    @Test
    public void testInsertPlacesDummyRightOfOwner() {
        node("a", 0, 0);
        node("b", 0, 1);
        g.setEdge("a", "a", EdgeLabel.labelled(20, 5));
        SelfEdges.remove(g);
        SelfEdges.insert(g, ctx);

        String dummy = selfEdgeDummy();
        NodeLabel label = g.node(dummy);
        assertEquals(0, label.getRank().intValue());
        assertEquals(1, label.getOrder().intValue());
        assertEquals(20.0, label.getWidth(), 0.0);
        assertEquals(5.0, label.getHeight(), 0.0);
        assertEquals(0, g.node("a").getOrder().intValue());
        assertEquals(2, g.node("b").getOrder().intValue());
        assertTrue(g.node("a").getSelfEdges().isEmpty());
    }

    @Test
    public void testInsertSwapsLabelSizeForHorizontalLayouts() {
        g.config().setDirection(Direction.LR);
        node("a", 0, 0);
        g.setEdge("a", "a", EdgeLabel.labelled(20, 5));
        SelfEdges.remove(g);
        SelfEdges.insert(g, ctx);

        NodeLabel label = g.node(selfEdgeDummy());
        assertEquals(5.0, label.getWidth(), 0.0);
        assertEquals(20.0, label.getHeight(), 0.0);
    }

    @Test
    public void testPositionDrawsLoopAroundDummy() {
        NodeLabel a = node("a", 0, 0);
        g.setEdge("a", "a", EdgeLabel.labelled(20, 5));
        SelfEdges.remove(g);
        SelfEdges.insert(g, ctx);
        a.setX(0.0);
        a.setY(0.0);
        String dummy = selfEdgeDummy();
        g.node(dummy).setX(20.0);
        g.node(dummy).setY(0.0);

        SelfEdges.position(g);

        assertFalse(g.hasNode(dummy));
        EdgeLabel loop = g.edge("a", "a");
        assertNotNull(loop);
        assertEquals(Arrays.asList(
                new Point(15, -10),
                new Point(17.5, -10),
                new Point(20, 0),
                new Point(17.5, 10),
                new Point(15, 10)), loop.getPoints());
        assertEquals(20.0, loop.getX(), 0.0);
        assertEquals(0.0, loop.getY(), 0.0);
    }
}
