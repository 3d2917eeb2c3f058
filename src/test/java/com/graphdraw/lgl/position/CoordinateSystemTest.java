package com.graphdraw.lgl.position;

import com.graphdraw.lgl.api.Direction;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;
import com.graphdraw.lgl.core.Point;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class CoordinateSystemTest {

    private LayoutGraph g;

    @Before
    public void setUp() {
        g = new LayoutGraph();
        g.setNode("a", NodeLabel.of(100, 200));
        g.setNode("b", NodeLabel.of(10, 10));
        g.setEdge("a", "b", EdgeLabel.labelled(30, 40));
    }

    private void place() {
        g.node("a").setX(1.0);
        g.node("a").setY(2.0);
        EdgeLabel edge = g.edge("a", "b");
        edge.setPoints(new ArrayList<>(Arrays.asList(new Point(3, 4), new Point(5, 6))));
        edge.setX(7.0);
        edge.setY(8.0);
    }

    @Test
    public void testAdjustKeepsTopToBottom() {
        CoordinateSystem.adjust(g);
        assertEquals(100.0, g.node("a").getWidth(), 0.0);
        assertEquals(200.0, g.node("a").getHeight(), 0.0);
        assertEquals(30.0, g.edge("a", "b").getWidth(), 0.0);
    }

    @Test
    public void testAdjustSwapsSizesForLeftToRight() {
        g.config().setDirection(Direction.LR);
        CoordinateSystem.adjust(g);
        assertEquals(200.0, g.node("a").getWidth(), 0.0);
        assertEquals(100.0, g.node("a").getHeight(), 0.0);
        assertEquals(40.0, g.edge("a", "b").getWidth(), 0.0);
        assertEquals(30.0, g.edge("a", "b").getHeight(), 0.0);
    }

    @Test
    public void testUndoMirrorsBottomToTop() {
        g.config().setDirection(Direction.BT);
        CoordinateSystem.adjust(g);
        place();
        CoordinateSystem.undo(g);
        assertEquals(1.0, g.node("a").getX(), 0.0);
        assertEquals(-2.0, g.node("a").getY(), 0.0);
        EdgeLabel edge = g.edge("a", "b");
        assertEquals(Arrays.asList(new Point(3, -4), new Point(5, -6)), edge.getPoints());
        assertEquals(7.0, edge.getX(), 0.0);
        assertEquals(-8.0, edge.getY(), 0.0);
        assertEquals(100.0, g.node("a").getWidth(), 0.0);
    }

    @Test
    public void testUndoSwapsAxesForLeftToRight() {
        g.config().setDirection(Direction.LR);
        CoordinateSystem.adjust(g);
        place();
        CoordinateSystem.undo(g);
        assertEquals(2.0, g.node("a").getX(), 0.0);
        assertEquals(1.0, g.node("a").getY(), 0.0);
        EdgeLabel edge = g.edge("a", "b");
        assertEquals(Arrays.asList(new Point(4, 3), new Point(6, 5)), edge.getPoints());
        assertEquals(8.0, edge.getX(), 0.0);
        assertEquals(7.0, edge.getY(), 0.0);
        assertEquals(100.0, g.node("a").getWidth(), 0.0);
        assertEquals(200.0, g.node("a").getHeight(), 0.0);
        assertEquals(30.0, edge.getWidth(), 0.0);
    }

    @Test
    public void testUndoRightToLeftMirrorsThenSwaps() {
        g.config().setDirection(Direction.RL);
        CoordinateSystem.adjust(g);
        place();
        CoordinateSystem.undo(g);
        assertEquals(-2.0, g.node("a").getX(), 0.0);
        assertEquals(1.0, g.node("a").getY(), 0.0);
        assertEquals(new Point(-4, 3), g.edge("a", "b").getPoints().get(0));
    }
}
