package com.graphdraw.lgl.finish;

import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;
import com.graphdraw.lgl.core.Point;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class TranslationTest {

    private LayoutGraph g;

    @Before
    public void setUp() {
        g = new LayoutGraph();
    }

    private NodeLabel node(String v, double x, double y, double width, double height) {
        NodeLabel label = NodeLabel.of(width, height);
        label.setX(x);
        label.setY(y);
        g.setNode(v, label);
        return label;
    }

    @Test
    public void testEmptyGraphIsJustMargins() {
        g.config().setMarginx(5);
        g.config().setMarginy(7);
        Translation.translate(g);
        assertEquals(10.0, g.config().getWidth(), 0.0);
        assertEquals(14.0, g.config().getHeight(), 0.0);
    }

    @Test
    public void testShiftsNodesOntoMargins() {
        g.config().setMarginx(5);
        g.config().setMarginy(7);
        node("a", 0, 0, 10, 20);
        node("b", 50, 100, 30, 10);
        Translation.translate(g);

        assertEquals(10.0, g.node("a").getX(), 0.0);
        assertEquals(17.0, g.node("a").getY(), 0.0);
        assertEquals(60.0, g.node("b").getX(), 0.0);
        assertEquals(117.0, g.node("b").getY(), 0.0);
        assertEquals(80.0, g.config().getWidth(), 0.0);
        assertEquals(129.0, g.config().getHeight(), 0.0);
    }

    @Test
    public void testZeroMarginPutsBoxAtOrigin() {
        node("a", -40, -40, 20, 20);
        node("b", 40, 40, 20, 20);
        Translation.translate(g);
        assertEquals(0.0, g.node("a").getX() - g.node("a").getWidth() / 2, 0.0);
        assertEquals(0.0, g.node("a").getY() - g.node("a").getHeight() / 2, 0.0);
        assertEquals(100.0, g.config().getWidth(), 0.0);
        assertEquals(100.0, g.config().getHeight(), 0.0);
    }

    @Test
    public void testEdgeLabelsCountAndPointsMove() {
        node("a", 0, 0, 10, 10);
        node("b", 0, 100, 10, 10);
        EdgeLabel edge = EdgeLabel.labelled(10, 4);
        edge.setX(-20.0);
        edge.setY(50.0);
        edge.setPoints(new ArrayList<>(Arrays.asList(new Point(0, 50))));
        g.setEdge("a", "b", edge);
        Translation.translate(g);

        assertEquals(5.0, edge.getX(), 0.0);
        assertEquals(25.0, g.node("a").getX(), 0.0);
        assertEquals(new Point(25, 55), edge.getPoints().get(0));
        assertEquals(30.0, g.config().getWidth(), 0.0);
    }
}
