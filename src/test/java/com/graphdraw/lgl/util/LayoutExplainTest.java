package com.graphdraw.lgl.util;

import com.graphdraw.lgl.api.DummyKind;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class LayoutExplainTest {

    private LayoutGraph g;
    private LayoutExplain explain;

    @Before
    public void setUp() {
        g = new LayoutGraph();
        NodeLabel a = NodeLabel.of(10, 20);
        a.setRank(0);
        a.setOrder(0);
        g.setNode("a", a);
        NodeLabel d = NodeLabel.dummy(DummyKind.EDGE);
        d.setRank(1);
        d.setOrder(0);
        g.setNode("_d1", d);
        NodeLabel b = NodeLabel.of(10, 20);
        b.setRank(2);
        b.setOrder(0);
        g.setNode("b", b);
        g.setPath("a", "_d1", "b");
        explain = new LayoutExplain(g);
    }

    @Test
    public void testLayersTagDummies() {
        String layers = explain.explainLayers();
        assertTrue(layers.contains("rank   0: a"));
        assertTrue(layers.contains("rank   1: _d1[EDGE]"));
        assertTrue(layers.contains("rank   2: b"));
    }

    @Test
    public void testExplainNode() {
        String text = explain.explainNode("a");
        assertTrue(text.contains("Node: a"));
        assertTrue(text.contains("Kind: NODE"));
        assertTrue(text.contains("Successors (1): _d1"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNode() {
        explain.explainNode("zzz");
    }

    @Test
    public void testExplainEdge() {
        String text = explain.explainEdge(EdgeKey.of("a", "_d1"));
        assertTrue(text.contains("minlen/weight: 1/1.0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEdge() {
        explain.explainEdge(EdgeKey.of("b", "a"));
    }

    @Test
    public void testExplainGraph() {
        String text = explain.explainGraph();
        assertTrue(text.contains("Direction: TB"));
        assertTrue(text.contains("Nodes: 3, Edges: 2"));
    }
}
