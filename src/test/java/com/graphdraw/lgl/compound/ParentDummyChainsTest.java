package com.graphdraw.lgl.compound;

import com.graphdraw.lgl.api.DummyKind;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ParentDummyChainsTest {

    private LayoutGraph g;
    private LayoutContext ctx;

    @Before
    public void setUp() {
        g = new LayoutGraph();
        ctx = new LayoutContext(1);
    }

    private void node(String v, int rank) {
        NodeLabel label = NodeLabel.of(10, 10);
        label.setRank(rank);
        g.setNode(v, label);
    }

    private void cluster(String v, int minRank, int maxRank) {
        NodeLabel label = new NodeLabel();
        label.setMinRank(minRank);
        label.setMaxRank(maxRank);
        g.setNode(v, label);
    }

    /** Chain a -> d1 -> ... -> b standing in for the normalized edge a -> b. */
    private void chain(String... dummies) {
        String prev = "a";
        int rank = g.node("a").getRank();
        for (String d : dummies) {
            NodeLabel label = NodeLabel.dummy(DummyKind.EDGE);
            label.setRank(++rank);
            label.setEdgeObj(EdgeKey.of("a", "b"));
            g.setNode(d, label);
            g.setEdge(prev, d);
            prev = d;
        }
        g.setEdge(prev, "b");
        ctx.dummyChains().add(dummies[0]);
    }

    @Test
    public void testTopLevelEdgeStaysTopLevel() {
        node("a", 0);
        node("b", 2);
        chain("d1");
        ParentDummyChains.run(g, ctx);
        assertNull(g.parent("d1"));
    }

    @Test
    public void testUsesTailClusterWhileItSpansTheRank() {
        cluster("sg1", 0, 2);
        node("a", 0);
        node("b", 2);
        g.setParent("a", "sg1");
        chain("d1");
        ParentDummyChains.run(g, ctx);
        assertEquals("sg1", g.parent("d1"));
    }

    @Test
    public void testUsesHeadClusterWhenTailIsTopLevel() {
        cluster("sg1", 1, 3);
        node("a", 0);
        node("b", 2);
        g.setParent("b", "sg1");
        chain("d1");
        ParentDummyChains.run(g, ctx);
        assertEquals("sg1", g.parent("d1"));
    }

    @Test
    public void testClimbsOutOfTailClusterPastItsLastRank() {
        cluster("sg1", 0, 1);
        node("a", 0);
        node("b", 3);
        g.setParent("a", "sg1");
        chain("d1", "d2");
        ParentDummyChains.run(g, ctx);
        assertEquals("sg1", g.parent("d1"));
        assertNull(g.parent("d2"));
    }

    @Test
    public void testDescendsIntoHeadCluster() {
        cluster("sg1", 0, 1);
        cluster("sg2", 3, 5);
        node("a", 0);
        node("b", 5);
        g.setParent("a", "sg1");
        g.setParent("b", "sg2");
        chain("d1", "d2", "d3", "d4");
        ParentDummyChains.run(g, ctx);
        assertEquals("sg1", g.parent("d1"));
        assertNull(g.parent("d2"));
        assertEquals("sg2", g.parent("d3"));
        assertEquals("sg2", g.parent("d4"));
    }
}
