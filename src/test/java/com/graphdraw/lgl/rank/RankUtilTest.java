package com.graphdraw.lgl.rank;

import com.graphdraw.lgl.api.RankerKind;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class RankUtilTest {

    private LayoutGraph g;

    @Before
    public void setUp() {
        g = new LayoutGraph(true, false);
        g.setDefaultNodeLabel(NodeLabel::new);
    }

    @Test
    public void testLongestPathPutsSinksOnZero() {
        g.setPath("a", "b", "c");
        g.setEdge("a", "c", EdgeLabel.of(3, 1));
        RankUtil.longestPath(g);
        assertEquals(0, (int) g.node("c").getRank());
        assertEquals(-1, (int) g.node("b").getRank());
        assertEquals(-3, (int) g.node("a").getRank());
        for (EdgeKey e : g.edges())
            assertTrue(RankUtil.slack(g, e) >= 0);
    }

    @Test
    public void testNormalizeRanksIsIdempotent() {
        g.setNode("a", ranked(-3));
        g.setNode("b", ranked(-1));
        g.setNode("c", ranked(2));
        RankUtil.normalizeRanks(g);
        assertEquals(0, (int) g.node("a").getRank());
        assertEquals(2, (int) g.node("b").getRank());
        assertEquals(5, (int) g.node("c").getRank());
        RankUtil.normalizeRanks(g);
        assertEquals(0, (int) g.node("a").getRank());
        assertEquals(5, (int) g.node("c").getRank());
    }

    @Test
    public void testRemoveEmptyRanksKeepsFactorMultiples() {
        g.setNode("a", ranked(0));
        g.setNode("b", ranked(4));
        g.setNode("c", ranked(7));
        LayoutContext ctx = new LayoutContext(1);
        ctx.setNodeRankFactor(4);
        RankUtil.removeEmptyRanks(g, ctx);
        assertEquals(0, (int) g.node("a").getRank());
        assertEquals(1, (int) g.node("b").getRank());
        assertEquals(2, (int) g.node("c").getRank());
    }

    @Test
    public void testRankerCapIsDerivedFromGraphSize() {
        assertEquals(1000, Ranker.derivedIterationCap(0, 3, 2));
        assertEquals(25_000, Ranker.derivedIterationCap(0, 50, 50));
        assertEquals(1_000_000, Ranker.derivedIterationCap(0, 10_000, 10_000));
        assertEquals(7, Ranker.derivedIterationCap(7, 10_000, 10_000));
    }

    @Test
    public void testLongestPathRanker() {
        g.setPath("a", "b", "d");
        g.setEdge("a", "c");
        g.setEdge("c", "d", EdgeLabel.of(2, 1));
        g.config().setRanker(RankerKind.LONGEST_PATH);
        Ranker.rank(g, 100);
        RankUtil.normalizeRanks(g);
        assertEquals(0, (int) g.node("a").getRank());
        assertEquals(3, (int) g.node("d").getRank());
    }

    private static NodeLabel ranked(int rank) {
        NodeLabel label = new NodeLabel();
        label.setRank(rank);
        return label;
    }
}
