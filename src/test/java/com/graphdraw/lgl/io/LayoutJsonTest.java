package com.graphdraw.lgl.io;

import com.graphdraw.lgl.LayeredLayout;
import com.graphdraw.lgl.api.Acyclicer;
import com.graphdraw.lgl.api.Direction;
import com.graphdraw.lgl.api.LabelPosition;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutGraph;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Test;

import static org.junit.Assert.*;

public class LayoutJsonTest {

    private static Path fixture(String name) throws Exception {
        return Paths.get(LayoutJsonTest.class.getResource("/fixtures/" + name).toURI());
    }

    @Test
    public void testParsesFixture() throws Exception {
        LayoutDefinition def = LayoutJson.parseFile(fixture("cluster.json"));
        assertEquals("LR", def.getConfig().getRankdir());
        assertEquals(40.0, def.getConfig().getNodesep(), 0.0);
        assertNull(def.getConfig().getEdgesep());
        assertEquals(5, def.getNodes().size());
        assertEquals(5, def.getEdges().size());
        assertEquals("work", def.getNodes().get(2).getParent());
    }

    @Test
    public void testBuildsGraphFromDefinition() throws Exception {
        LayoutGraph g = LayoutJson.toGraph(LayoutJson.parseFile(fixture("cluster.json")));

        assertEquals(Direction.LR, g.config().getDirection());
        assertEquals(Acyclicer.GREEDY, g.config().getAcyclicer());
        assertEquals(60.0, g.config().getRanksep(), 0.0);
        assertEquals(20.0, g.config().getEdgesep(), 0.0);
        assertEquals("work", g.parent("parse"));
        assertEquals("work", g.parent("check"));
        assertNull(g.parent("start"));

        EdgeLabel labelled = g.edge("parse", "check");
        assertEquals(LabelPosition.C, labelled.getLabelpos());
        assertEquals(40.0, labelled.getWidth(), 0.0);
        assertEquals(2.0, g.edge("check", "parse", "retry").getWeight(), 0.0);
        assertEquals(2, g.edge("check", "end").getMinlen());
        assertEquals(LabelPosition.R, g.edge("start", "parse").getLabelpos());
        assertTrue(g.hasEdge("end", "end"));
    }

    @Test
    public void testEmptyDocument() throws Exception {
        LayoutGraph g = LayoutJson.read("{}");
        assertEquals(0, g.nodeCount());
        assertEquals(Direction.TB, g.config().getDirection());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNode() throws Exception {
        LayoutJson.read("{\"nodes\":[{\"id\":\"a\"},{\"id\":\"a\"}]}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNodeWithoutId() throws Exception {
        LayoutJson.read("{\"nodes\":[{\"width\":10}]}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEndpoint() throws Exception {
        LayoutJson.read("{\"nodes\":[{\"id\":\"a\"}],\"edges\":[{\"v\":\"a\",\"w\":\"b\"}]}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownDirection() throws Exception {
        LayoutJson.read("{\"config\":{\"rankdir\":\"diagonal\"}}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownParent() throws Exception {
        LayoutJson.read("{\"nodes\":[{\"id\":\"a\",\"parent\":\"nowhere\"}]}");
    }

    @Test
    public void testSnapshotOfLaidOutFixture() throws Exception {
        LayoutGraph g = LayoutJson.toGraph(LayoutJson.parseFile(fixture("cluster.json")));
        LayeredLayout.layout(g);

        String json = LayoutJson.writeSnapshot(g);
        LayoutSnapshot snapshot = LayoutJson.readSnapshot(json);

        assertEquals(g.config().getWidth(), snapshot.getWidth(), 0.0);
        assertTrue(snapshot.getWidth() > 0);
        assertEquals(5, snapshot.getNodes().size());
        assertEquals(5, snapshot.getEdges().size());
        for (LayoutSnapshot.NodeGeometry n : snapshot.getNodes()) {
            assertNotNull(n.getId(), n.getX());
            assertNotNull(n.getId(), n.getY());
        }
        LayoutSnapshot.NodeGeometry work = snapshot.getNodes().get(1);
        assertEquals("work", work.getId());
        assertTrue(work.getWidth() > 0);
        for (LayoutSnapshot.EdgeGeometry e : snapshot.getEdges())
            assertTrue(e.getV() + "->" + e.getW(), e.getPoints().size() >= 3);
    }
}
