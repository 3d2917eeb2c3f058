package com.graphdraw.lgl.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphdraw.lgl.api.Acyclicer;
import com.graphdraw.lgl.api.Alignment;
import com.graphdraw.lgl.api.Direction;
import com.graphdraw.lgl.api.LabelPosition;
import com.graphdraw.lgl.api.RankerKind;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.GraphConfig;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;
import com.graphdraw.lgl.core.Point;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON interchange for layout graphs: definitions in, geometry snapshots out.
 */
public final class LayoutJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LayoutJson() {
        // Utility class
    }

    public static LayoutDefinition parse(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, LayoutDefinition.class);
    }

    public static LayoutDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses {@code json} and builds the graph it describes. */
    public static LayoutGraph read(String json) throws JsonProcessingException {
        return toGraph(parse(json));
    }

    /**
     * Builds a compound multigraph from a definition.
     *
     * @throws IllegalArgumentException on duplicate nodes, unknown endpoints or
     *                                  parents, or unknown strategy names.
     */
    public static LayoutGraph toGraph(LayoutDefinition def) {
        LayoutGraph g = new LayoutGraph();
        if (def.getConfig() != null)
            applyConfig(def.getConfig(), g.config());

        List<LayoutDefinition.NodeDef> nodes = def.getNodes() == null ? List.of() : def.getNodes();
        for (LayoutDefinition.NodeDef n : nodes) {
            if (n.getId() == null)
                throw new IllegalArgumentException("Node without id");
            if (g.hasNode(n.getId()))
                throw new IllegalArgumentException("Duplicate node: " + n.getId());
            g.setNode(n.getId(), NodeLabel.of(n.getWidth(), n.getHeight()));
        }
        for (LayoutDefinition.NodeDef n : nodes) {
            if (n.getParent() != null)
                g.setParent(n.getId(), n.getParent());
        }

        if (def.getEdges() != null) {
            for (LayoutDefinition.EdgeDef e : def.getEdges()) {
                EdgeLabel label = new EdgeLabel();
                if (e.getMinlen() != null)
                    label.setMinlen(e.getMinlen());
                if (e.getWeight() != null)
                    label.setWeight(e.getWeight());
                label.setWidth(e.getWidth());
                label.setHeight(e.getHeight());
                if (e.getLabelpos() != null)
                    label.setLabelpos(LabelPosition.fromString(e.getLabelpos()));
                if (e.getLabeloffset() != null)
                    label.setLabeloffset(e.getLabeloffset());
                g.setEdge(e.getV(), e.getW(), label, e.getName());
            }
        }
        return g;
    }

    private static void applyConfig(LayoutDefinition.ConfigDef c, GraphConfig config) {
        if (c.getRankdir() != null)
            config.setDirection(Direction.fromString(c.getRankdir()));
        if (c.getAcyclicer() != null)
            config.setAcyclicer(Acyclicer.fromString(c.getAcyclicer()));
        if (c.getRanker() != null)
            config.setRanker(RankerKind.fromString(c.getRanker()));
        if (c.getAlign() != null)
            config.setAlign(Alignment.fromString(c.getAlign()));
        if (c.getNodesep() != null)
            config.setNodesep(c.getNodesep());
        if (c.getRanksep() != null)
            config.setRanksep(c.getRanksep());
        if (c.getEdgesep() != null)
            config.setEdgesep(c.getEdgesep());
        if (c.getMarginx() != null)
            config.setMarginx(c.getMarginx());
        if (c.getMarginy() != null)
            config.setMarginy(c.getMarginy());
        if (c.getTranspose() != null)
            config.setTranspose(c.getTranspose());
        if (c.getDisableOptimalOrderHeuristic() != null)
            config.setDisableOptimalOrderHeuristic(c.getDisableOptimalOrderHeuristic());
        if (c.getMaxOrderSweeps() != null)
            config.setMaxOrderSweeps(c.getMaxOrderSweeps());
        if (c.getMaxSimplexIterations() != null)
            config.setMaxSimplexIterations(c.getMaxSimplexIterations());
    }

    public static LayoutSnapshot snapshot(LayoutGraph g) {
        LayoutSnapshot s = new LayoutSnapshot();
        s.setWidth(g.config().getWidth());
        s.setHeight(g.config().getHeight());

        List<LayoutSnapshot.NodeGeometry> nodes = new ArrayList<>();
        for (String v : g.nodes()) {
            NodeLabel label = g.node(v);
            LayoutSnapshot.NodeGeometry n = new LayoutSnapshot.NodeGeometry();
            n.setId(v);
            n.setParent(g.parent(v));
            n.setX(label.getX());
            n.setY(label.getY());
            n.setWidth(label.getWidth());
            n.setHeight(label.getHeight());
            n.setRank(label.getRank());
            n.setOrder(label.getOrder());
            nodes.add(n);
        }
        s.setNodes(nodes);

        List<LayoutSnapshot.EdgeGeometry> edges = new ArrayList<>();
        for (EdgeKey e : g.edges()) {
            EdgeLabel label = g.edge(e);
            LayoutSnapshot.EdgeGeometry eg = new LayoutSnapshot.EdgeGeometry();
            eg.setV(e.v());
            eg.setW(e.w());
            eg.setName(e.name());
            eg.setX(label.getX());
            eg.setY(label.getY());
            List<double[]> points = new ArrayList<>();
            for (Point p : label.getPoints())
                points.add(new double[] { p.x(), p.y() });
            eg.setPoints(points);
            edges.add(eg);
        }
        s.setEdges(edges);
        return s;
    }

    /** Pretty-printed JSON of the geometry of {@code g}. */
    public static String writeSnapshot(LayoutGraph g) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot(g));
    }

    public static LayoutSnapshot readSnapshot(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, LayoutSnapshot.class);
    }
}
