package com.graphdraw.lgl.normalize;

import com.graphdraw.lgl.api.DummyKind;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.core.NodeLabel;
import com.graphdraw.lgl.core.Point;

import java.util.ArrayList;

import lombok.extern.log4j.Log4j2;

/**
 * Splits every edge that spans more than one rank into a chain of unit-length
 * edges through dummy nodes, one dummy per intermediate rank.
 *
 * The dummy on the edge's label rank becomes an {@link DummyKind#EDGE_LABEL}
 * node sized like the label, so ordering and positioning reserve room for it.
 * The first dummy of each chain is recorded on the context; {@link #undo}
 * walks the chains to turn dummy coordinates into edge waypoints.
 */
@Log4j2
public final class Normalizer {

    private Normalizer() {
    }

    public static void run(LayoutGraph g, LayoutContext ctx) {
        ctx.dummyChains().clear();
        for (EdgeKey e : g.edges())
            normalizeEdge(g, ctx, e);
        log.debug("Normalized {} long edges", ctx.dummyChains().size());
    }

    private static void normalizeEdge(LayoutGraph g, LayoutContext ctx, EdgeKey e) {
        String v = e.v();
        int vRank = g.node(v).getRank();
        String w = e.w();
        int wRank = g.node(w).getRank();
        EdgeLabel edgeLabel = g.edge(e);
        Integer labelRank = edgeLabel.getLabelRank();

        if (wRank == vRank + 1)
            return;

        g.removeEdge(e);
        edgeLabel.setPoints(new ArrayList<>());
        int i = 0;
        for (++vRank; vRank < wRank; ++i, ++vRank) {
            NodeLabel attrs = new NodeLabel();
            attrs.setEdgeLabel(edgeLabel);
            attrs.setEdgeObj(e);
            attrs.setRank(vRank);
            DummyKind kind = DummyKind.EDGE;
            if (labelRank != null && vRank == labelRank) {
                attrs.setWidth(edgeLabel.getWidth());
                attrs.setHeight(edgeLabel.getHeight());
                attrs.setLabelpos(edgeLabel.getLabelpos());
                kind = DummyKind.EDGE_LABEL;
            }
            String dummy = ctx.addDummyNode(g, kind, attrs, "_d");
            g.setEdge(EdgeKey.of(v, dummy, e.name()), EdgeLabel.of(1, edgeLabel.getWeight()));
            if (i == 0)
                ctx.dummyChains().add(dummy);
            v = dummy;
        }
        g.setEdge(EdgeKey.of(v, w, e.name()), EdgeLabel.of(1, edgeLabel.getWeight()));
    }

    /**
     * Removes the dummy chains and restores the original edges. Dummy
     * coordinates become the edge's points; the label dummy's box becomes the
     * label position.
     */
    public static void undo(LayoutGraph g, LayoutContext ctx) {
        for (String start : ctx.dummyChains()) {
            String v = start;
            NodeLabel node = g.node(v);
            EdgeLabel origLabel = node.getEdgeLabel();
            g.setEdge(node.getEdgeObj(), origLabel);
            while (isChainNode(node)) {
                String w = g.successors(v).get(0);
                g.removeNode(v);
                origLabel.getPoints().add(new Point(node.getX(), node.getY()));
                if (node.getDummy() == DummyKind.EDGE_LABEL) {
                    origLabel.setX(node.getX());
                    origLabel.setY(node.getY());
                    origLabel.setWidth(node.getWidth());
                    origLabel.setHeight(node.getHeight());
                }
                v = w;
                node = g.node(v);
            }
        }
        ctx.dummyChains().clear();
    }

    private static boolean isChainNode(NodeLabel node) {
        return node.getDummy() == DummyKind.EDGE || node.getDummy() == DummyKind.EDGE_LABEL;
    }
}
