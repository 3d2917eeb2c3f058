package com.graphdraw.lgl.normalize;

import com.graphdraw.lgl.api.LabelPosition;
import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.EdgeLabel;
import com.graphdraw.lgl.core.GraphConfig;
import com.graphdraw.lgl.core.LayoutGraph;

/**
 * Room for edge labels between ranks.
 *
 * Before ranking every edge is made twice as long and the rank separation is
 * halved, which opens a free rank between any two connected nodes where a label
 * dummy can sit. Labels placed to the side of their edge are widened by the
 * label offset; {@link #fixupLabelCoords} takes the offset back out once the
 * label has a position.
 */
public final class EdgeLabelSpacing {

    private EdgeLabelSpacing() {
    }

    public static void makeSpace(LayoutGraph g) {
        GraphConfig config = g.config();
        config.setRanksep(config.getRanksep() / 2);
        boolean horizontal = config.getDirection().isHorizontal();
        for (EdgeKey e : g.edges()) {
            EdgeLabel edge = g.edge(e);
            edge.setMinlen(edge.getMinlen() * 2);
            if (edge.getLabelpos() != LabelPosition.C) {
                if (horizontal)
                    edge.setHeight(edge.getHeight() + edge.getLabeloffset());
                else
                    edge.setWidth(edge.getWidth() + edge.getLabeloffset());
            }
        }
    }

    public static void fixupLabelCoords(LayoutGraph g) {
        for (EdgeKey e : g.edges()) {
            EdgeLabel edge = g.edge(e);
            if (edge.getX() == null)
                continue;
            if (edge.getLabelpos() == LabelPosition.L || edge.getLabelpos() == LabelPosition.R)
                edge.setWidth(edge.getWidth() - edge.getLabeloffset());
            switch (edge.getLabelpos()) {
                case L -> edge.setX(edge.getX() - edge.getWidth() / 2 - edge.getLabeloffset());
                case R -> edge.setX(edge.getX() + edge.getWidth() / 2 + edge.getLabeloffset());
                case C -> {
                }
            }
        }
    }
}
