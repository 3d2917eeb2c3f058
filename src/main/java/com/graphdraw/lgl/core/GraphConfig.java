package com.graphdraw.lgl.core;

import com.graphdraw.lgl.api.Acyclicer;
import com.graphdraw.lgl.api.Alignment;
import com.graphdraw.lgl.api.Direction;
import com.graphdraw.lgl.api.RankerKind;

import lombok.Data;

/**
 * Graph-level layout settings, plus the drawing size written back when the
 * layout finishes.
 */
@Data
public class GraphConfig {
    private Direction direction = Direction.TB;
    private double nodesep = 50;
    private double ranksep = 50;
    private double edgesep = 20;
    private double marginx;
    private double marginy;

    private Acyclicer acyclicer = Acyclicer.DFS;
    private RankerKind ranker = RankerKind.NETWORK_SIMPLEX;
    /** Null balances the four alignments. */
    private Alignment align;

    private boolean transpose = true;
    private boolean disableOptimalOrderHeuristic;
    private int maxOrderSweeps = 24;
    /** 0 derives the cap from the graph size. */
    private int maxSimplexIterations;

    // Output
    private double width;
    private double height;

    public GraphConfig copy() {
        GraphConfig c = new GraphConfig();
        c.setDirection(direction);
        c.setNodesep(nodesep);
        c.setRanksep(ranksep);
        c.setEdgesep(edgesep);
        c.setMarginx(marginx);
        c.setMarginy(marginy);
        c.setAcyclicer(acyclicer);
        c.setRanker(ranker);
        c.setAlign(align);
        c.setTranspose(transpose);
        c.setDisableOptimalOrderHeuristic(disableOptimalOrderHeuristic);
        c.setMaxOrderSweeps(maxOrderSweeps);
        c.setMaxSimplexIterations(maxSimplexIterations);
        return c;
    }
}
