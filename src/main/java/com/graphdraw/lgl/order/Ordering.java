package com.graphdraw.lgl.order;

import com.graphdraw.lgl.core.Graph;
import com.graphdraw.lgl.core.GraphConfig;
import com.graphdraw.lgl.core.Layers;
import com.graphdraw.lgl.core.LayoutGraph;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Assigns the {@code order} of every node within its rank, trying to minimize
 * edge crossings.
 *
 * After the initial depth-first order, layers are swept alternately upward
 * and downward. Each sweep re-sorts every layer by the median order of its
 * neighbours on the layer swept from, clusters moving as units, and is
 * followed by a transpose pass when enabled. The best layering seen is kept,
 * starting with the initial one, so the result is never worse than it. The
 * loop stops after four sweeps without improvement or at the configured
 * sweep cap.
 */
@Log4j2
public final class Ordering {

    private Ordering() {
    }

    public static void order(LayoutGraph g) {
        int maxRank = Layers.maxRank(g);
        if (maxRank < 0)
            return;
        GraphConfig config = g.config();

        assignOrder(g, InitOrder.initOrder(g));
        if (config.isDisableOptimalOrderHeuristic()) {
            log.debug("Optimal order heuristic disabled; keeping initial order");
            return;
        }

        String root = LayerGraphs.rootId(g);
        List<Graph<String, LayerNode, Double>> down = new ArrayList<>();
        for (int rank = 1; rank <= maxRank; rank++)
            down.add(LayerGraphs.build(g, rank, true, root));
        List<Graph<String, LayerNode, Double>> up = new ArrayList<>();
        for (int rank = maxRank - 1; rank >= 0; rank--)
            up.add(LayerGraphs.build(g, rank, false, root));

        List<List<String>> best = Layers.buildLayerMatrix(g);
        double bestCC = CrossCount.count(g, best);
        log.debug("Initial order has {} crossings", bestCC);

        int i = 0;
        for (int lastBest = 0; lastBest < 4 && i < config.getMaxOrderSweeps(); ++i, ++lastBest) {
            sweepLayerGraphs(i % 2 == 1 ? down : up, i % 4 >= 2);
            if (config.isTranspose())
                Transpose.run(g, Layers.buildLayerMatrix(g));

            List<List<String>> layering = Layers.buildLayerMatrix(g);
            double cc = CrossCount.count(g, layering);
            if (cc < bestCC) {
                lastBest = 0;
                best = layering;
                bestCC = cc;
            }
        }
        assignOrder(g, best);
        log.debug("Ordering finished after {} sweeps with {} crossings", i, bestCC);
    }

    private static void sweepLayerGraphs(List<Graph<String, LayerNode, Double>> layerGraphs, boolean biasRight) {
        Graph<Object, Object, Object> cg = new Graph<>(false, false);
        cg.setDefaultNodeLabel(Object::new);
        cg.setDefaultEdgeLabel(Object::new);
        for (Graph<String, LayerNode, Double> lg : layerGraphs) {
            String root = lg.graph();
            SortEntry sorted = SubgraphSorter.sortSubgraph(lg, root, cg, biasRight);
            for (int i = 0; i < sorted.vs.size(); i++)
                lg.node(sorted.vs.get(i)).setOrder(i);
            SubgraphConstraints.add(lg, cg, sorted.vs);
        }
    }

    private static void assignOrder(LayoutGraph g, List<List<String>> layering) {
        for (List<String> layer : layering) {
            for (int i = 0; i < layer.size(); i++)
                g.node(layer.get(i)).setOrder(i);
        }
    }
}
