package com.graphdraw.lgl.order;

import com.graphdraw.lgl.core.Graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders one cluster of a layer graph, bottom-up.
 *
 * Child clusters are sorted first and then move as a single unit whose value
 * is the weighted average of their members. A cluster's own left and right
 * border nodes are kept out of the sort and wrap the result.
 */
final class SubgraphSorter {

    private SubgraphSorter() {
    }

    static SortEntry sortSubgraph(Graph<String, LayerNode, Double> lg, String v,
            Graph<Object, Object, Object> cg, boolean biasRight) {
        List<String> movable = lg.children(v);
        LayerNode node = lg.node(v);
        String bl = node != null ? node.borderLeft() : null;
        String br = node != null ? node.borderRight() : null;
        Map<String, SortEntry> subgraphs = new HashMap<>();

        if (bl != null)
            movable.removeIf(w -> w.equals(bl) || w.equals(br));

        List<SortEntry> values = MedianValues.compute(lg, movable);
        for (SortEntry entry : values) {
            if (lg.hasChildren(entry.v())) {
                SortEntry subgraphResult = sortSubgraph(lg, entry.v(), cg, biasRight);
                subgraphs.put(entry.v(), subgraphResult);
                if (subgraphResult.hasValue())
                    entry.mergeValue(subgraphResult);
            }
        }

        List<SortEntry> entries = ConflictResolver.resolve(values, cg);
        expandSubgraphs(entries, subgraphs);

        SortEntry result = EntrySorter.sort(entries, biasRight);

        if (bl != null) {
            List<String> vs = new ArrayList<>(result.vs.size() + 2);
            vs.add(bl);
            vs.addAll(result.vs);
            vs.add(br);
            result.vs = vs;
            List<String> blPreds = lg.predecessors(bl);
            if (!blPreds.isEmpty()) {
                int blPred = lg.node(blPreds.get(0)).order();
                int brPred = lg.node(lg.predecessors(br).get(0)).order();
                if (!result.hasValue()) {
                    result.value = 0.0;
                    result.weight = 0;
                }
                result.value = (result.value * result.weight + blPred + brPred) / (result.weight + 2);
                result.weight += 2;
            }
        }
        return result;
    }

    private static void expandSubgraphs(List<SortEntry> entries, Map<String, SortEntry> subgraphs) {
        for (SortEntry entry : entries) {
            List<String> expanded = new ArrayList<>();
            for (String v : entry.vs) {
                SortEntry sub = subgraphs.get(v);
                if (sub != null)
                    expanded.addAll(sub.vs);
                else
                    expanded.add(v);
            }
            entry.vs = expanded;
        }
    }
}
