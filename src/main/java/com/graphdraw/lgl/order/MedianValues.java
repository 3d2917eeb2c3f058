package com.graphdraw.lgl.order;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.Graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Median of the neighbour orders of each movable node.
 *
 * With an even number of neighbours the two middle positions are
 * interpolated, weighted toward the side where the neighbours are packed more
 * tightly (Gansner et al.). The entry weight is the number of neighbours.
 */
final class MedianValues {

    private MedianValues() {
    }

    static List<SortEntry> compute(Graph<String, LayerNode, Double> lg, List<String> movable) {
        List<SortEntry> result = new ArrayList<>(movable.size());
        for (String v : movable) {
            SortEntry entry = SortEntry.of(v);
            List<EdgeKey> in = lg.inEdges(v);
            if (!in.isEmpty()) {
                double[] positions = new double[in.size()];
                for (int i = 0; i < positions.length; i++)
                    positions[i] = lg.node(in.get(i).v()).order();
                entry.value = median(positions);
                entry.weight = positions.length;
            }
            result.add(entry);
        }
        return result;
    }

    static double median(double[] positions) {
        double[] p = positions.clone();
        Arrays.sort(p);
        int n = p.length;
        int m = n / 2;
        if (n % 2 == 1)
            return p[m];
        if (n == 2)
            return (p[0] + p[1]) / 2;
        double left = p[m - 1] - p[0];
        double right = p[n - 1] - p[m];
        if (left + right == 0)
            return (p[m - 1] + p[m]) / 2;
        return (p[m - 1] * right + p[m] * left) / (left + right);
    }
}
