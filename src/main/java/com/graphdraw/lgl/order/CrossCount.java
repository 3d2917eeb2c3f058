package com.graphdraw.lgl.order;

import com.graphdraw.lgl.core.EdgeKey;
import com.graphdraw.lgl.core.LayoutGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted edge crossings of a layering, counted pairwise between adjacent
 * ranks with an accumulator tree (Barth, Juenger and Mutzel, "Simple and
 * Efficient Bilayer Cross Counting").
 */
public final class CrossCount {

    private CrossCount() {
    }

    public static double count(LayoutGraph g, List<List<String>> layering) {
        double cc = 0;
        for (int i = 1; i < layering.size(); i++)
            cc += twoLayerCrossCount(g, layering.get(i - 1), layering.get(i));
        return cc;
    }

    private static double twoLayerCrossCount(LayoutGraph g, List<String> north, List<String> south) {
        if (south.isEmpty())
            return 0;
        Map<String, Integer> southPos = new HashMap<>();
        for (int i = 0; i < south.size(); i++)
            southPos.put(south.get(i), i);

        List<Integer> positions = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (String v : north) {
            List<EdgeKey> out = new ArrayList<>(g.outEdges(v));
            out.removeIf(e -> !southPos.containsKey(e.w()));
            out.sort((a, b) -> Integer.compare(southPos.get(a.w()), southPos.get(b.w())));
            for (EdgeKey e : out) {
                positions.add(southPos.get(e.w()));
                weights.add(g.edge(e).getWeight());
            }
        }

        int firstIndex = 1;
        while (firstIndex < south.size())
            firstIndex <<= 1;
        int treeSize = 2 * firstIndex - 1;
        firstIndex -= 1;
        double[] tree = new double[treeSize];

        double cc = 0;
        for (int k = 0; k < positions.size(); k++) {
            double weight = weights.get(k);
            int index = positions.get(k) + firstIndex;
            tree[index] += weight;
            double weightSum = 0;
            while (index > 0) {
                if (index % 2 == 1)
                    weightSum += tree[index + 1];
                index = (index - 1) >> 1;
                tree[index] += weight;
            }
            cc += weight * weightSum;
        }
        return cc;
    }
}
