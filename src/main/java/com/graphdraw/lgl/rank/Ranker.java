package com.graphdraw.lgl.rank;

import com.graphdraw.lgl.core.LayoutGraph;

/**
 * Assigns an integer rank to every node so that each edge spans at least its
 * {@code minlen}. The graph must be acyclic, connected and non-compound.
 *
 * The strategy comes from the graph configuration:
 * network-simplex minimizes the total weighted edge length,
 * tight-tree stops after building the feasible tree,
 * longest-path keeps the initial ranking as is.
 */
public final class Ranker {

    private Ranker() {
    }

    public static void rank(LayoutGraph g, int maxSimplexIterations) {
        switch (g.config().getRanker()) {
            case LONGEST_PATH -> RankUtil.longestPath(g);
            case TIGHT_TREE -> {
                RankUtil.longestPath(g);
                FeasibleTree.find(g);
            }
            case NETWORK_SIMPLEX -> NetworkSimplex.run(g, maxSimplexIterations);
        }
    }

    /**
     * Pivot cap used when the configuration leaves it at 0: ten pivots per
     * edge and node, at least 1000 and at most 1,000,000.
     */
    public static int derivedIterationCap(int configured, int nodeCount, int edgeCount) {
        if (configured > 0)
            return configured;
        long derived = 10L * nodeCount * edgeCount;
        return (int) Math.min(1_000_000L, Math.max(1000L, derived));
    }
}
