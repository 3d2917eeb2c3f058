package com.graphdraw.lgl.core;

import com.graphdraw.lgl.api.DummyKind;

import java.util.ArrayList;
import java.util.List;

/**
 * State owned by a single layout run.
 *
 * Holds the dummy id counter and the bookkeeping that stages hand to each
 * other. A context is never shared between runs, so concurrent layouts of
 * different graphs cannot collide on generated ids.
 */
public final class LayoutContext {
    private final long runId;
    private long idCounter;

    private String nestingRoot;
    private int nodeRankFactor;
    private int maxRank;
    private int maxSimplexIterations;
    private final List<String> dummyChains = new ArrayList<>();

    public LayoutContext(long runId) {
        this.runId = runId;
    }

    public long runId() {
        return runId;
    }

    /** Next id with the given prefix, unique within this run. */
    public String uniqueId(String prefix) {
        return prefix + (++idCounter);
    }

    /** Adds a dummy node under a fresh id and returns that id. */
    public String addDummyNode(LayoutGraph g, DummyKind kind, NodeLabel label, String prefix) {
        String v;
        do {
            v = uniqueId(prefix);
        } while (g.hasNode(v));
        label.setDummy(kind);
        g.setNode(v, label);
        return v;
    }

    public String nestingRoot() {
        return nestingRoot;
    }

    public void setNestingRoot(String nestingRoot) {
        this.nestingRoot = nestingRoot;
    }

    public int nodeRankFactor() {
        return nodeRankFactor;
    }

    public void setNodeRankFactor(int nodeRankFactor) {
        this.nodeRankFactor = nodeRankFactor;
    }

    public int maxRank() {
        return maxRank;
    }

    public void setMaxRank(int maxRank) {
        this.maxRank = maxRank;
    }

    public int maxSimplexIterations() {
        return maxSimplexIterations;
    }

    public void setMaxSimplexIterations(int maxSimplexIterations) {
        this.maxSimplexIterations = maxSimplexIterations;
    }

    /** First dummy of every normalized edge chain. */
    public List<String> dummyChains() {
        return dummyChains;
    }
}
