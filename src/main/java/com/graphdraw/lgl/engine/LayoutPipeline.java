package com.graphdraw.lgl.engine;

import com.graphdraw.lgl.acyclic.Acyclic;
import com.graphdraw.lgl.api.LayoutListener;
import com.graphdraw.lgl.api.LayoutStage;
import com.graphdraw.lgl.compound.BorderSegments;
import com.graphdraw.lgl.compound.ParentDummyChains;
import com.graphdraw.lgl.core.Graphs;
import com.graphdraw.lgl.core.LayoutContext;
import com.graphdraw.lgl.core.LayoutGraph;
import com.graphdraw.lgl.finish.EdgeIntersections;
import com.graphdraw.lgl.finish.Translation;
import com.graphdraw.lgl.nesting.NestingGraph;
import com.graphdraw.lgl.normalize.EdgeLabelProxies;
import com.graphdraw.lgl.normalize.EdgeLabelSpacing;
import com.graphdraw.lgl.normalize.Normalizer;
import com.graphdraw.lgl.order.Ordering;
import com.graphdraw.lgl.position.CoordinateSystem;
import com.graphdraw.lgl.position.Positioner;
import com.graphdraw.lgl.rank.RankUtil;
import com.graphdraw.lgl.rank.Ranker;
import com.graphdraw.lgl.selfedge.SelfEdges;

import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives one layout run through every {@link LayoutStage} in order.
 *
 * Each run gets its own {@link LayoutContext}, so one pipeline may serve
 * several threads as long as each lays out its own graph. Stages mutate the
 * graph in place.
 *
 * Failure handling: the first stage that throws stops the run. The listener
 * is told, the error is logged once, and a {@link LayoutException} naming the
 * stage is thrown. The graph handed to {@link #run} is then in an undefined
 * intermediate state; {@link LayoutGraphAdapter} keeps that graph separate
 * from the caller's.
 */
public final class LayoutPipeline {
    private static final Logger log = LogManager.getLogger(LayoutPipeline.class);

    private final LayoutListener listener;
    private final AtomicLong runs = new AtomicLong();

    public LayoutPipeline() {
        this(null);
    }

    public LayoutPipeline(LayoutListener listener) {
        this.listener = listener;
    }

    @FunctionalInterface
    private interface Step {
        void apply();
    }

    /**
     * Lays out {@code g} in place.
     *
     * @return The id of this run, as passed to the listener.
     * @throws LayoutException if a stage fails.
     */
    public long run(LayoutGraph g) {
        final long runId = runs.incrementAndGet();
        final LayoutContext ctx = new LayoutContext(runId);
        final LayoutListener l = this.listener;
        final int nodeCount = g.nodeCount();
        final int edgeCount = g.edgeCount();

        if (l != null)
            l.onLayoutStart(runId, nodeCount, edgeCount);
        long start = System.nanoTime();

        stage(ctx, LayoutStage.MAKE_SPACE_FOR_EDGE_LABELS, () -> EdgeLabelSpacing.makeSpace(g));
        stage(ctx, LayoutStage.REMOVE_SELF_EDGES, () -> SelfEdges.remove(g));
        stage(ctx, LayoutStage.ACYCLIC, () -> Acyclic.run(g, ctx));
        stage(ctx, LayoutStage.NESTING_GRAPH, () -> NestingGraph.run(g, ctx));
        stage(ctx, LayoutStage.RANK, () -> {
            LayoutGraph leaves = Graphs.asNonCompound(g);
            int cap = Ranker.derivedIterationCap(g.config().getMaxSimplexIterations(),
                    leaves.nodeCount(), leaves.edgeCount());
            ctx.setMaxSimplexIterations(cap);
            Ranker.rank(leaves, cap);
        });
        stage(ctx, LayoutStage.INJECT_EDGE_LABEL_PROXIES, () -> EdgeLabelProxies.inject(g, ctx));
        stage(ctx, LayoutStage.REMOVE_EMPTY_RANKS, () -> RankUtil.removeEmptyRanks(g, ctx));
        stage(ctx, LayoutStage.NESTING_GRAPH_CLEANUP, () -> NestingGraph.cleanup(g, ctx));
        stage(ctx, LayoutStage.NORMALIZE_RANKS, () -> RankUtil.normalizeRanks(g));
        stage(ctx, LayoutStage.ASSIGN_RANK_MIN_MAX, () -> RankUtil.assignRankMinMax(g, ctx));
        stage(ctx, LayoutStage.REMOVE_EDGE_LABEL_PROXIES, () -> EdgeLabelProxies.remove(g));
        stage(ctx, LayoutStage.NORMALIZE, () -> Normalizer.run(g, ctx));
        stage(ctx, LayoutStage.PARENT_DUMMY_CHAINS, () -> ParentDummyChains.run(g, ctx));
        stage(ctx, LayoutStage.ADD_BORDER_SEGMENTS, () -> BorderSegments.add(g, ctx));
        stage(ctx, LayoutStage.ORDER, () -> Ordering.order(g));
        stage(ctx, LayoutStage.ADJUST_COORDINATE_SYSTEM, () -> CoordinateSystem.adjust(g));
        stage(ctx, LayoutStage.INSERT_SELF_EDGES, () -> SelfEdges.insert(g, ctx));
        stage(ctx, LayoutStage.POSITION, () -> Positioner.position(g));
        stage(ctx, LayoutStage.POSITION_SELF_EDGES, () -> SelfEdges.position(g));
        stage(ctx, LayoutStage.REMOVE_BORDER_NODES, () -> BorderSegments.remove(g));
        stage(ctx, LayoutStage.NORMALIZE_UNDO, () -> Normalizer.undo(g, ctx));
        stage(ctx, LayoutStage.FIXUP_EDGE_LABEL_COORDS, () -> EdgeLabelSpacing.fixupLabelCoords(g));
        stage(ctx, LayoutStage.UNDO_COORDINATE_SYSTEM, () -> CoordinateSystem.undo(g));
        stage(ctx, LayoutStage.TRANSLATE, () -> Translation.translate(g));
        stage(ctx, LayoutStage.ASSIGN_NODE_INTERSECTS, () -> EdgeIntersections.assignNodeIntersects(g));
        stage(ctx, LayoutStage.ACYCLIC_UNDO, () -> Acyclic.undo(g));

        long total = System.nanoTime() - start;
        if (l != null)
            l.onLayoutEnd(runId, total);
        log.info("Layout run {} finished: {} nodes, {} edges in {} us",
                runId, nodeCount, edgeCount, total / 1000);
        return runId;
    }

    private void stage(LayoutContext ctx, LayoutStage stage, Step step) {
        final LayoutListener l = this.listener;
        long stageStart = System.nanoTime();
        try {
            step.apply();
        } catch (RuntimeException | StackOverflowError e) {
            if (l != null)
                l.onLayoutError(ctx.runId(), stage, e);
            log.error("Layout run {} failed in stage {}", ctx.runId(), stage, e);
            throw new LayoutException(stage, e);
        }
        long duration = System.nanoTime() - stageStart;
        if (l != null)
            l.onStageComplete(ctx.runId(), stage, duration);
        log.debug("Run {} stage {} took {} us", ctx.runId(), stage, duration / 1000);
    }
}
