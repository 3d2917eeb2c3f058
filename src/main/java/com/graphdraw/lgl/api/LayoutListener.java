package com.graphdraw.lgl.api;

/**
 * Observability hook for a layout run.
 *
 * A listener is passed explicitly to the layout call; nothing in the pipeline
 * looks at the process environment to decide whether to trace. Callbacks run on
 * the caller's thread in the middle of the run, so implementations should be
 * cheap and must not touch the graph being laid out.
 */
public interface LayoutListener {

    /**
     * Called before the first stage runs.
     *
     * @param runId     Identifier of this layout invocation.
     * @param nodeCount Number of nodes in the internal layout graph.
     * @param edgeCount Number of edges in the internal layout graph.
     */
    void onLayoutStart(long runId, int nodeCount, int edgeCount);

    /**
     * Called after a stage has completed.
     *
     * @param runId         Identifier of this layout invocation.
     * @param stage         The stage that just finished.
     * @param durationNanos Wall time spent in the stage.
     */
    void onStageComplete(long runId, LayoutStage stage, long durationNanos);

    /**
     * Called when a stage throws. The run is abandoned afterwards.
     *
     * @param runId Identifier of this layout invocation.
     * @param stage The failing stage.
     * @param error The exception raised by the stage.
     */
    void onLayoutError(long runId, LayoutStage stage, Throwable error);

    /**
     * Called after the last stage has completed successfully.
     *
     * @param runId      Identifier of this layout invocation.
     * @param totalNanos Wall time of the whole run.
     */
    void onLayoutEnd(long runId, long totalNanos);
}
