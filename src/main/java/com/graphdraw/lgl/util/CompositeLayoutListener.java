package com.graphdraw.lgl.util;

import com.graphdraw.lgl.api.LayoutListener;
import com.graphdraw.lgl.api.LayoutStage;

import java.util.Arrays;

/** Fans every callback out to several {@link LayoutListener}s, in the order they were added. */
public class CompositeLayoutListener implements LayoutListener {
    private LayoutListener[] listeners = new LayoutListener[0];

    public CompositeLayoutListener add(LayoutListener listener) {
        LayoutListener[] old = listeners;
        LayoutListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onLayoutStart(long runId, int nodeCount, int edgeCount) {
        for (LayoutListener l : listeners)
            l.onLayoutStart(runId, nodeCount, edgeCount);
    }

    @Override
    public void onStageComplete(long runId, LayoutStage stage, long durationNanos) {
        for (LayoutListener l : listeners)
            l.onStageComplete(runId, stage, durationNanos);
    }

    @Override
    public void onLayoutError(long runId, LayoutStage stage, Throwable error) {
        for (LayoutListener l : listeners)
            l.onLayoutError(runId, stage, error);
    }

    @Override
    public void onLayoutEnd(long runId, long totalNanos) {
        for (LayoutListener l : listeners)
            l.onLayoutEnd(runId, totalNanos);
    }
}
