package com.graphdraw.lgl.util;

import com.graphdraw.lgl.api.LayoutListener;
import com.graphdraw.lgl.api.LayoutStage;

/**
 * Aggregates wall time per pipeline stage and per run.
 *
 * <p>
 * Captures, for every {@link LayoutStage}, how often it ran and the
 * min/max/average duration, plus the same figures for whole runs and a count
 * of failed runs. {@link #dump()} renders the table.
 */
public final class StageTimingListener implements LayoutListener {

    public static final class StageStats {
        public final LayoutStage stage;
        public long count;
        public long totalNanos;
        public long minNanos = Long.MAX_VALUE;
        public long maxNanos = Long.MIN_VALUE;

        StageStats(LayoutStage stage) {
            this.stage = stage;
        }

        void update(long duration) {
            count++;
            totalNanos += duration;
            if (duration < minNanos)
                minNanos = duration;
            if (duration > maxNanos)
                maxNanos = duration;
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalNanos / (double) count / 1000.0;
        }

        public double minMicros() {
            return count == 0 ? 0 : minNanos / 1000.0;
        }

        public double maxMicros() {
            return count == 0 ? 0 : maxNanos / 1000.0;
        }
    }

    private final StageStats[] stats = new StageStats[LayoutStage.values().length];
    private long runs;
    private long failures;
    private long totalRunNanos;
    private long minRunNanos = Long.MAX_VALUE;
    private long maxRunNanos = Long.MIN_VALUE;

    public StageTimingListener() {
        for (LayoutStage stage : LayoutStage.values())
            stats[stage.ordinal()] = new StageStats(stage);
    }

    @Override
    public void onLayoutStart(long runId, int nodeCount, int edgeCount) {
        // No-op
    }

    @Override
    public void onStageComplete(long runId, LayoutStage stage, long durationNanos) {
        stats[stage.ordinal()].update(durationNanos);
    }

    @Override
    public void onLayoutError(long runId, LayoutStage stage, Throwable error) {
        failures++;
    }

    @Override
    public void onLayoutEnd(long runId, long totalNanos) {
        runs++;
        totalRunNanos += totalNanos;
        if (totalNanos < minRunNanos)
            minRunNanos = totalNanos;
        if (totalNanos > maxRunNanos)
            maxRunNanos = totalNanos;
    }

    public StageStats stats(LayoutStage stage) {
        return stats[stage.ordinal()];
    }

    public long runs() {
        return runs;
    }

    public long failures() {
        return failures;
    }

    public double avgRunMicros() {
        return runs > 0 ? totalRunNanos / (double) runs / 1000.0 : 0;
    }

    public void reset() {
        for (LayoutStage stage : LayoutStage.values())
            stats[stage.ordinal()] = new StageStats(stage);
        runs = 0;
        failures = 0;
        totalRunNanos = 0;
        minRunNanos = Long.MAX_VALUE;
        maxRunNanos = Long.MIN_VALUE;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-28s | %8s | %10s | %10s | %10s%n", "Stage", "Count", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("--------------------------------------------------------------------------------\n");
        for (StageStats s : stats) {
            if (s.count == 0)
                continue;
            sb.append(String.format("%-28s | %8d | %10.2f | %10.2f | %10.2f%n",
                    s.stage, s.count, s.avgMicros(), s.minMicros(), s.maxMicros()));
        }
        sb.append("--------------------------------------------------------------------------------\n");
        sb.append(String.format("%-28s | %8d | %10.2f | %10.2f | %10.2f%n",
                "Total runs",
                runs,
                avgRunMicros(),
                runs == 0 ? 0 : minRunNanos / 1000.0,
                runs == 0 ? 0 : maxRunNanos / 1000.0));
        if (failures > 0)
            sb.append(String.format("%-28s | %8d%n", "Failed runs", failures));
        return sb.toString();
    }
}
