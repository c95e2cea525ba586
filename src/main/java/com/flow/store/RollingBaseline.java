package com.flow.store;

import com.flow.config.DetectionConfig;
import com.flow.model.BaselineContext;
import com.flow.model.InstrumentKey;
import com.flow.model.PercentileLadder;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Mutable baseline state for one key: a running statistic over the lookback,
 * per-day summaries for recompute and persistence, and a ring-buffer reservoir
 * of the most recent ratios for percentiles.
 *
 * This class is NOT thread-safe by itself; the store's single writer owns it.
 */
class RollingBaseline {

    private final InstrumentKey key;
    private final NavigableMap<LocalDate, RunningStats> days = new TreeMap<>();
    private RunningStats total = RunningStats.EMPTY;

    private final double[] reservoir;
    private final long[] reservoirDays;
    private int reservoirCount;
    private int next;

    private long lastAppliedWindowStart = Long.MIN_VALUE;

    RollingBaseline(InstrumentKey key, int reservoirSize) {
        this.key = key;
        this.reservoir = new double[reservoirSize];
        this.reservoirDays = new long[reservoirSize];
    }

    /**
     * Fold one closed window's ratio into the statistic.
     *
     * @return false if the window is not newer than the last one applied (replay)
     */
    boolean apply(long windowStart, LocalDate day, double ratio) {
        if (windowStart <= lastAppliedWindowStart) return false;
        total = total.add(ratio);
        days.merge(day, RunningStats.of(ratio), RunningStats::merge);
        reservoir[next] = ratio;
        reservoirDays[next] = day.toEpochDay();
        next = (next + 1) % reservoir.length;
        reservoirCount = Math.min(reservoirCount + 1, reservoir.length);
        lastAppliedWindowStart = windowStart;
        return true;
    }

    /**
     * Restore a persisted day. The reservoir stays empty, so the ladder is
     * approximated until enough live windows arrive.
     */
    void restore(DailyStats daily) {
        days.merge(daily.day(), daily.stats(), RunningStats::merge);
        total = total.merge(daily.stats());
        lastAppliedWindowStart = Math.max(lastAppliedWindowStart, daily.lastWindowStart());
    }

    /**
     * Drop days before {@code cutoff} and rebuild the running statistic by merging
     * the remaining per-day summaries.
     *
     * @return number of days dropped
     */
    int recompute(LocalDate cutoff) {
        Map<LocalDate, RunningStats> expired = days.headMap(cutoff, false);
        int dropped = expired.size();
        expired.clear();

        RunningStats merged = RunningStats.EMPTY;
        for (RunningStats day : days.values()) {
            merged = merged.merge(day);
        }
        total = merged;
        evictReservoirBefore(cutoff);
        return dropped;
    }

    DailyStats dailyStats(LocalDate day) {
        return new DailyStats(key, day, days.getOrDefault(day, RunningStats.EMPTY), lastAppliedWindowStart);
    }

    Iterable<LocalDate> trackedDays() {
        return days.keySet();
    }

    boolean isEmpty() {
        return total.isEmpty();
    }

    RunningStats total() {
        return total;
    }

    int reservoirCount() {
        return reservoirCount;
    }

    /**
     * Build an immutable context, or null when nothing has been observed yet.
     *
     * @param qualityFactor Multiplier applied to the data-quality fraction
     */
    BaselineContext toContext(DetectionConfig.Baseline config, double qualityFactor) {
        if (total.isEmpty()) return null;
        double mean = total.mean();
        double std = total.std();
        PercentileLadder ladder = reservoirCount >= config.minReservoirSamples()
                ? PercentileLadder.fromSamples(samples())
                : PercentileLadder.normal(mean, std);
        double quality = Math.min(1.0, (double) total.count() / config.expectedWindows()) * qualityFactor;
        return new BaselineContext(key, mean, std, ladder, total.count(), quality, false);
    }

    private double[] samples() {
        return Arrays.copyOf(reservoir, reservoirCount);
    }

    private void evictReservoirBefore(LocalDate cutoff) {
        long cutoffDay = cutoff.toEpochDay();
        double[] keptValues = new double[reservoir.length];
        long[] keptDays = new long[reservoir.length];
        int kept = 0;
        // oldest first, so the ring order survives compaction
        int start = reservoirCount < reservoir.length ? 0 : next;
        for (int i = 0; i < reservoirCount; i++) {
            int idx = (start + i) % reservoir.length;
            if (reservoirDays[idx] >= cutoffDay) {
                keptValues[kept] = reservoir[idx];
                keptDays[kept] = reservoirDays[idx];
                kept++;
            }
        }
        System.arraycopy(keptValues, 0, reservoir, 0, reservoir.length);
        System.arraycopy(keptDays, 0, reservoirDays, 0, reservoirDays.length);
        reservoirCount = kept;
        next = kept % reservoir.length;
    }
}
