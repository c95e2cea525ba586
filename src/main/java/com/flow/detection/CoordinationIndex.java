package com.flow.detection;

import com.flow.model.PressureWindow;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Strike-sorted, read-only view over one evaluation batch.
 *
 * <p>{@link #nearby} finds the matching slice with two binary searches, so a lookup
 * costs O(log n + k) instead of a scan of the whole batch. Built once per batch
 * in O(n log n) and shared by every key scored in that batch.
 */
public final class CoordinationIndex {

    private static final CoordinationIndex EMPTY = new CoordinationIndex(new double[0], new PressureWindow[0]);

    private static final Comparator<PressureWindow> BY_STRIKE = Comparator
            .comparingDouble((PressureWindow w) -> w.key().strike())
            .thenComparing(w -> w.key().side())
            .thenComparingLong(PressureWindow::windowStart);

    private final double[] strikes;
    private final PressureWindow[] windows;

    private CoordinationIndex(double[] strikes, PressureWindow[] windows) {
        this.strikes = strikes;
        this.windows = windows;
    }

    public static CoordinationIndex build(Collection<PressureWindow> batch) {
        if (batch.isEmpty()) return EMPTY;
        PressureWindow[] sorted = batch.toArray(new PressureWindow[0]);
        Arrays.sort(sorted, BY_STRIKE);
        double[] strikes = new double[sorted.length];
        for (int i = 0; i < sorted.length; i++) {
            strikes[i] = sorted[i].key().strike();
        }
        return new CoordinationIndex(strikes, sorted);
    }

    public static CoordinationIndex empty() {
        return EMPTY;
    }

    /**
     * Windows whose strike lies within {@code [strike - radius, strike + radius]},
     * in strike order. Includes windows at {@code strike} itself.
     */
    public List<PressureWindow> nearby(double strike, double radius) {
        if (radius < 0 || Double.isNaN(radius)) throw new IllegalArgumentException("Radius must be non-negative");
        int from = lowerBound(strike - radius);
        int to = upperBound(strike + radius);
        if (from >= to) return List.of();
        return Collections.unmodifiableList(Arrays.asList(Arrays.copyOfRange(windows, from, to)));
    }

    /** Windows at exactly {@code strike}, both sides. */
    public List<PressureWindow> atStrike(double strike) {
        return nearby(strike, 0.0);
    }

    public int size() {
        return windows.length;
    }

    public boolean isEmpty() {
        return windows.length == 0;
    }

    /** First index whose strike is &gt;= {@code value}. */
    private int lowerBound(double value) {
        int lo = 0;
        int hi = strikes.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (strikes[mid] < value) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    /** First index whose strike is &gt; {@code value}. */
    private int upperBound(double value) {
        int lo = 0;
        int hi = strikes.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (strikes[mid] <= value) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }
}
