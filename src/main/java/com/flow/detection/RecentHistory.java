package com.flow.detection;

import com.flow.model.PressureWindow;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded buffer of recently scored windows, grouped by strike for the
 * market-making checks. Windows leave once they end more than the retention
 * before the newest window, or when the buffer exceeds its capacity.
 */
public class RecentHistory {

    private final long retentionMillis;
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();

    /** Insertion order, for eviction. */
    private final Deque<PressureWindow> all = new ArrayDeque<>();
    private final Map<Double, Deque<PressureWindow>> byStrike = new HashMap<>();
    private long newestEnd = Long.MIN_VALUE;

    public RecentHistory(Duration retention, int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("Capacity must be positive");
        this.retentionMillis = retention.toMillis();
        this.capacity = capacity;
    }

    public void add(PressureWindow window) {
        lock.lock();
        try {
            all.addLast(window);
            byStrike.computeIfAbsent(window.key().strike(), s -> new ArrayDeque<>()).addLast(window);
            newestEnd = Math.max(newestEnd, window.windowEnd());
            evict();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of the retained windows at {@code strike}, oldest first.
     */
    public List<PressureWindow> atStrike(double strike) {
        lock.lock();
        try {
            Deque<PressureWindow> windows = byStrike.get(strike);
            return windows == null ? List.of() : new ArrayList<>(windows);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return all.size();
        } finally {
            lock.unlock();
        }
    }

    /** Must be called while holding the lock. */
    private void evict() {
        while (!all.isEmpty()
                && (all.size() > capacity || all.peekFirst().windowEnd() < newestEnd - retentionMillis)) {
            PressureWindow oldest = all.pollFirst();
            Deque<PressureWindow> strikeWindows = byStrike.get(oldest.key().strike());
            if (strikeWindows != null) {
                strikeWindows.remove(oldest);
                if (strikeWindows.isEmpty()) byStrike.remove(oldest.key().strike());
            }
        }
    }
}
