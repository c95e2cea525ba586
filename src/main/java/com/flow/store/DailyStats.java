package com.flow.store;

import com.flow.model.InstrumentKey;

import java.time.LocalDate;

/**
 * Persisted pressure-ratio summary for one key on one UTC trading day.
 *
 * @param lastWindowStart Start of the newest window folded in, so replays after a restart are ignored
 */
public record DailyStats(InstrumentKey key, LocalDate day, RunningStats stats, long lastWindowStart) {

    public DailyStats {
        if (key == null || day == null || stats == null) {
            throw new IllegalArgumentException("Key, day and stats are required");
        }
    }
}
