package com.flow.store;

import java.time.LocalDate;
import java.util.List;

/**
 * Durable per-day baseline statistics keyed by (strike, side, day).
 * Implementations throw {@link BaselinePersistenceException} when storage is unreachable.
 */
public interface BaselineRepository {

    /** Insert or replace the row for the stats' key and day. */
    void upsert(DailyStats stats);

    /** All rows with a day on or after {@code fromDay}, ordered by day. */
    List<DailyStats> loadSince(LocalDate fromDay);

    /** Delete rows older than {@code day}; returns the number removed. */
    int deleteBefore(LocalDate day);
}
