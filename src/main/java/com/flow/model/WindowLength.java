package com.flow.model;

import java.time.Duration;

/**
 * Fixed bucket length used to align pressure windows.
 * Buckets are aligned to the Unix epoch so they never overlap across keys.
 *
 * @param millis Bucket length in milliseconds
 */
public record WindowLength(long millis) {

    public static final WindowLength FIVE_MINUTES = of(Duration.ofMinutes(5));

    public WindowLength {
        if (millis <= 0) throw new IllegalArgumentException("Window length must be positive");
    }

    public static WindowLength of(Duration duration) {
        return new WindowLength(duration.toMillis());
    }

    /**
     * Given a Unix timestamp in milliseconds, compute the start of the bucket it falls into.
     */
    public long bucketStart(long timestampMillis) {
        return Math.floorDiv(timestampMillis, millis) * millis;
    }

    public long bucketEnd(long timestampMillis) {
        return bucketStart(timestampMillis) + millis;
    }

    /**
     * Human-readable label such as "5m" or "30s".
     */
    public String label() {
        if (millis % 3_600_000L == 0) return (millis / 3_600_000L) + "h";
        if (millis % 60_000L == 0) return (millis / 60_000L) + "m";
        if (millis % 1_000L == 0) return (millis / 1_000L) + "s";
        return millis + "ms";
    }
}
