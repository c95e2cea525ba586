package com.flow.aggregator;

import com.flow.event.OrderEvent;
import com.flow.model.InstrumentKey;
import com.flow.model.PressureWindow;
import com.flow.model.WindowLength;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Folds order events into fixed-length pressure windows per (strike, side) key.
 *
 * <ul>
 *   <li>Maintains one {@link WindowAggregator} (one open-window slot) per active key</li>
 *   <li>Closes windows lazily per key when a newer bucket's event arrives</li>
 *   <li>Evicts keys idle longer than the configured timeout, returning their open window</li>
 *   <li>Drops events for buckets an evicted key already closed</li>
 * </ul>
 *
 * <p>New keys are auto-registered on first event. No I/O is performed here.
 */
public class PressureAggregator {

    private static final Logger log = LoggerFactory.getLogger(PressureAggregator.class);

    private final WindowLength windowLength;
    private final long idleTimeoutMillis;

    /**
     * ConcurrentHashMap for safe concurrent reads + computeIfAbsent writes.
     * Keys are independent so events for different keys never contend.
     */
    private final ConcurrentMap<InstrumentKey, WindowAggregator> aggregators = new ConcurrentHashMap<>();

    /** Last closed bucket of evicted keys, until the stream moves past it. */
    private final ConcurrentMap<InstrumentKey, Long> watermarks = new ConcurrentHashMap<>();

    /** Highest watermark pruned from {@link #watermarks}; applies to every new aggregator. */
    private final AtomicLong forgottenWatermark = new AtomicLong(Long.MIN_VALUE);

    /** Newest event timestamp seen. */
    private final AtomicLong streamTime = new AtomicLong(Long.MIN_VALUE);

    private final AtomicLong eventsIngested = new AtomicLong();
    private final AtomicLong windowsClosed = new AtomicLong();
    private final AtomicLong keysEvicted = new AtomicLong();

    public PressureAggregator(WindowLength windowLength, Duration idleTimeout) {
        this.windowLength = windowLength;
        this.idleTimeoutMillis = idleTimeout.toMillis();
    }

    /**
     * Accumulate an event into the open window for its key.
     *
     * @param event The incoming order event
     * @return the key's previous window once this event crosses its bucket boundary
     */
    public Optional<PressureWindow> ingest(OrderEvent event) {
        log.debug("Ingesting event: key={} size={} initiator={} ts={}",
                event.key(), event.size(), event.initiator(), event.timestamp());
        eventsIngested.incrementAndGet();
        streamTime.accumulateAndGet(event.timestamp(), Math::max);

        while (true) {
            WindowAggregator aggregator = aggregators.computeIfAbsent(event.key(), this::newAggregator);
            WindowAggregator.Outcome outcome = aggregator.process(event);
            if (outcome.retired()) {
                // Evicted between lookup and process; hand the event to a successor
                detach(aggregator);
                continue;
            }
            outcome.closed().ifPresent(w -> windowsClosed.incrementAndGet());
            return outcome.closed();
        }
    }

    /**
     * Drop keys that have seen no events for longer than the idle timeout.
     * Their open windows are closed and returned so no data is lost. The last
     * closed bucket of each evicted key is remembered, so a late event for it
     * is dropped instead of opening a second window for the same bucket.
     *
     * @param nowMillis Current time in Unix milliseconds
     */
    public Eviction evictIdle(long nowMillis) {
        List<PressureWindow> flushed = new ArrayList<>();
        List<InstrumentKey> evicted = new ArrayList<>();
        for (WindowAggregator aggregator : aggregators.values()) {
            if (aggregator.retireIfIdle(nowMillis, idleTimeoutMillis, flushed)) {
                detach(aggregator);
                evicted.add(aggregator.getKey());
                keysEvicted.incrementAndGet();
                log.info("Evicted idle key={} lastEvent={}", aggregator.getKey(), aggregator.getLastEventMillis());
            }
        }
        windowsClosed.addAndGet(flushed.size());
        pruneWatermarks();
        return new Eviction(flushed, evicted);
    }

    /**
     * Close every open window, e.g. on shutdown. Keys stay registered.
     */
    public List<PressureWindow> flushAll() {
        List<PressureWindow> flushed = new ArrayList<>();
        aggregators.values().forEach(agg -> agg.forceFlush().ifPresent(flushed::add));
        windowsClosed.addAndGet(flushed.size());
        log.info("Flushed {} open windows across {} keys", flushed.size(), aggregators.size());
        return flushed;
    }

    /**
     * Returns the keys currently tracked, sorted by strike then side.
     */
    public List<InstrumentKey> activeKeys() {
        return aggregators.keySet().stream().sorted().toList();
    }

    public boolean isActive(InstrumentKey key) {
        return aggregators.containsKey(key);
    }

    public int activeKeyCount() {
        return aggregators.size();
    }

    public long openWindowCount() {
        return aggregators.values().stream().filter(WindowAggregator::hasOpenWindow).count();
    }

    public long getEventsIngested() {
        return eventsIngested.get();
    }

    public long getWindowsClosed() {
        return windowsClosed.get();
    }

    public long getKeysEvicted() {
        return keysEvicted.get();
    }

    public WindowLength getWindowLength() {
        return windowLength;
    }

    int retainedWatermarkCount() {
        return watermarks.size();
    }

    private WindowAggregator newAggregator(InstrumentKey key) {
        Long watermark = watermarks.remove(key);
        long lastClosed = Math.max(watermark == null ? Long.MIN_VALUE : watermark, forgottenWatermark.get());
        log.info("Creating new window aggregator for key={} window={}", key, windowLength.label());
        return new WindowAggregator(key, windowLength, lastClosed);
    }

    /**
     * Unmap a retired aggregator and keep its watermark. Runs inside the map's
     * per-key lock so a successor is never created before the watermark is stored.
     */
    private void detach(WindowAggregator retired) {
        aggregators.computeIfPresent(retired.getKey(), (key, current) -> {
            if (current != retired) return current;
            watermarks.merge(key, retired.getLastClosedBucket(), Math::max);
            return null;
        });
    }

    /**
     * Forget watermarks that the stream has moved well past. Buckets at or before a
     * forgotten watermark stay closed for keys that come back later.
     */
    private void pruneWatermarks() {
        long newest = streamTime.get();
        if (newest == Long.MIN_VALUE) return;
        long horizon = newest - windowLength.millis() - idleTimeoutMillis;
        for (Map.Entry<InstrumentKey, Long> entry : watermarks.entrySet()) {
            long watermark = entry.getValue();
            if (watermark < horizon) {
                forgottenWatermark.accumulateAndGet(watermark, Math::max);
                watermarks.remove(entry.getKey(), watermark);
            }
        }
    }

    /**
     * Outcome of one eviction pass.
     *
     * @param flushed     Windows closed because their key went idle
     * @param evictedKeys Keys no longer tracked
     */
    public record Eviction(List<PressureWindow> flushed, List<InstrumentKey> evictedKeys) {
    }
}
