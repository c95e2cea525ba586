package com.flow.aggregator;

import com.flow.event.OrderEvent;
import com.flow.model.InstrumentKey;
import com.flow.model.PressureWindow;
import com.flow.model.WindowLength;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Aggregates a stream of {@link OrderEvent}s for a single (strike, side) key
 * into closed {@link PressureWindow}s.
 *
 * <p>Thread-safety is achieved via a per-aggregator {@link ReentrantLock} so that
 * multiple keys can be processed in parallel without contention.
 *
 * <p>A window is closed lazily when an event arrives with a timestamp belonging to a
 * <em>newer</em> bucket, or when the owner evicts the key for being idle.
 *
 * <p>Eviction retires the aggregator under its lock. A retired aggregator accepts no
 * further events; callers route them to a successor that starts from this one's
 * closed-bucket watermark.
 */
class WindowAggregator {

    private static final Logger log = LoggerFactory.getLogger(WindowAggregator.class);

    private final InstrumentKey key;
    private final WindowLength windowLength;
    private final ReentrantLock lock = new ReentrantLock();

    /** The window currently being built. Null if no events received since the last close. */
    private MutableWindow current;

    /** Start of the most recently closed bucket; events at or before it are late. */
    private long lastClosedBucket = Long.MIN_VALUE;

    /** Late events seen while no window was open; charged to the next window. */
    private int pendingDrops;

    private boolean retired;

    private volatile long lastEventMillis;

    WindowAggregator(InstrumentKey key, WindowLength windowLength) {
        this(key, windowLength, Long.MIN_VALUE);
    }

    /**
     * @param lastClosedBucket Watermark inherited from an evicted predecessor
     */
    WindowAggregator(InstrumentKey key, WindowLength windowLength, long lastClosedBucket) {
        this.key = key;
        this.windowLength = windowLength;
        this.lastClosedBucket = lastClosedBucket;
    }

    /**
     * Process a new event.
     *
     * @return the previous window if this event rolled the key into a newer bucket,
     *         or {@link Outcome#RETIRED} if this aggregator was evicted meanwhile
     */
    Outcome process(OrderEvent event) {
        long bucket = windowLength.bucketStart(event.timestamp());

        lock.lock();
        try {
            if (retired) return Outcome.RETIRED;
            if (current == null) {
                if (bucket <= lastClosedBucket) {
                    pendingDrops++;
                    log.warn("[{}] Late event dropped: eventBucket={}, lastClosedBucket={}",
                            key, bucket, lastClosedBucket);
                    return Outcome.NONE;
                }
                open(bucket, event);
                log.debug("[{}] Opened window at bucket={}", key, bucket);
                return Outcome.NONE;
            }
            if (bucket > current.getBucketStart()) {
                PressureWindow closed = close();
                open(bucket, event);
                log.debug("[{}] Rolled to new window at bucket={}", key, bucket);
                return Outcome.closed(closed);
            }
            if (bucket == current.getBucketStart()) {
                current.update(event);
                lastEventMillis = event.timestamp();
                return Outcome.NONE;
            }
            // Late/out-of-order event: never applied, only counted against completeness
            current.recordDropped(1);
            log.warn("[{}] Late event dropped: eventBucket={}, currentBucket={}",
                    key, bucket, current.getBucketStart());
            return Outcome.NONE;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retire this aggregator if it is still idle, closing its open window into {@code flushed}.
     * Idleness is re-checked under the lock so an event that just arrived keeps the key alive.
     *
     * @return true if this call retired the aggregator
     */
    boolean retireIfIdle(long nowMillis, long idleTimeoutMillis, List<PressureWindow> flushed) {
        lock.lock();
        try {
            if (retired || !isIdle(nowMillis, idleTimeoutMillis)) return false;
            if (current != null) flushed.add(close());
            retired = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the open window without starting a new one.
     * Used for idle eviction and graceful shutdown.
     */
    Optional<PressureWindow> forceFlush() {
        lock.lock();
        try {
            if (current == null) return Optional.empty();
            return Optional.of(close());
        } finally {
            lock.unlock();
        }
    }

    boolean isIdle(long nowMillis, long idleTimeoutMillis) {
        return nowMillis - lastEventMillis >= idleTimeoutMillis;
    }

    boolean hasOpenWindow() {
        lock.lock();
        try {
            return current != null;
        } finally {
            lock.unlock();
        }
    }

    long getLastClosedBucket() {
        lock.lock();
        try {
            return lastClosedBucket;
        } finally {
            lock.unlock();
        }
    }

    InstrumentKey getKey() {
        return key;
    }

    long getLastEventMillis() {
        return lastEventMillis;
    }

    /** Must be called while holding the lock. */
    private void open(long bucket, OrderEvent event) {
        current = new MutableWindow(key, bucket, bucket + windowLength.millis(), event);
        if (pendingDrops > 0) {
            current.recordDropped(pendingDrops);
            pendingDrops = 0;
        }
        lastEventMillis = event.timestamp();
    }

    /** Must be called while holding the lock. */
    private PressureWindow close() {
        PressureWindow window = current.snapshot();
        lastClosedBucket = window.windowStart();
        current = null;
        log.debug("[{}] Window closed: start={} bid={} ask={} ratio={} trades={} dropped={}",
                key, window.windowStart(), window.bidVolume(), window.askVolume(),
                String.format("%.2f", window.pressureRatio()), window.tradeCount(), window.droppedEvents());
        return window;
    }

    /**
     * Result of {@link #process}: the window closed by the event, if any, or the
     * signal that the aggregator was retired and the event was not taken.
     */
    record Outcome(boolean retired, Optional<PressureWindow> closed) {
        static final Outcome NONE = new Outcome(false, Optional.empty());
        static final Outcome RETIRED = new Outcome(true, Optional.empty());

        static Outcome closed(PressureWindow window) {
            return new Outcome(false, Optional.of(window));
        }
    }
}
