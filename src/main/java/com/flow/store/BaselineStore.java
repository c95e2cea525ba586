package com.flow.store;

import com.flow.config.DetectionConfig;
import com.flow.model.BaselineContext;
import com.flow.model.InstrumentKey;
import com.flow.model.PercentileLadder;
import com.flow.model.PressureWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolling N-day pressure-ratio baseline per (strike, side) key.
 *
 * <ul>
 *   <li>{@link #get} reads an immutable {@link BaselineContext} from a concurrent map and never blocks or throws</li>
 *   <li>{@link #record} only enqueues; a full queue drops its oldest entry instead of blocking the caller</li>
 *   <li>{@link #applyPending} is the single writer: it folds queued windows in close order,
 *       persists the touched days and publishes fresh contexts by replacing the map entry</li>
 *   <li>{@link #recomputeAll} merges the per-day summaries of the lookback, dropping older days</li>
 * </ul>
 *
 * <p>If the repository fails, the store keeps working from memory and scales every
 * published data quality by the configured degradation factor.
 */
public class BaselineStore {

    private static final Logger log = LoggerFactory.getLogger(BaselineStore.class);

    private final DetectionConfig.Baseline config;
    private final BaselineRepository repository;
    private final Clock clock;

    /** Read side. Values are immutable and replaced whole. */
    private final ConcurrentMap<InstrumentKey, BaselineContext> published = new ConcurrentHashMap<>();

    private final BlockingQueue<PendingRecord> queue;

    /** Write side. Only touched while holding {@link #writerLock}. */
    private final Map<InstrumentKey, RollingBaseline> states = new HashMap<>();
    private final ReentrantLock writerLock = new ReentrantLock();

    private volatile boolean degraded;

    private final AtomicLong recorded = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong replays = new AtomicLong();

    private record PendingRecord(InstrumentKey key, PressureWindow window) {
    }

    public BaselineStore(DetectionConfig.Baseline config, BaselineRepository repository, Clock clock) {
        this.config = config;
        this.repository = repository;
        this.clock = clock;
        this.queue = new ArrayBlockingQueue<>(config.queueCapacity());
    }

    /**
     * Current context for {@code key}, or the configured default with a data-quality
     * penalty when the key has no history yet.
     */
    public BaselineContext get(InstrumentKey key) {
        BaselineContext context = published.get(key);
        return context != null ? context : defaultContext(key);
    }

    /**
     * Fallback context served for keys without history.
     */
    public BaselineContext defaultContext(InstrumentKey key) {
        return new BaselineContext(key,
                config.defaultMean(),
                config.defaultStd(),
                PercentileLadder.normal(config.defaultMean(), config.defaultStd()),
                0,
                config.fallbackDataQuality() * qualityFactor(),
                true);
    }

    /**
     * Enqueue a closed window for the background updater. Never blocks.
     */
    public void record(InstrumentKey key, PressureWindow window) {
        if (!key.equals(window.key())) {
            throw new IllegalArgumentException("Window key " + window.key() + " does not match " + key);
        }
        PendingRecord pending = new PendingRecord(key, window);
        while (!queue.offer(pending)) {
            PendingRecord evicted = queue.poll();
            if (evicted != null) {
                long total = dropped.incrementAndGet();
                log.warn("Baseline queue full (capacity={}), dropped oldest window key={} start={} totalDropped={}",
                        config.queueCapacity(), evicted.key(), evicted.window().windowStart(), total);
            }
        }
        recorded.incrementAndGet();
    }

    /**
     * Drain the queue and apply every pending window in order.
     *
     * @return number of windows folded into a baseline (replays excluded)
     */
    public int applyPending() {
        writerLock.lock();
        try {
            List<PendingRecord> batch = new ArrayList<>();
            queue.drainTo(batch);
            if (batch.isEmpty()) return 0;

            Map<InstrumentKey, Set<LocalDate>> touched = new TreeMap<>();
            int count = 0;
            for (PendingRecord pending : batch) {
                PressureWindow window = pending.window();
                LocalDate day = dayOf(window.windowStart());
                RollingBaseline state = states.computeIfAbsent(pending.key(),
                        k -> new RollingBaseline(k, config.reservoirSize()));
                if (state.apply(window.windowStart(), day, window.pressureRatio())) {
                    touched.computeIfAbsent(pending.key(), k -> new LinkedHashSet<>()).add(day);
                    count++;
                } else {
                    replays.incrementAndGet();
                    log.debug("Ignoring replayed window key={} start={}", pending.key(), window.windowStart());
                }
            }

            persist(touched);
            touched.keySet().forEach(this::publish);
            applied.addAndGet(count);
            log.debug("Applied {} of {} pending windows across {} keys", count, batch.size(), touched.size());
            return count;
        } finally {
            writerLock.unlock();
        }
    }

    /**
     * Full recompute: drop days outside the lookback and rebuild each key's
     * statistic from the remaining per-day summaries.
     *
     * @return number of keys recomputed
     */
    public int recomputeAll() {
        writerLock.lock();
        try {
            LocalDate cutoff = cutoff();
            int droppedDays = 0;
            for (RollingBaseline state : states.values()) {
                droppedDays += state.recompute(cutoff);
            }
            states.values().removeIf(RollingBaseline::isEmpty);
            published.keySet().retainAll(states.keySet());

            if (degraded) {
                tryRestorePersistence();
            }
            if (!degraded) {
                try {
                    int removed = repository.deleteBefore(cutoff);
                    log.debug("Deleted {} persisted baseline rows before {}", removed, cutoff);
                } catch (BaselinePersistenceException e) {
                    markDegraded(e);
                }
            }

            states.keySet().forEach(this::publish);
            log.info("Baseline recompute: keys={} droppedDays={} cutoff={} degraded={}",
                    states.size(), droppedDays, cutoff, degraded);
            return states.size();
        } finally {
            writerLock.unlock();
        }
    }

    /**
     * Rebuild state from persisted days inside the lookback. Called once on startup.
     *
     * @return number of keys restored
     */
    public int loadFromRepository() {
        writerLock.lock();
        try {
            List<DailyStats> rows;
            try {
                rows = repository.loadSince(cutoff());
            } catch (BaselinePersistenceException e) {
                markDegraded(e);
                return 0;
            }
            for (DailyStats row : rows) {
                states.computeIfAbsent(row.key(), k -> new RollingBaseline(k, config.reservoirSize())).restore(row);
            }
            states.keySet().forEach(this::publish);
            log.info("Restored baselines for {} keys from {} persisted days", states.size(), rows.size());
            return states.size();
        } finally {
            writerLock.unlock();
        }
    }

    /**
     * Snapshot of every published context, sorted by key.
     */
    public Map<InstrumentKey, BaselineContext> contexts() {
        return new TreeMap<>(published);
    }

    public boolean isDegraded() {
        return degraded;
    }

    public int pendingCount() {
        return queue.size();
    }

    public int trackedKeyCount() {
        return published.size();
    }

    public long getRecordedCount() {
        return recorded.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getAppliedCount() {
        return applied.get();
    }

    public long getReplayCount() {
        return replays.get();
    }

    /** Must be called while holding the writer lock. */
    private void persist(Map<InstrumentKey, Set<LocalDate>> touched) {
        if (degraded) return;
        try {
            touched.forEach((key, days) -> {
                RollingBaseline state = states.get(key);
                days.forEach(day -> repository.upsert(state.dailyStats(day)));
            });
        } catch (BaselinePersistenceException e) {
            markDegraded(e);
        }
    }

    /** Must be called while holding the writer lock. */
    private void tryRestorePersistence() {
        try {
            for (RollingBaseline state : states.values()) {
                for (LocalDate day : state.trackedDays()) {
                    repository.upsert(state.dailyStats(day));
                }
            }
            degraded = false;
            log.info("Baseline persistence restored, {} keys written back", states.size());
        } catch (BaselinePersistenceException e) {
            log.warn("Baseline persistence still unavailable: {}", e.getMessage());
        }
    }

    /** Must be called while holding the writer lock. */
    private void markDegraded(BaselinePersistenceException e) {
        if (!degraded) {
            degraded = true;
            log.warn("Baseline persistence unavailable, continuing memory-only with data quality x{}: {}",
                    config.degradedQualityFactor(), e.getMessage());
            states.keySet().forEach(this::publish);
        }
    }

    /** Must be called while holding the writer lock. */
    private void publish(InstrumentKey key) {
        RollingBaseline state = states.get(key);
        BaselineContext context = state == null ? null : state.toContext(config, qualityFactor());
        if (context == null) {
            published.remove(key);
        } else {
            published.put(key, context);
        }
    }

    private double qualityFactor() {
        return degraded ? config.degradedQualityFactor() : 1.0;
    }

    private LocalDate cutoff() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(config.lookbackDays() - 1L);
    }

    private static LocalDate dayOf(long epochMillis) {
        return LocalDate.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC);
    }
}
