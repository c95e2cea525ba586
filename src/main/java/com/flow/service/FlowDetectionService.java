package com.flow.service;

import com.flow.aggregator.PressureAggregator;
import com.flow.comparison.ComparisonHarness;
import com.flow.engine.BatchResult;
import com.flow.engine.EvaluationMode;
import com.flow.engine.KeyEvaluation;
import com.flow.engine.KeyState;
import com.flow.engine.Signal;
import com.flow.engine.SignalAlgorithm;
import com.flow.engine.SignalEngine;
import com.flow.engine.SuppressionReason;
import com.flow.event.OrderEvent;
import com.flow.model.InstrumentKey;
import com.flow.model.PressureWindow;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ingestion boundary and evaluation loop:
 * <ul>
 *   <li>Routes incoming {@link OrderEvent}s to the {@link PressureAggregator}</li>
 *   <li>Buffers closed windows into the next evaluation batch</li>
 *   <li>Runs the selected {@link SignalAlgorithm} over that batch on a schedule</li>
 *   <li>Hands emitted signals to every {@link SignalListener} and keeps the latest ones</li>
 *   <li>Evicts idle keys and flushes open windows on shutdown</li>
 * </ul>
 */
@Service
public class FlowDetectionService {

    private static final Logger log = LoggerFactory.getLogger(FlowDetectionService.class);

    static final int RECENT_SIGNAL_CAPACITY = 100;

    private final PressureAggregator aggregator;
    private final SignalAlgorithm algorithm;
    private final SignalEngine engine;
    private final ComparisonHarness comparisonHarness;
    private final Clock clock;
    private final boolean comparisonEnabled;
    private final List<SignalListener> listeners = new CopyOnWriteArrayList<>();

    private final Queue<PressureWindow> pending = new ConcurrentLinkedQueue<>();

    /** Serialises batches so windows of one key are evaluated in close order. */
    private final ReentrantLock evaluationLock = new ReentrantLock();

    private final Deque<Signal> recentSignals = new ArrayDeque<>(RECENT_SIGNAL_CAPACITY);

    private final AtomicLong windowsEvaluated = new AtomicLong();
    private final AtomicLong signalsEmitted = new AtomicLong();
    private final AtomicLong computationFailures = new AtomicLong();

    public FlowDetectionService(PressureAggregator aggregator,
                                SignalAlgorithm algorithm,
                                SignalEngine engine,
                                ComparisonHarness comparisonHarness,
                                Clock clock,
                                ObjectProvider<SignalListener> signalListeners,
                                @Value("${flow.comparison.enabled:false}") boolean comparisonEnabled) {
        this.aggregator = aggregator;
        this.algorithm = algorithm;
        this.engine = engine;
        this.comparisonHarness = comparisonHarness;
        this.clock = clock;
        this.comparisonEnabled = comparisonEnabled;
        signalListeners.orderedStream().forEach(listeners::add);
        log.info("Flow detection using algorithm={} listeners={} comparison={}",
                algorithm.name(), listeners.size(), comparisonEnabled);
    }

    /**
     * Ingest a single order event.
     *
     * @param event The incoming normalized event
     */
    public void ingest(OrderEvent event) {
        aggregator.ingest(event).ifPresent(pending::add);
        if (engine.stateOf(event.key()) != KeyState.WINDOW_OPEN) {
            engine.windowOpened(event.key());
        }
    }

    public void addListener(SignalListener listener) {
        listeners.add(listener);
    }

    /**
     * Evaluate every window closed since the previous run.
     *
     * @return signals emitted by this run
     */
    @Scheduled(fixedDelayString = "${flow.evaluation.interval-ms:1000}")
    public List<Signal> evaluatePending() {
        evaluationLock.lock();
        try {
            List<PressureWindow> batch = new ArrayList<>();
            PressureWindow window;
            while ((window = pending.poll()) != null) {
                batch.add(window);
            }
            if (batch.isEmpty()) return List.of();

            if (comparisonEnabled) {
                comparisonHarness.compareOnce(batch);
            }
            BatchResult result = algorithm.evaluateDetailed(batch, EvaluationMode.LIVE);
            windowsEvaluated.addAndGet(batch.size());

            for (KeyEvaluation evaluation : result.evaluations()) {
                if (evaluation.reason() == SuppressionReason.COMPUTATION_FAILURE) {
                    computationFailures.incrementAndGet();
                }
                if (!aggregator.isActive(evaluation.key())) {
                    engine.keyIdle(evaluation.key());
                }
            }
            result.signals().forEach(this::publish);

            log.debug("Evaluated batch: windows={} signals={} elapsed={}us",
                    batch.size(), result.signals().size(), result.elapsedNanos() / 1_000);
            return result.signals();
        } finally {
            evaluationLock.unlock();
        }
    }

    /**
     * Close windows of keys that went quiet; they join the next batch.
     */
    @Scheduled(fixedRateString = "${flow.eviction.interval-ms:60000}")
    public void evictIdleKeys() {
        PressureAggregator.Eviction eviction = aggregator.evictIdle(clock.millis());
        List<PressureWindow> flushed = eviction.flushed();
        pending.addAll(flushed);
        // Keys with a flushed window are released after their batch is evaluated
        Set<InstrumentKey> awaitingEvaluation = new HashSet<>();
        flushed.forEach(w -> awaitingEvaluation.add(w.key()));
        for (InstrumentKey key : eviction.evictedKeys()) {
            if (!awaitingEvaluation.contains(key) && !aggregator.isActive(key)) {
                engine.keyIdle(key);
            }
        }
        if (!eviction.evictedKeys().isEmpty()) {
            log.info("Idle eviction evicted {} keys, flushed {} windows, {} keys remain",
                    eviction.evictedKeys().size(), flushed.size(), aggregator.activeKeyCount());
        }
    }

    /**
     * On shutdown, force-flush and evaluate all open windows so no data is lost.
     */
    @PreDestroy
    public void shutdown() {
        List<PressureWindow> flushed = aggregator.flushAll();
        pending.addAll(flushed);
        List<Signal> signals = evaluatePending();
        log.info("Shutdown: flushed {} open windows, emitted {} final signals", flushed.size(), signals.size());
    }

    /**
     * Latest emitted signals, newest first.
     */
    public List<Signal> recentSignals(int limit) {
        synchronized (recentSignals) {
            List<Signal> newestFirst = new ArrayList<>(recentSignals.size());
            recentSignals.descendingIterator().forEachRemaining(newestFirst::add);
            return newestFirst.subList(0, Math.min(Math.max(limit, 0), newestFirst.size()));
        }
    }

    public SignalSummary summary() {
        synchronized (recentSignals) {
            return SignalSummary.of(signalsEmitted.get(), new ArrayList<>(recentSignals));
        }
    }

    public int pendingWindowCount() {
        return pending.size();
    }

    public List<InstrumentKey> activeKeys() {
        return aggregator.activeKeys();
    }

    public String algorithmName() {
        return algorithm.name();
    }

    public long getWindowsEvaluated() {
        return windowsEvaluated.get();
    }

    public long getSignalsEmitted() {
        return signalsEmitted.get();
    }

    public long getComputationFailures() {
        return computationFailures.get();
    }

    private void publish(Signal signal) {
        signalsEmitted.incrementAndGet();
        synchronized (recentSignals) {
            if (recentSignals.size() == RECENT_SIGNAL_CAPACITY) recentSignals.pollFirst();
            recentSignals.addLast(signal);
        }
        for (SignalListener listener : listeners) {
            try {
                listener.onSignal(signal);
            } catch (RuntimeException e) {
                log.warn("Signal listener {} failed for key={}: {}",
                        listener.getClass().getSimpleName(), signal.key(), e.toString());
            }
        }
    }
}
