package com.flow.service;

import com.flow.aggregator.PressureAggregator;
import com.flow.comparison.ComparisonHarness;
import com.flow.config.DetectionConfig;
import com.flow.detection.SignalStrength;
import com.flow.engine.KeyState;
import com.flow.engine.Signal;
import com.flow.engine.SignalEngine;
import com.flow.engine.VolumeRatioAlgorithm;
import com.flow.model.InitiatorSide;
import com.flow.model.InstrumentKey;
import com.flow.store.BaselineStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.flow.Fixtures.CALL_21900;
import static com.flow.Fixtures.FIVE_MINUTES;
import static com.flow.Fixtures.T0;
import static com.flow.Fixtures.baseline;
import static com.flow.Fixtures.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("FlowDetectionService")
class FlowDetectionServiceTest {

    private static final long TWO_HOURS = 7_200_000L;

    private final DetectionConfig config = DetectionConfig.defaults();
    private BaselineStore store;
    private PressureAggregator aggregator;
    private SignalEngine engine;
    private ComparisonHarness harness;

    @BeforeEach
    void setUp() {
        store = mock(BaselineStore.class);
        when(store.get(any())).thenAnswer(inv -> baseline(inv.getArgument(0), 1.0, 0.3, 1.0));
        aggregator = new PressureAggregator(config.window().windowLength(), config.window().idleTimeout());
        engine = SignalEngine.create(config, store);
        harness = new ComparisonHarness(engine, new VolumeRatioAlgorithm(config));
    }

    private FlowDetectionService service(boolean comparison, long nowMillis) {
        ObjectProvider<SignalListener> listeners = new StaticListableBeanFactory().getBeanProvider(SignalListener.class);
        Clock clock = Clock.fixed(Instant.ofEpochMilli(nowMillis), ZoneOffset.UTC);
        return new FlowDetectionService(aggregator, engine, engine, harness, clock, listeners, comparison);
    }

    /** 300 ask-initiated and 100 bid-initiated contracts inside the bucket starting at {@code start}. */
    private static void buyingBurst(FlowDetectionService service, InstrumentKey key, long start) {
        for (int i = 0; i < 5; i++) {
            service.ingest(event(key, start + i * 1_000L, 60, InitiatorSide.ASK));
            service.ingest(event(key, start + i * 1_000L + 500, 20, InitiatorSide.BID));
        }
    }

    @Test
    @DisplayName("A window closed by the next bucket's event is evaluated and published")
    void closedWindowEmitsSignal() {
        FlowDetectionService service = service(false, T0);
        List<Signal> received = new ArrayList<>();
        service.addListener(received::add);

        buyingBurst(service, CALL_21900, T0);
        assertThat(service.pendingWindowCount()).isZero();
        service.ingest(event(CALL_21900, T0 + FIVE_MINUTES, 5, InitiatorSide.BID));
        assertThat(service.pendingWindowCount()).isEqualTo(1);

        List<Signal> signals = service.evaluatePending();

        assertThat(signals).hasSize(1);
        assertThat(signals.get(0).strength()).isEqualTo(SignalStrength.EXTREME);
        assertThat(received).containsExactlyElementsOf(signals);
        assertThat(service.recentSignals(10)).containsExactlyElementsOf(signals);
        assertThat(service.summary().totalSignals()).isEqualTo(1);
        assertThat(service.getWindowsEvaluated()).isEqualTo(1);
        assertThat(service.pendingWindowCount()).isZero();
    }

    @Test
    @DisplayName("An empty batch does nothing")
    void emptyBatch() {
        FlowDetectionService service = service(false, T0);

        assertThat(service.evaluatePending()).isEmpty();
        assertThat(service.getWindowsEvaluated()).isZero();
    }

    @Test
    @DisplayName("A failing listener does not stop the others")
    void listenerIsolation() {
        FlowDetectionService service = service(false, T0);
        List<Signal> received = new ArrayList<>();
        service.addListener(signal -> {
            throw new IllegalStateException("listener down");
        });
        service.addListener(received::add);

        buyingBurst(service, CALL_21900, T0);
        service.shutdown();

        assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("Idle keys are evicted, their window evaluated and their state reset")
    void idleEviction() {
        FlowDetectionService service = service(false, T0 + TWO_HOURS);
        buyingBurst(service, CALL_21900, T0);
        assertThat(engine.stateOf(CALL_21900)).isEqualTo(KeyState.WINDOW_OPEN);

        service.evictIdleKeys();

        assertThat(service.activeKeys()).isEmpty();
        assertThat(service.pendingWindowCount()).isEqualTo(1);
        assertThat(service.evaluatePending()).hasSize(1);
        assertThat(engine.stateOf(CALL_21900)).isEqualTo(KeyState.IDLE);
    }

    @Test
    @DisplayName("A key evicted without an open window has its state cleared")
    void evictionWithoutOpenWindowClearsState() {
        FlowDetectionService service = service(false, T0 + TWO_HOURS);
        buyingBurst(service, CALL_21900, T0);
        service.shutdown();
        assertThat(engine.stateOf(CALL_21900)).isEqualTo(KeyState.EMITTED);

        service.evictIdleKeys();

        assertThat(service.activeKeys()).isEmpty();
        assertThat(service.pendingWindowCount()).isZero();
        assertThat(engine.stateOf(CALL_21900)).isEqualTo(KeyState.IDLE);
        assertThat(engine.stateCounts()).isEmpty();
    }

    @Test
    @DisplayName("A late event after eviction does not produce a second window for a closed bucket")
    void lateEventAfterEviction() {
        FlowDetectionService service = service(false, T0 + TWO_HOURS);
        buyingBurst(service, CALL_21900, T0);
        service.evictIdleKeys();
        assertThat(service.evaluatePending()).hasSize(1);

        service.ingest(event(CALL_21900, T0 + 2_000, 60, InitiatorSide.ASK));
        service.shutdown();

        assertThat(service.getWindowsEvaluated()).isEqualTo(1);
        assertThat(service.getSignalsEmitted()).isEqualTo(1);
    }

    @Test
    @DisplayName("Recently active keys survive eviction")
    void activeKeysKept() {
        FlowDetectionService service = service(false, T0 + FIVE_MINUTES);
        buyingBurst(service, CALL_21900, T0);

        service.evictIdleKeys();

        assertThat(service.activeKeys()).containsExactly(CALL_21900);
        assertThat(service.pendingWindowCount()).isZero();
    }

    @Test
    @DisplayName("Shutdown flushes and evaluates every open window")
    void shutdownFlushes() {
        FlowDetectionService service = service(false, T0);
        buyingBurst(service, CALL_21900, T0);
        buyingBurst(service, InstrumentKey.put(22500), T0);

        service.shutdown();

        assertThat(service.getWindowsEvaluated()).isEqualTo(2);
        assertThat(service.getSignalsEmitted()).isEqualTo(2);
    }

    @Test
    @DisplayName("Computation failures are counted without failing the batch")
    void computationFailuresCounted() {
        InstrumentKey broken = InstrumentKey.put(22500);
        when(store.get(broken)).thenThrow(new IllegalStateException("corrupt baseline"));
        FlowDetectionService service = service(false, T0);
        buyingBurst(service, CALL_21900, T0);
        buyingBurst(service, broken, T0);

        service.shutdown();

        assertThat(service.getComputationFailures()).isEqualTo(1);
        assertThat(service.getSignalsEmitted()).isEqualTo(1);
    }

    @Test
    @DisplayName("With comparison enabled every batch also runs through the harness")
    void comparisonRuns() {
        FlowDetectionService service = service(true, T0);
        buyingBurst(service, CALL_21900, T0);

        service.shutdown();

        assertThat(harness.stats().runs()).isEqualTo(1);
        assertThat(service.getSignalsEmitted()).isEqualTo(1);
    }

    @Test
    @DisplayName("Recent signals are returned newest first and bounded by the limit")
    void recentOrder() {
        FlowDetectionService service = service(false, T0);
        for (int i = 0; i < 3; i++) {
            buyingBurst(service, CALL_21900, T0 + i * FIVE_MINUTES);
        }
        service.shutdown();

        List<Signal> recent = service.recentSignals(2);
        assertThat(recent).hasSize(2);
        assertThat(recent.get(0).windowStart()).isEqualTo(T0 + 2 * FIVE_MINUTES);
        assertThat(recent.get(1).windowStart()).isEqualTo(T0 + FIVE_MINUTES);
        assertThat(service.summary().latest()).hasSize(3);
    }
}
