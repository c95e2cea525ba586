package com.flow.comparison;

import com.flow.config.DetectionConfig;
import com.flow.engine.KeyState;
import com.flow.engine.SignalEngine;
import com.flow.engine.VolumeRatioAlgorithm;
import com.flow.model.InstrumentKey;
import com.flow.model.PressureWindow;
import com.flow.store.BaselineStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flow.Fixtures.CALL_21900;
import static com.flow.Fixtures.PUT_21900;
import static com.flow.Fixtures.T0;
import static com.flow.Fixtures.baseline;
import static com.flow.Fixtures.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ComparisonHarnessTest {

    private static final InstrumentKey CALL_22500 = InstrumentKey.call(22500);
    private static final InstrumentKey CALL_23000 = InstrumentKey.call(23000);

    private BaselineStore store;
    private SignalEngine engine;
    private ComparisonHarness harness;

    /** Straddle pair, one clean signal and one quiet window. */
    private final List<PressureWindow> batch = List.of(
            window(CALL_21900, T0, 100, 300),
            window(PUT_21900, T0, 100, 300),
            window(CALL_22500, T0, 100, 300),
            window(CALL_23000, T0, 100, 100));

    @BeforeEach
    void setUp() {
        DetectionConfig config = DetectionConfig.defaults();
        store = mock(BaselineStore.class);
        when(store.get(any())).thenAnswer(inv -> baseline(inv.getArgument(0), 1.0, 0.3, 1.0));
        engine = SignalEngine.create(config, store);
        harness = new ComparisonHarness(engine, new VolumeRatioAlgorithm(config));
    }

    @Test
    @DisplayName("Windows are matched by key and start and classified by who signalled")
    void agreementPerWindow() {
        ComparisonResult result = harness.compareOnce(batch);

        assertThat(result.primaryAlgorithm()).isEqualTo(SignalEngine.NAME);
        assertThat(result.referenceAlgorithm()).isEqualTo(VolumeRatioAlgorithm.NAME);
        assertThat(result.comparisons()).hasSize(4);
        assertThat(result.count(Agreement.BOTH)).isEqualTo(1);
        assertThat(result.count(Agreement.REFERENCE_ONLY)).isEqualTo(2);
        assertThat(result.count(Agreement.NEITHER)).isEqualTo(1);
        assertThat(result.primarySignals()).isEqualTo(1);
        assertThat(result.referenceSignals()).isEqualTo(3);

        KeyComparison both = result.comparisons().stream()
                .filter(c -> c.agreement() == Agreement.BOTH).findFirst().orElseThrow();
        assertThat(both.key()).isEqualTo(CALL_22500);
        assertThat(both.directionAgreement()).isTrue();
        assertThat(both.confidenceDelta()).isPositive();
    }

    @Test
    @DisplayName("Comparison runs in shadow mode and leaves the live engine untouched")
    void noSideEffects() {
        harness.compareOnce(batch);

        verify(store, never()).record(any(), any());
        assertThat(engine.stateOf(CALL_21900)).isEqualTo(KeyState.IDLE);
        assertThat(engine.evaluate(List.of(window(CALL_22500, T0, 100, 300)))).hasSize(1);
    }

    @Test
    @DisplayName("Stats accumulate across runs")
    void statsAccumulate() {
        assertThat(harness.stats().runs()).isZero();

        harness.compareOnce(batch);
        harness.compareOnce(batch);
        ComparisonStats stats = harness.stats();

        assertThat(stats.runs()).isEqualTo(2);
        assertThat(stats.windowsCompared()).isEqualTo(8);
        assertThat(stats.agreement())
                .containsEntry(Agreement.BOTH, 2L)
                .containsEntry(Agreement.REFERENCE_ONLY, 4L)
                .containsEntry(Agreement.NEITHER, 2L);
        assertThat(stats.directionAgreementRate()).isEqualTo(1.0);
        assertThat(stats.meanConfidenceDelta()).isNegative();
        assertThat(stats.meanPrimaryMicros()).isNotNegative();
    }
}
