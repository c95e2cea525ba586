package com.flow.controller;

import com.flow.config.DetectionConfig;
import com.flow.event.OrderEvent;
import com.flow.model.InitiatorSide;
import com.flow.model.InstrumentKey;
import com.flow.service.FlowDetectionService;
import com.flow.store.BaselineStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static com.flow.Fixtures.FIVE_MINUTES;
import static com.flow.Fixtures.T0;
import static com.flow.Fixtures.windowWithRatio;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "flow.generator.enabled=false",
        "spring.datasource.url=jdbc:h2:mem:flow-controller-test;DB_CLOSE_DELAY=-1",
        "flow.evaluation.interval-ms=3600000",   // evaluation is driven by the tests
        "flow.baseline.drain-interval-ms=3600000",
        "flow.detection.baseline.lookback-days=1",
        "flow.detection.baseline.expected-windows-per-day=10"
})
@DisplayName("SignalController integration tests")
class SignalControllerTest {

    private static final InstrumentKey SEEDED = InstrumentKey.call(30000);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private FlowDetectionService flowDetectionService;

    @Autowired
    private BaselineStore baselineStore;

    @Autowired
    private DetectionConfig detectionConfig;

    /** Ten calm windows ending before T0: mean 1.0, full data quality. */
    private void seedBaseline() {
        double[] ratios = {0.8, 0.9, 1.0, 1.1, 1.2, 0.8, 0.9, 1.0, 1.1, 1.2};
        for (int i = 0; i < ratios.length; i++) {
            long start = T0 - (ratios.length - i) * FIVE_MINUTES;
            baselineStore.record(SEEDED, windowWithRatio(SEEDED, start, ratios[i]));
        }
        baselineStore.applyPending();
    }

    private void buyingBurst() {
        for (int i = 0; i < 5; i++) {
            flowDetectionService.ingest(new OrderEvent(SEEDED, T0 + i * 1_000L, 100.0, 60, InitiatorSide.ASK));
            flowDetectionService.ingest(new OrderEvent(SEEDED, T0 + i * 1_000L + 500, 100.0, 20, InitiatorSide.BID));
        }
        flowDetectionService.ingest(new OrderEvent(SEEDED, T0 + FIVE_MINUTES, 100.0, 1, InitiatorSide.BID));
        flowDetectionService.evaluatePending();
    }

    @Test
    @DisplayName("Detection settings bind from properties with the test overrides applied")
    void configBound() {
        DetectionConfig defaults = DetectionConfig.defaults();
        assertThat(detectionConfig.baseline().expectedWindows()).isEqualTo(10);
        assertThat(detectionConfig.withBaseline(defaults.baseline())).isEqualTo(defaults);
    }

    @Test
    @DisplayName("GET /signals/recent returns emitted signals newest first")
    void recentSignals() throws Exception {
        seedBaseline();
        buyingBurst();

        mockMvc.perform(get("/signals/recent").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].key.strike").value(30000.0))
                .andExpect(jsonPath("$[0].key.side").value("CALL"))
                .andExpect(jsonPath("$[0].strength").value("EXTREME"))
                .andExpect(jsonPath("$[0].action").value("STRONG_BUY"))
                .andExpect(jsonPath("$[0].direction").value("LONG"))
                .andExpect(jsonPath("$[0].algorithm").value("institutional-flow"))
                .andExpect(jsonPath("$[0].dataQuality").doesNotExist());
    }

    @Test
    @DisplayName("GET /signals/recent rejects limits outside 1..100")
    void invalidLimit() throws Exception {
        mockMvc.perform(get("/signals/recent").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", startsWith("limit")));
        mockMvc.perform(get("/signals/recent").param("limit", "101"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /signals/summary aggregates retained signals")
    void summary() throws Exception {
        seedBaseline();
        buyingBurst();

        mockMvc.perform(get("/signals/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSignals", greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.byStrength.EXTREME", greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.latest", not(empty())));
    }

    @Test
    @DisplayName("GET /baselines returns the seeded statistic")
    void seededBaseline() throws Exception {
        seedBaseline();

        mockMvc.perform(get("/baselines").param("strike", "30000").param("side", "C"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.key").value("30000C"))
                .andExpect(jsonPath("$.fallback").value(false))
                .andExpect(jsonPath("$.samples", greaterThanOrEqualTo(10)))
                .andExpect(jsonPath("$.percentiles.p50").exists())
                .andExpect(jsonPath("$.percentiles.p99").exists());
    }

    @Test
    @DisplayName("GET /baselines for an unseen key returns the fallback context")
    void fallbackBaseline() throws Exception {
        mockMvc.perform(get("/baselines").param("strike", "31000").param("side", "PUT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.key").value("31000P"))
                .andExpect(jsonPath("$.fallback").value(true))
                .andExpect(jsonPath("$.samples").value(0))
                .andExpect(jsonPath("$.dataQuality").value(0.1));
    }

    @Test
    @DisplayName("GET /baselines rejects unknown sides and non-positive strikes")
    void invalidBaselineRequest() throws Exception {
        mockMvc.perform(get("/baselines").param("strike", "21900").param("side", "X"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", startsWith("Unsupported side")));
        mockMvc.perform(get("/baselines").param("strike", "-5").param("side", "C"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /comparison/stats reports zero runs while comparison is disabled")
    void comparisonStats() throws Exception {
        mockMvc.perform(get("/comparison/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runs").value(0));
    }
}
