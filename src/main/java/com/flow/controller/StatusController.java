package com.flow.controller;

import com.flow.aggregator.PressureAggregator;
import com.flow.engine.SignalEngine;
import com.flow.generator.MarketDataGenerator;
import com.flow.service.FlowDetectionService;
import com.flow.store.BaselineStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operational endpoints for health monitoring and service introspection.
 */
@RestController
public class StatusController {

    private final FlowDetectionService flowDetectionService;
    private final PressureAggregator aggregator;
    private final BaselineStore baselineStore;
    private final SignalEngine signalEngine;
    private final ObjectProvider<MarketDataGenerator> generator;

    public StatusController(FlowDetectionService flowDetectionService,
                            PressureAggregator aggregator,
                            BaselineStore baselineStore,
                            SignalEngine signalEngine,
                            ObjectProvider<MarketDataGenerator> generator) {
        this.flowDetectionService = flowDetectionService;
        this.aggregator = aggregator;
        this.baselineStore = baselineStore;
        this.signalEngine = signalEngine;
        this.generator = generator;
    }

    /**
     * Simple liveness probe.
     * GET /ping → {"status": "ok"}
     */
    @GetMapping("/ping")
    public ResponseEntity<Map<String, String>> ping() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * Detailed service status.
     * GET /status → aggregator, evaluation, baseline store and key-state counts.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", Instant.now().toEpochMilli());
        body.put("algorithm", flowDetectionService.algorithmName());
        body.put("windowLength", aggregator.getWindowLength().label());
        body.put("activeKeys", aggregator.activeKeyCount());
        body.put("openWindows", aggregator.openWindowCount());
        body.put("eventsIngested", aggregator.getEventsIngested());
        body.put("pendingWindows", flowDetectionService.pendingWindowCount());
        body.put("windowsEvaluated", flowDetectionService.getWindowsEvaluated());
        body.put("signalsEmitted", flowDetectionService.getSignalsEmitted());
        body.put("computationFailures", flowDetectionService.getComputationFailures());
        body.put("keyStates", signalEngine.stateCounts());
        body.put("baseline", Map.of(
                "trackedKeys", baselineStore.trackedKeyCount(),
                "pending", baselineStore.pendingCount(),
                "applied", baselineStore.getAppliedCount(),
                "dropped", baselineStore.getDroppedCount(),
                "degraded", baselineStore.isDegraded()));
        MarketDataGenerator gen = generator.getIfAvailable();
        body.put("totalEventsGenerated", gen == null ? 0L : gen.getEventCount());
        return ResponseEntity.ok(body);
    }
}
