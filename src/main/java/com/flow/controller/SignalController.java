package com.flow.controller;

import com.flow.comparison.ComparisonHarness;
import com.flow.comparison.ComparisonStats;
import com.flow.engine.Signal;
import com.flow.model.InstrumentKey;
import com.flow.model.OptionSide;
import com.flow.service.FlowDetectionService;
import com.flow.service.SignalSummary;
import com.flow.store.BaselineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only endpoints over emitted signals, baselines and comparison totals.
 *
 * <pre>
 * GET /signals/recent?limit=20
 * GET /signals/summary
 * GET /baselines?strike=21900&amp;side=C
 * GET /comparison/stats
 * </pre>
 */
@RestController
@CrossOrigin(origins = "*") // Allow any frontend to query; restrict in production
public class SignalController {

    private static final Logger log = LoggerFactory.getLogger(SignalController.class);

    static final int MAX_LIMIT = 100;

    private final FlowDetectionService flowDetectionService;
    private final BaselineStore baselineStore;
    private final ComparisonHarness comparisonHarness;

    public SignalController(FlowDetectionService flowDetectionService,
                            BaselineStore baselineStore,
                            ComparisonHarness comparisonHarness) {
        this.flowDetectionService = flowDetectionService;
        this.baselineStore = baselineStore;
        this.comparisonHarness = comparisonHarness;
    }

    /**
     * Latest emitted signals, newest first.
     *
     * @param limit Maximum number of signals, 1 to {@value #MAX_LIMIT}
     */
    @GetMapping("/signals/recent")
    public ResponseEntity<?> recentSignals(@RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            log.warn("Invalid signal limit requested: {}", limit);
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "limit must be between 1 and " + MAX_LIMIT));
        }
        List<Signal> signals = flowDetectionService.recentSignals(limit);
        return ResponseEntity.ok(signals);
    }

    @GetMapping("/signals/summary")
    public ResponseEntity<SignalSummary> summary() {
        return ResponseEntity.ok(flowDetectionService.summary());
    }

    /**
     * Baseline for one key. Keys without history return the default context.
     *
     * @param strike Strike price
     * @param side   "C", "P", "CALL" or "PUT"
     */
    @GetMapping("/baselines")
    public ResponseEntity<?> baseline(@RequestParam double strike, @RequestParam String side) {
        Optional<OptionSide> parsedSide = OptionSide.fromCode(side);
        if (parsedSide.isEmpty()) {
            log.warn("Invalid option side requested: {}", side);
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Unsupported side: " + side + ". Supported: C, P"));
        }
        if (!(strike > 0)) {
            return ResponseEntity.badRequest().body(Map.of("error", "strike must be positive"));
        }
        InstrumentKey key = new InstrumentKey(strike, parsedSide.get());
        return ResponseEntity.ok(BaselineResponse.of(baselineStore.get(key)));
    }

    @GetMapping("/comparison/stats")
    public ResponseEntity<ComparisonStats> comparisonStats() {
        return ResponseEntity.ok(comparisonHarness.stats());
    }
}
