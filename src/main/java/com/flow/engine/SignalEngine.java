package com.flow.engine;

import com.flow.config.DetectionConfig;
import com.flow.detection.ConfidenceScorer;
import com.flow.detection.CoordinationIndex;
import com.flow.detection.MarketMakingAssessment;
import com.flow.detection.MarketMakingDetector;
import com.flow.detection.RecentHistory;
import com.flow.detection.ScoreResult;
import com.flow.model.BaselineContext;
import com.flow.model.InstrumentKey;
import com.flow.model.PressureWindow;
import com.flow.store.BaselineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Institutional-flow algorithm: baseline lookup, market-making filter,
 * confidence scoring and hard gates for every closed window in a batch.
 *
 * <p>Per window:
 * <ol>
 *   <li>Fetch the key's {@link BaselineContext}</li>
 *   <li>Share one {@link CoordinationIndex} built for the whole batch</li>
 *   <li>Assess market making against recent history and the batch</li>
 *   <li>Score confidence</li>
 *   <li>Apply the hard gates and the confidence floor; failures are suppressed, not errors</li>
 * </ol>
 *
 * <p>In {@link EvaluationMode#LIVE} every scored window is then recorded into the
 * baseline store and the recent history, after the whole batch has been scored.
 * A failure confined to one window suppresses that window only.
 */
public class SignalEngine implements SignalAlgorithm {

    private static final Logger log = LoggerFactory.getLogger(SignalEngine.class);

    public static final String NAME = "institutional-flow";

    private static final Comparator<PressureWindow> CLOSE_ORDER = Comparator
            .comparingLong(PressureWindow::windowStart)
            .thenComparing(PressureWindow::key);

    private final DetectionConfig config;
    private final BaselineStore baselineStore;
    private final MarketMakingDetector marketMakingDetector;
    private final ConfidenceScorer scorer;
    private final RecentHistory history;

    private final ConcurrentMap<InstrumentKey, KeyState> states = new ConcurrentHashMap<>();

    public SignalEngine(DetectionConfig config,
                        BaselineStore baselineStore,
                        MarketMakingDetector marketMakingDetector,
                        ConfidenceScorer scorer,
                        RecentHistory history) {
        this.config = config;
        this.baselineStore = baselineStore;
        this.marketMakingDetector = marketMakingDetector;
        this.scorer = scorer;
        this.history = history;
    }

    /**
     * Wire the default collaborators from one configuration.
     */
    public static SignalEngine create(DetectionConfig config, BaselineStore baselineStore) {
        DetectionConfig.MarketMaking mm = config.marketMaking();
        return new SignalEngine(config, baselineStore,
                new MarketMakingDetector(mm),
                new ConfidenceScorer(config),
                new RecentHistory(mm.historyRetention(), mm.historyCapacity()));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BatchResult evaluateDetailed(List<PressureWindow> batch, EvaluationMode mode) {
        long started = System.nanoTime();
        List<PressureWindow> ordered = new ArrayList<>(batch);
        ordered.sort(CLOSE_ORDER);
        boolean live = mode == EvaluationMode.LIVE;

        if (live) ordered.forEach(w -> states.put(w.key(), KeyState.WINDOW_CLOSED));
        CoordinationIndex index = buildIndex(ordered);

        List<Signal> signals = new ArrayList<>();
        List<KeyEvaluation> evaluations = new ArrayList<>(ordered.size());
        for (PressureWindow window : ordered) {
            KeyEvaluation evaluation = evaluateWindow(window, index, live);
            evaluations.add(evaluation);
            if (evaluation.isEmitted()) signals.add(evaluation.signal());
            if (live) states.put(window.key(), evaluation.state());
        }

        if (live) {
            for (PressureWindow window : ordered) {
                baselineStore.record(window.key(), window);
                history.add(window);
            }
        }

        long elapsed = System.nanoTime() - started;
        if (!ordered.isEmpty()) {
            log.debug("[{}] Evaluated {} windows, emitted {} signals in {}us (mode={})",
                    NAME, ordered.size(), signals.size(), elapsed / 1_000, mode);
        }
        return new BatchResult(NAME, signals, evaluations, elapsed);
    }

    /**
     * A window began accumulating for {@code key}.
     */
    public void windowOpened(InstrumentKey key) {
        states.put(key, KeyState.WINDOW_OPEN);
    }

    /**
     * {@code key} was evicted for inactivity.
     */
    public void keyIdle(InstrumentKey key) {
        states.remove(key);
    }

    public KeyState stateOf(InstrumentKey key) {
        return states.getOrDefault(key, KeyState.IDLE);
    }

    public Map<KeyState, Long> stateCounts() {
        Map<KeyState, Long> counts = new EnumMap<>(KeyState.class);
        states.values().forEach(state -> counts.merge(state, 1L, Long::sum));
        return counts;
    }

    private KeyEvaluation evaluateWindow(PressureWindow window, CoordinationIndex index, boolean live) {
        InstrumentKey key = window.key();
        double dataQuality = window.dataCompleteness();
        try {
            BaselineContext baseline = baselineStore.get(key);
            dataQuality = Math.min(dataQuality, baseline.dataQuality());

            MarketMakingAssessment mm = marketMakingDetector.assess(
                    window, history.atStrike(key.strike()), index);
            ScoreResult score = scorer.score(window, baseline, mm, index);
            if (live) states.put(key, KeyState.SCORED);

            SuppressionReason reason = gate(window, score);
            if (reason != null) {
                log.debug("[{}] Suppressed window start={} reason={} confidence={} quality={}",
                        key, window.windowStart(), reason,
                        String.format("%.3f", score.confidence()), String.format("%.2f", score.dataQuality()));
                return KeyEvaluation.suppressed(key, window.windowStart(), score.confidence(),
                        score.dataQuality(), reason);
            }

            Signal signal = toSignal(window, baseline, mm, score);
            if (live) {
                log.info("[{}] Signal {} {} ratio={} z={} mm={} confidence={}",
                        key, signal.strength(), signal.direction(),
                        String.format("%.2f", signal.pressureRatio()), String.format("%.2f", signal.zScore()),
                        String.format("%.2f", signal.marketMakingScore()), String.format("%.3f", signal.confidence()));
            }
            return KeyEvaluation.emitted(signal, score.dataQuality());
        } catch (RuntimeException e) {
            log.warn("[{}] Evaluation failed for window start={}, key suppressed (quality={}): {}",
                    key, window.windowStart(), String.format("%.2f", dataQuality), e.toString());
            return KeyEvaluation.suppressed(key, window.windowStart(), 0.0, dataQuality,
                    SuppressionReason.COMPUTATION_FAILURE);
        }
    }

    private CoordinationIndex buildIndex(List<PressureWindow> batch) {
        try {
            return CoordinationIndex.build(batch);
        } catch (RuntimeException e) {
            log.warn("Coordination index build failed for {} windows, scoring without coordination: {}",
                    batch.size(), e.toString());
            return CoordinationIndex.empty();
        }
    }

    /**
     * Hard gates first, then the confidence floor. Null when the window qualifies.
     */
    private SuppressionReason gate(PressureWindow window, ScoreResult score) {
        DetectionConfig.Gates gates = config.gates();
        if (window.pressureRatio() < gates.minPressureRatio()) return SuppressionReason.BELOW_MIN_PRESSURE;
        if (window.totalVolume() < gates.minVolume()) return SuppressionReason.BELOW_MIN_VOLUME;
        if (window.dataCompleteness() < gates.minDataQuality()) return SuppressionReason.LOW_DATA_QUALITY;
        if (!score.isSignal()) return SuppressionReason.BELOW_CONFIDENCE;
        return null;
    }

    private Signal toSignal(PressureWindow window, BaselineContext baseline,
                            MarketMakingAssessment mm, ScoreResult score) {
        return new Signal(
                window.key(),
                window.windowEnd(),
                window.windowStart(),
                window.pressureRatio(),
                window.bidVolume(),
                window.askVolume(),
                window.dominantSide(),
                window.direction(),
                baseline.mean(),
                score.baseline().zScore(),
                score.baseline().percentileRank(),
                mm.score(),
                mm.straddleDetected(),
                mm.volatilityCrush(),
                score.coordinationScore(),
                score.confidence(),
                score.strength(),
                RecommendedAction.forStrength(score.strength()),
                score.strength().getPositionMultiplier(),
                1.0 - score.confidence(),
                NAME);
    }
}
