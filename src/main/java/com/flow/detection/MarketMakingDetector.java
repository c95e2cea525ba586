package com.flow.detection;

import com.flow.config.DetectionConfig;
import com.flow.model.InstrumentKey;
import com.flow.model.OptionSide;
import com.flow.model.PressureWindow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Estimates whether a window is market making rather than directional positioning.
 *
 * <p>Two patterns are checked at the window's strike:
 * <ul>
 *   <li>Straddle coordination: an opposite-side window started within the configured
 *       offset with comparable volume</li>
 *   <li>Volatility crush: calls and puts both losing value over the same period</li>
 * </ul>
 *
 * <p>Stateless. The result depends only on the arguments.
 */
public class MarketMakingDetector {

    /** Straddle probability at which the straddle flag is raised. */
    static final double STRADDLE_FLAG_PROBABILITY = 0.5;

    private final DetectionConfig.MarketMaking config;
    private final long offsetMillis;

    public MarketMakingDetector(DetectionConfig.MarketMaking config) {
        this.config = config;
        this.offsetMillis = config.straddleTimeOffset().toMillis();
    }

    /**
     * @param window        The window under evaluation
     * @param recentHistory Recently scored windows, at least those at the window's strike
     * @param coordination  Index over the current batch
     */
    public MarketMakingAssessment assess(PressureWindow window,
                                         List<PressureWindow> recentHistory,
                                         CoordinationIndex coordination) {
        List<PressureWindow> sameStrike = sameStrike(window, recentHistory, coordination);

        double straddle = straddleProbability(window, sameStrike);
        double[] changes = sideChanges(sameStrike);
        double crush = crushProbability(changes[0], changes[1]);
        boolean crushFlag = changes[0] <= -config.crushDeclineThreshold()
                && changes[1] <= -config.crushDeclineThreshold();

        double score = clamp(config.straddleWeight() * straddle + config.volatilityCrushWeight() * crush);
        return new MarketMakingAssessment(
                straddle,
                straddle >= STRADDLE_FLAG_PROBABILITY,
                crush,
                crushFlag,
                score,
                FilterRecommendation.of(score, config.maxProbability()));
    }

    /**
     * balanceWeight * volume balance + (1 - balanceWeight) * temporal proximity,
     * best over every opposite-side window inside the offset.
     */
    double straddleProbability(PressureWindow window, List<PressureWindow> sameStrike) {
        InstrumentKey opposite = window.key().opposite();
        double best = 0.0;
        for (PressureWindow candidate : sameStrike) {
            if (!candidate.key().equals(opposite)) continue;
            long dt = Math.abs(candidate.windowStart() - window.windowStart());
            if (dt > offsetMillis) continue;
            double proximity = 1.0 - (double) dt / offsetMillis;
            double balance = volumeBalance(window.totalVolume(), candidate.totalVolume());
            double probability = config.straddleBalanceWeight() * balance
                    + (1.0 - config.straddleBalanceWeight()) * proximity;
            best = Math.max(best, probability);
        }
        return clamp(best);
    }

    /**
     * Positive only when both sides declined; reaches 1 at twice the decline threshold.
     */
    double crushProbability(double callChange, double putChange) {
        if (!(callChange < 0 && putChange < 0)) return 0.0;
        double decline = Math.min(-callChange, -putChange);
        return clamp(decline / (2.0 * config.crushDeclineThreshold()));
    }

    /**
     * Windows at the evaluated strike whose start lies within the offset, deduplicated
     * by (key, start), including the evaluated window itself.
     */
    private List<PressureWindow> sameStrike(PressureWindow window,
                                            List<PressureWindow> recentHistory,
                                            CoordinationIndex coordination) {
        double strike = window.key().strike();
        Map<String, PressureWindow> unique = new LinkedHashMap<>();
        unique.put(identity(window), window);
        for (PressureWindow w : recentHistory) {
            if (w.key().strike() == strike && withinOffset(window, w)) unique.putIfAbsent(identity(w), w);
        }
        for (PressureWindow w : coordination.atStrike(strike)) {
            if (withinOffset(window, w)) unique.putIfAbsent(identity(w), w);
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * Relative price change per side, from the earliest window's first trade to the
     * latest window's last trade. Index 0 is calls, 1 is puts; 0 when a side is missing.
     */
    private static double[] sideChanges(List<PressureWindow> sameStrike) {
        return new double[]{sideChange(sameStrike, OptionSide.CALL), sideChange(sameStrike, OptionSide.PUT)};
    }

    private static double sideChange(List<PressureWindow> windows, OptionSide side) {
        List<PressureWindow> sideWindows = windows.stream()
                .filter(w -> w.key().side() == side)
                .sorted(Comparator.comparingLong(PressureWindow::windowStart))
                .toList();
        if (sideWindows.isEmpty()) return 0.0;
        double first = sideWindows.get(0).firstPrice();
        double last = sideWindows.get(sideWindows.size() - 1).lastPrice();
        return first > 0 ? (last - first) / first : 0.0;
    }

    private boolean withinOffset(PressureWindow a, PressureWindow b) {
        return Math.abs(a.windowStart() - b.windowStart()) <= offsetMillis;
    }

    private static double volumeBalance(long a, long b) {
        long sum = a + b;
        return sum == 0 ? 0.0 : 2.0 * Math.min(a, b) / sum;
    }

    private static String identity(PressureWindow window) {
        return window.key() + "@" + window.windowStart();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
