package com.flow.comparison;

import com.flow.engine.BatchResult;
import com.flow.engine.EvaluationMode;
import com.flow.engine.KeyEvaluation;
import com.flow.engine.SignalAlgorithm;
import com.flow.model.Direction;
import com.flow.model.InstrumentKey;
import com.flow.model.PressureWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs a primary algorithm and a reference algorithm over the same batch and
 * records where they agree. Both run in {@link EvaluationMode#SHADOW}, so the
 * harness never changes either algorithm's state.
 */
public class ComparisonHarness {

    private static final Logger log = LoggerFactory.getLogger(ComparisonHarness.class);

    private final SignalAlgorithm primary;
    private final SignalAlgorithm reference;

    private final ReentrantLock lock = new ReentrantLock();
    private long runs;
    private long windowsCompared;
    private final Map<Agreement, Long> agreementCounts = new EnumMap<>(Agreement.class);
    private long bothSignalled;
    private long directionMatches;
    private double confidenceDeltaSum;
    private long primaryNanosTotal;
    private long referenceNanosTotal;

    public ComparisonHarness(SignalAlgorithm primary, SignalAlgorithm reference) {
        this.primary = primary;
        this.reference = reference;
    }

    public ComparisonResult compareOnce(List<PressureWindow> batch) {
        BatchResult primaryResult = primary.evaluateDetailed(batch, EvaluationMode.SHADOW);
        BatchResult referenceResult = reference.evaluateDetailed(batch, EvaluationMode.SHADOW);

        Map<String, KeyEvaluation> referenceByWindow = new HashMap<>();
        referenceResult.evaluations().forEach(e -> referenceByWindow.put(identity(e.key(), e.windowStart()), e));

        List<KeyComparison> comparisons = new ArrayList<>(primaryResult.evaluations().size());
        for (KeyEvaluation p : primaryResult.evaluations()) {
            KeyEvaluation r = referenceByWindow.get(identity(p.key(), p.windowStart()));
            comparisons.add(compare(p, r));
        }

        ComparisonResult result = new ComparisonResult(primary.name(), reference.name(), comparisons,
                primaryResult.signals().size(), referenceResult.signals().size(),
                primaryResult.elapsedNanos(), referenceResult.elapsedNanos());
        accumulate(result);
        log.debug("Comparison {} vs {}: windows={} both={} primaryOnly={} referenceOnly={}",
                primary.name(), reference.name(), comparisons.size(), result.count(Agreement.BOTH),
                result.count(Agreement.PRIMARY_ONLY), result.count(Agreement.REFERENCE_ONLY));
        return result;
    }

    public ComparisonStats stats() {
        lock.lock();
        try {
            return new ComparisonStats(
                    runs,
                    windowsCompared,
                    agreementCounts,
                    bothSignalled == 0 ? 0.0 : (double) directionMatches / bothSignalled,
                    windowsCompared == 0 ? 0.0 : confidenceDeltaSum / windowsCompared,
                    runs == 0 ? 0.0 : primaryNanosTotal / 1_000.0 / runs,
                    runs == 0 ? 0.0 : referenceNanosTotal / 1_000.0 / runs);
        } finally {
            lock.unlock();
        }
    }

    private static KeyComparison compare(KeyEvaluation p, KeyEvaluation r) {
        boolean primarySignal = p.isEmitted();
        boolean referenceSignal = r != null && r.isEmitted();
        Direction primaryDirection = primarySignal ? p.signal().direction() : null;
        Direction referenceDirection = referenceSignal ? r.signal().direction() : null;
        double referenceConfidence = r == null ? 0.0 : r.confidence();
        return new KeyComparison(
                p.key(),
                p.windowStart(),
                Agreement.of(primarySignal, referenceSignal),
                primaryDirection,
                referenceDirection,
                primarySignal && referenceSignal && primaryDirection == referenceDirection,
                p.confidence(),
                referenceConfidence,
                p.confidence() - referenceConfidence);
    }

    private void accumulate(ComparisonResult result) {
        lock.lock();
        try {
            runs++;
            windowsCompared += result.comparisons().size();
            primaryNanosTotal += result.primaryNanos();
            referenceNanosTotal += result.referenceNanos();
            for (KeyComparison c : result.comparisons()) {
                agreementCounts.merge(c.agreement(), 1L, Long::sum);
                confidenceDeltaSum += c.confidenceDelta();
                if (c.agreement() == Agreement.BOTH) {
                    bothSignalled++;
                    if (c.directionAgreement()) directionMatches++;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private static String identity(InstrumentKey key, long windowStart) {
        return key + "@" + windowStart;
    }
}
