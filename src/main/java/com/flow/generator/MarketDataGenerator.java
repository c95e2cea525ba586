package com.flow.generator;

import com.flow.event.OrderEvent;
import com.flow.model.InitiatorSide;
import com.flow.model.InstrumentKey;
import com.flow.model.OptionSide;
import com.flow.service.FlowDetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated option order flow.
 *
 * <p>Produces random-walk trades for calls and puts on a ladder of strikes around
 * a configured centre. Most trades are balanced between bid and ask; now and then
 * one strike receives an ask-heavy burst of large orders to mimic institutional
 * buying. Enabled only when {@code flow.generator.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "flow.generator.enabled", havingValue = "true")
public class MarketDataGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarketDataGenerator.class);

    private final FlowDetectionService flowDetectionService;
    private final double burstProbability;

    /** Current simulated premium per instrument */
    private final Map<InstrumentKey, Double> premiums = new ConcurrentHashMap<>();
    private final List<InstrumentKey> keys = new ArrayList<>();
    private final Random random = new Random();
    private final AtomicLong eventCount = new AtomicLong(0);

    public MarketDataGenerator(
            FlowDetectionService flowDetectionService,
            @Value("${flow.generator.centre-strike:21900}") double centreStrike,
            @Value("${flow.generator.strike-step:50}") double strikeStep,
            @Value("${flow.generator.strikes-each-side:5}") int strikesEachSide,
            @Value("${flow.generator.burst-probability:0.002}") double burstProbability) {
        this.flowDetectionService = flowDetectionService;
        this.burstProbability = burstProbability;

        for (int i = -strikesEachSide; i <= strikesEachSide; i++) {
            double strike = centreStrike + i * strikeStep;
            for (OptionSide side : OptionSide.values()) {
                InstrumentKey key = new InstrumentKey(strike, side);
                keys.add(key);
                // deeper in the money carries more premium
                double moneyness = side == OptionSide.CALL ? -i : i;
                premiums.put(key, Math.max(5.0, 100.0 + moneyness * 30.0));
            }
        }

        log.info("MarketDataGenerator initialized with {} instruments around strike {}", keys.size(), centreStrike);
    }

    /**
     * Generate one trade per instrument on each invocation, plus an occasional burst.
     * Rate is controlled by {@code flow.generator.interval-ms}.
     */
    @Scheduled(fixedRateString = "${flow.generator.interval-ms:200}")
    public void generate() {
        long now = System.currentTimeMillis();

        for (InstrumentKey key : keys) {
            double premium = premiums.compute(key, (k, current) ->
                    Math.max(current + current * random.nextGaussian() * 0.002, 0.05));
            InitiatorSide initiator = randomInitiator(0.5);
            long size = 1 + random.nextInt(20);
            emit(new OrderEvent(key, now, premium, size, initiator));
        }

        if (random.nextDouble() < burstProbability) {
            InstrumentKey target = keys.get(random.nextInt(keys.size()));
            double premium = premiums.get(target);
            int orders = 20 + random.nextInt(30);
            for (int i = 0; i < orders; i++) {
                emit(new OrderEvent(target, now, premium, 50 + random.nextInt(200), randomInitiator(0.9)));
            }
            log.info("Injected institutional burst of {} orders on {}", orders, target);
        }
    }

    /**
     * Total events generated since startup, reported by /status.
     */
    public long getEventCount() {
        return eventCount.get();
    }

    private void emit(OrderEvent event) {
        flowDetectionService.ingest(event);
        long count = eventCount.incrementAndGet();
        if (count % 5000 == 0) {
            log.info("Generated {} total events. Latest: key={} price={}",
                    count, event.key(), String.format("%.2f", event.price()));
        }
    }

    private InitiatorSide randomInitiator(double askShare) {
        double roll = random.nextDouble();
        if (roll < 0.05) return InitiatorSide.NONE;
        return roll < 0.05 + 0.95 * askShare ? InitiatorSide.ASK : InitiatorSide.BID;
    }
}
