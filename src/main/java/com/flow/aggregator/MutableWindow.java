package com.flow.aggregator;

import com.flow.event.OrderEvent;
import com.flow.model.InitiatorSide;
import com.flow.model.InstrumentKey;
import com.flow.model.PressureWindow;

/**
 * Mutable accumulator for an in-progress pressure window.
 *
 * Not thread-safe by itself; callers synchronize per key.
 * Kept separate from the immutable {@link PressureWindow} record to clearly separate
 * mutable aggregation state from the immutable domain model.
 */
class MutableWindow {

    private final InstrumentKey key;
    private final long bucketStart;
    private final long bucketEnd;
    private long bidVolume;
    private long askVolume;
    private long unclassifiedVolume;
    private int tradeCount;
    private int classifiedTrades;
    private int droppedEvents;
    private final double firstPrice;
    private double lastPrice;
    private double notional;

    MutableWindow(InstrumentKey key, long bucketStart, long bucketEnd, OrderEvent first) {
        this.key = key;
        this.bucketStart = bucketStart;
        this.bucketEnd = bucketEnd;
        this.firstPrice = first.price();
        update(first);
    }

    /**
     * Incorporate a new event into this window.
     */
    void update(OrderEvent event) {
        switch (event.initiator()) {
            case ASK -> askVolume += event.size();
            case BID -> bidVolume += event.size();
            default -> unclassifiedVolume += event.size();
        }
        if (event.initiator() != InitiatorSide.NONE) classifiedTrades++;
        tradeCount++;
        lastPrice = event.price();
        notional += event.notional();
    }

    void recordDropped(int count) {
        droppedEvents += count;
    }

    long getBucketStart() {
        return bucketStart;
    }

    /**
     * Produce an immutable snapshot of the current state.
     */
    PressureWindow snapshot() {
        return new PressureWindow(key, bucketStart, bucketEnd,
                bidVolume, askVolume, unclassifiedVolume,
                tradeCount, classifiedTrades, droppedEvents,
                firstPrice, lastPrice, notional);
    }
}
