package com.flow;

import com.flow.event.OrderEvent;
import com.flow.model.BaselineContext;
import com.flow.model.InitiatorSide;
import com.flow.model.InstrumentKey;
import com.flow.model.PercentileLadder;
import com.flow.model.PressureWindow;

/**
 * Shared builders for windows, events and baselines used across tests.
 */
public final class Fixtures {

    /** 2023-11-14T22:15:00Z, aligned to a five-minute bucket. */
    public static final long T0 = 1_700_000_100_000L;
    public static final long FIVE_MINUTES = 300_000L;

    public static final InstrumentKey CALL_21900 = InstrumentKey.call(21900);
    public static final InstrumentKey PUT_21900 = InstrumentKey.put(21900);
    public static final InstrumentKey CALL_21950 = InstrumentKey.call(21950);

    private Fixtures() {
    }

    /**
     * Fully classified window with a flat price of 100.
     */
    public static PressureWindow window(InstrumentKey key, long start, long bidVolume, long askVolume) {
        return window(key, start, bidVolume, askVolume, 100.0, 100.0);
    }

    public static PressureWindow window(InstrumentKey key, long start, long bidVolume, long askVolume,
                                        double firstPrice, double lastPrice) {
        long volume = bidVolume + askVolume;
        return new PressureWindow(key, start, start + FIVE_MINUTES,
                bidVolume, askVolume, 0,
                10, 10, 0,
                firstPrice, lastPrice, volume * (firstPrice + lastPrice) / 2.0);
    }

    /**
     * Window whose pressure ratio is {@code ratio} on a bid volume of 100.
     */
    public static PressureWindow windowWithRatio(InstrumentKey key, long start, double ratio) {
        return window(key, start, 100, Math.round(ratio * 100));
    }

    public static BaselineContext baseline(InstrumentKey key, double mean, double std, double dataQuality) {
        return new BaselineContext(key, mean, std, PercentileLadder.normal(mean, std), 1_000, dataQuality, false);
    }

    public static OrderEvent event(InstrumentKey key, long timestamp, long size, InitiatorSide initiator) {
        return new OrderEvent(key, timestamp, 100.0, size, initiator);
    }
}
