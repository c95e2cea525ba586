package com.flow.model;

import java.util.Comparator;

/**
 * Identifies one option instrument by strike price and side.
 * Record equality makes it safe as a ConcurrentHashMap key.
 *
 * @param strike Strike price (e.g., 21900.0)
 * @param side   Call or put
 */
public record InstrumentKey(double strike, OptionSide side) implements Comparable<InstrumentKey> {

    private static final Comparator<InstrumentKey> ORDER =
            Comparator.comparingDouble(InstrumentKey::strike).thenComparing(InstrumentKey::side);

    public InstrumentKey {
        if (!(strike > 0) || Double.isInfinite(strike)) throw new IllegalArgumentException("Strike must be positive");
        if (side == null) throw new IllegalArgumentException("Side must not be null");
    }

    public static InstrumentKey call(double strike) {
        return new InstrumentKey(strike, OptionSide.CALL);
    }

    public static InstrumentKey put(double strike) {
        return new InstrumentKey(strike, OptionSide.PUT);
    }

    /**
     * The key on the other side of the same strike (call &lt;-&gt; put).
     */
    public InstrumentKey opposite() {
        return new InstrumentKey(strike, side.opposite());
    }

    @Override
    public int compareTo(InstrumentKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return (strike == Math.rint(strike) ? String.valueOf((long) strike) : String.valueOf(strike)) + side.getCode();
    }
}
