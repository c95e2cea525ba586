package com.flow.model;

/**
 * Immutable pressure aggregate for one (strike, side) key over one time bucket.
 *
 * @param key                Strike and option side
 * @param windowStart        Bucket start in Unix milliseconds (inclusive)
 * @param windowEnd          Bucket end in Unix milliseconds (exclusive)
 * @param bidVolume          Contracts executed at the bid (seller-initiated)
 * @param askVolume          Contracts executed at the ask (buyer-initiated)
 * @param unclassifiedVolume Contracts executed between the quotes
 * @param tradeCount         Number of accepted events
 * @param classifiedTrades   Accepted events with a known initiator side
 * @param droppedEvents      Late events rejected while this window was open
 * @param firstPrice         Price of the first accepted event
 * @param lastPrice          Price of the last accepted event
 * @param notional           Sum of price * size, for VWAP
 */
public record PressureWindow(
        InstrumentKey key,
        long windowStart,
        long windowEnd,
        long bidVolume,
        long askVolume,
        long unclassifiedVolume,
        int tradeCount,
        int classifiedTrades,
        int droppedEvents,
        double firstPrice,
        double lastPrice,
        double notional
) {

    public PressureWindow {
        if (key == null) throw new IllegalArgumentException("Key must not be null");
        if (windowEnd <= windowStart) throw new IllegalArgumentException("Window end must be after start");
        if (bidVolume < 0 || askVolume < 0 || unclassifiedVolume < 0) {
            throw new IllegalArgumentException("Volumes must be non-negative");
        }
        if (tradeCount < 0 || classifiedTrades < 0 || droppedEvents < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
        if (classifiedTrades > tradeCount) throw new IllegalArgumentException("Classified trades exceed trade count");
    }

    /**
     * ask-volume / max(bid-volume, 1).
     */
    public double pressureRatio() {
        return (double) askVolume / Math.max(bidVolume, 1L);
    }

    public long totalVolume() {
        return bidVolume + askVolume + unclassifiedVolume;
    }

    public long classifiedVolume() {
        return bidVolume + askVolume;
    }

    public DominantSide dominantSide() {
        return DominantSide.of(askVolume, bidVolume);
    }

    public Direction direction() {
        return Direction.of(key.side(), dominantSide());
    }

    /**
     * Share of received events that were accepted with a known initiator.
     * Late drops and unclassified executions both lower it.
     */
    public double dataCompleteness() {
        int received = tradeCount + droppedEvents;
        if (received == 0) return 0.0;
        return (double) classifiedTrades / received;
    }

    /**
     * Relative price change from first to last trade in the window.
     */
    public double priceChange() {
        if (firstPrice <= 0) return 0.0;
        return (lastPrice - firstPrice) / firstPrice;
    }

    public double vwap() {
        long volume = totalVolume();
        return volume > 0 ? notional / volume : lastPrice;
    }

    public double averageTradeSize() {
        return tradeCount > 0 ? (double) totalVolume() / tradeCount : 0.0;
    }

    public boolean contains(long timestampMillis) {
        return timestampMillis >= windowStart && timestampMillis < windowEnd;
    }
}
