package com.flow.event;

import com.flow.model.InitiatorSide;
import com.flow.model.InstrumentKey;

/**
 * Represents a single normalized order/trade tick for one option instrument.
 *
 * @param key       Strike and option side
 * @param timestamp Unix timestamp in milliseconds
 * @param price     Execution price
 * @param size      Number of contracts
 * @param initiator Side of the book the execution hit
 */
public record OrderEvent(InstrumentKey key, long timestamp, double price, long size, InitiatorSide initiator) {

    public OrderEvent {
        if (key == null) throw new IllegalArgumentException("Key must not be null");
        if (timestamp <= 0) throw new IllegalArgumentException("Timestamp must be positive");
        if (!(price > 0)) throw new IllegalArgumentException("Price must be positive");
        if (size < 0) throw new IllegalArgumentException("Size must be non-negative");
        if (initiator == null) initiator = InitiatorSide.NONE;
    }

    public boolean isAskInitiated() {
        return initiator == InitiatorSide.ASK;
    }

    public boolean isBidInitiated() {
        return initiator == InitiatorSide.BID;
    }

    /**
     * Notional traded, used for VWAP.
     */
    public double notional() {
        return price * size;
    }
}
