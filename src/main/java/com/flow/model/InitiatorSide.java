package com.flow.model;

/**
 * Which side of the book an execution hit.
 * ASK means a buyer lifted the offer, BID means a seller hit the bid.
 */
public enum InitiatorSide {
    BID,
    ASK,
    /** Executed between the quotes; direction unknown. */
    NONE
}
