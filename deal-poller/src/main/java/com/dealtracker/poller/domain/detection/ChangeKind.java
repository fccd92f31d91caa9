package com.dealtracker.poller.domain.detection;

public enum ChangeKind {
    NEW,
    PRICE_DROP,
    PRICE_RISE,
    QUANTITY_CHANGED,
    UNCHANGED,
    /** Absent from this fetch, present and active before it. */
    VANISHED,
    /** Absent from this fetch and already marked vanished. Nothing to write. */
    STILL_VANISHED;

    public boolean recordsObservation() {
        return this == NEW || this == PRICE_DROP || this == PRICE_RISE;
    }

    public boolean requiresWrite() {
        return this != STILL_VANISHED;
    }
}
