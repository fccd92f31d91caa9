package com.dealtracker.poller.domain.cycle;

public record StoreOutcome(String storeId, int changesWritten, int eventsDispatched, boolean failed, boolean skipped) {

    public static StoreOutcome skipped(String storeId) {
        return new StoreOutcome(storeId, 0, 0, false, true);
    }
}
