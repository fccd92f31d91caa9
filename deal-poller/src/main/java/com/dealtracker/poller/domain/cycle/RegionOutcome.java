package com.dealtracker.poller.domain.cycle;

public record RegionOutcome(
        String regionKey,
        RegionStatus status,
        int storesProcessed,
        int storesFailed,
        int eventsDispatched,
        String failure) {

    public static RegionOutcome skipped(String regionKey, int storesProcessed, int eventsDispatched, String failure) {
        return new RegionOutcome(regionKey, RegionStatus.SKIPPED, storesProcessed, 0, eventsDispatched, failure);
    }
}
