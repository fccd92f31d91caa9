package com.dealtracker.poller.domain.cycle;

import com.dealtracker.poller.domain.notification.FanOutReport;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record CycleReport(
        String cycleId, Instant startedAt, Instant finishedAt, List<RegionOutcome> regions, FanOutReport notifications) {

    public long regionsCompleted() {
        return regions.stream().filter(region -> region.status() == RegionStatus.COMPLETED).count();
    }

    public long regionsSkipped() {
        return regions.stream().filter(region -> region.status() == RegionStatus.SKIPPED).count();
    }

    public int storesProcessed() {
        return regions.stream().mapToInt(RegionOutcome::storesProcessed).sum();
    }

    public int eventsDispatched() {
        return regions.stream().mapToInt(RegionOutcome::eventsDispatched).sum();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
