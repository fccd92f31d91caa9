package com.dealtracker.poller.domain.cycle;

public enum RegionStatus {
    COMPLETED,
    SKIPPED
}
