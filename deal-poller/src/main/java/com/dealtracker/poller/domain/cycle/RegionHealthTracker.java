package com.dealtracker.poller.domain.cycle;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Counts consecutive cycles in which a region failed fatally. Any successful cycle resets it.
 */
@Slf4j
@Component
public class RegionHealthTracker {

    private final ConcurrentMap<String, Integer> consecutiveFatal = new ConcurrentHashMap<>();
    private final int fatalThreshold;

    public RegionHealthTracker(UpstreamSettings settings) {
        this.fatalThreshold = settings.fatalThreshold();
    }

    public int recordFatal(String regionKey) {
        int count = consecutiveFatal.merge(regionKey, 1, Integer::sum);
        if (count == fatalThreshold) {
            log.warn("region.unhealthy: region={}, consecutive_fatal={}", regionKey, count);
        }
        return count;
    }

    public void recordSuccess(String regionKey) {
        var previous = consecutiveFatal.remove(regionKey);
        if (previous != null && previous >= fatalThreshold) {
            log.info("region.recovered: region={}, after_fatal_cycles={}", regionKey, previous);
        }
    }

    public int consecutiveFatal(String regionKey) {
        return consecutiveFatal.getOrDefault(regionKey, 0);
    }

    public int unhealthyRegions() {
        return (int) consecutiveFatal.values().stream().filter(count -> count >= fatalThreshold).count();
    }
}
