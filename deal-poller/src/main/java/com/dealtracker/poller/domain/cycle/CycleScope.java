package com.dealtracker.poller.domain.cycle;

import com.dealtracker.poller.domain.notification.NotificationCycle;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State shared by every worker of one polling cycle. A store id can be claimed once per cycle,
 * so a store inside two overlapping regions is processed by whichever region starts it first.
 */
public record CycleScope(
        String cycleId, Instant startedAt, NotificationCycle notifications, Set<String> claimedStores) {

    public static CycleScope open(String cycleId, Instant startedAt, NotificationCycle notifications) {
        return new CycleScope(cycleId, startedAt, notifications, ConcurrentHashMap.newKeySet());
    }

    public boolean claim(String storeId) {
        return claimedStores.add(storeId);
    }
}
