package com.dealtracker.poller.domain.notification;

import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Entry point for delivering a cycle's events. Each polling cycle opens its own
 * {@link NotificationCycle} so emails can be coalesced per subscriber across stores and regions.
 */
@Service
@RequiredArgsConstructor
public class NotificationFanOut {

    private final LiveBroadcaster liveBroadcaster;
    private final PreferenceProvider preferenceProvider;
    private final EmailQueue emailQueue;
    private final FanOutSettings settings;
    private final Clock clock;

    public NotificationCycle openCycle(String cycleId) {
        return new NotificationCycle(cycleId, liveBroadcaster, preferenceProvider, emailQueue, settings, clock);
    }
}
