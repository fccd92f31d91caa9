package com.dealtracker.poller.domain.notification;

import java.time.LocalTime;

/**
 * Inclusive time-of-day range in UTC. A start later than the end wraps past midnight.
 */
public record NotificationWindow(LocalTime start, LocalTime end) {

    public static final NotificationWindow ALL_DAY = new NotificationWindow(LocalTime.MIN, LocalTime.MAX);

    public boolean contains(LocalTime time) {
        if (!start.isAfter(end)) {
            return !time.isBefore(start) && !time.isAfter(end);
        }
        return !time.isBefore(start) || !time.isAfter(end);
    }
}
