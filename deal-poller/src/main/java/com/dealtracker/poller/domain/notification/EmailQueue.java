package com.dealtracker.poller.domain.notification;

import com.dealtracker.common.event.EmailDigest;

/**
 * Hand-off to the mail delivery process. Enqueuing the same {@code (userId, cycleId)} twice
 * must not produce a second email.
 */
public interface EmailQueue {

    void enqueue(String userId, EmailDigest digest);
}
