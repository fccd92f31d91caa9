package com.dealtracker.poller.domain.notification;

import io.github.resilience4j.retry.Retry;

/**
 * @param emailRetry backoff for a failed enqueue before the batch is dropped
 * @param sampleSize deals carried in one email; the total count is always exact
 */
public record FanOutSettings(Retry emailRetry, int sampleSize) {}
