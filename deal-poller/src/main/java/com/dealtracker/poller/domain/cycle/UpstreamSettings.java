package com.dealtracker.poller.domain.cycle;

import io.github.resilience4j.retry.Retry;

/**
 * @param retry backoff applied to transient marketplace failures
 * @param fatalThreshold consecutive fatal cycles after which a region is reported unhealthy
 */
public record UpstreamSettings(Retry retry, int fatalThreshold) {}
