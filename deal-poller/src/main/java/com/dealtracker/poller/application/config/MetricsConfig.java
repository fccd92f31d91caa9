package com.dealtracker.poller.application.config;

import com.dealtracker.poller.domain.cycle.RegionHealthTracker;
import com.dealtracker.poller.domain.notification.LiveConnectionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter cyclesCompletedCounter(MeterRegistry registry) {
        return Counter.builder("deals.cycles.completed")
                .description("Polling cycles that ran to completion")
                .register(registry);
    }

    @Bean
    public Counter regionsSkippedCounter(MeterRegistry registry) {
        return Counter.builder("deals.regions.skipped")
                .description("Region runs abandoned because of upstream failures")
                .register(registry);
    }

    @Bean
    public Counter dealEventsCounter(MeterRegistry registry) {
        return Counter.builder("deals.events.dispatched")
                .description("New, price drop and price rise events handed to fan-out")
                .register(registry);
    }

    @Bean
    public Counter emailsEnqueuedCounter(MeterRegistry registry) {
        return Counter.builder("deals.emails.enqueued")
                .description("Email batches written to the outbox")
                .register(registry);
    }

    @Bean
    public Counter emailsDroppedCounter(MeterRegistry registry) {
        return Counter.builder("deals.emails.dropped")
                .description("Email batches dropped after exhausting retries")
                .register(registry);
    }

    @Bean
    public Gauge liveConnectionsGauge(MeterRegistry registry, LiveConnectionRegistry connectionRegistry) {
        return Gauge.builder("deals.live.connections", connectionRegistry::connectionCount)
                .description("Open live deal connections")
                .register(registry);
    }

    @Bean
    public Gauge unhealthyRegionsGauge(MeterRegistry registry, RegionHealthTracker healthTracker) {
        return Gauge.builder("deals.regions.unhealthy", healthTracker::unhealthyRegions)
                .description("Regions at or above the consecutive fatal failure threshold")
                .register(registry);
    }
}
