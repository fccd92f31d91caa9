package com.dealtracker.poller.application.config;

import com.dealtracker.poller.domain.region.Region;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Interval and regions are checked by the cycle driver at start-up rather than here, so a bad
 * schedule leaves the driver in its failed state instead of aborting context refresh.
 */
@Validated
@ConfigurationProperties(prefix = "poller")
public record DealPollerProperties(
        Duration interval,
        @NotNull Duration initialDelay,
        @Min(1) int maxConcurrentRegions,
        @Min(1) int maxConcurrentStores,
        @NotNull @Valid CacheConfig cache,
        @NotNull @Valid UpstreamConfig upstream,
        @NotNull @Valid BackoffConfig retry,
        @NotNull @Valid EmailConfig email,
        @NotNull @Valid LiveConfig live,
        @NotNull @Valid HealthConfig health,
        Map<String, @Valid RegionConfig> regions) {

    public List<Region> toRegions() {
        if (regions == null) {
            return List.of();
        }
        return regions.entrySet().stream()
                .map(entry -> entry.getValue().toRegion(entry.getKey()))
                .toList();
    }

    public record CacheConfig(@NotNull Duration ttl) {}

    public record UpstreamConfig(
            @NotBlank String baseUrl,
            String apiKey,
            @NotNull Duration connectTimeout,
            @NotNull Duration readTimeout) {}

    /** Exponential backoff; the delay after attempt n is initial * multiplier^(n-1), capped at max. */
    public record BackoffConfig(
            @Min(1) int maxAttempts,
            @Min(1) long initialDelayMs,
            @Min(1) long maxDelayMs,
            @DecimalMin("1.0") double multiplier) {

        public RetryConfig toRetryConfig(Predicate<Throwable> retryOn) {
            return RetryConfig.custom()
                    .maxAttempts(maxAttempts)
                    .intervalFunction(IntervalFunction.ofExponentialBackoff(
                            Duration.ofMillis(initialDelayMs), multiplier, Duration.ofMillis(maxDelayMs)))
                    .retryOnException(retryOn)
                    .build();
        }
    }

    public record EmailConfig(@Min(1) int sampleSize, @NotNull @Valid BackoffConfig retry) {}

    public record LiveConfig(@Min(1) int queueCapacity, @NotNull Duration pollTimeout) {}

    public record HealthConfig(@Min(1) int fatalThreshold) {}

    public record RegionConfig(
            String label,
            double latitude,
            double longitude,
            @Min(1) int radiusMeters,
            @Min(1) int storeLimit) {

        Region toRegion(String key) {
            return Region.builder()
                    .key(key)
                    .label(label == null ? key : label)
                    .latitude(latitude)
                    .longitude(longitude)
                    .radiusMeters(radiusMeters)
                    .storeLimit(storeLimit)
                    .build();
        }
    }
}
