package com.dealtracker.poller.application.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dealtracker.poller.domain.exceptions.FatalMarketplaceException;
import com.dealtracker.poller.domain.exceptions.TransientMarketplaceException;
import io.github.resilience4j.retry.Retry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class BackoffConfigTest {

    private static final DealPollerProperties.BackoffConfig QUICK_BACKOFF =
            new DealPollerProperties.BackoffConfig(4, 1, 3, 2.0);

    @Test
    void toRetryConfig_transientFailure_retriedWithCappedExponentialWaits() {
        // given
        var retry = Retry.of("marketplace", QUICK_BACKOFF.toRetryConfig(TransientMarketplaceException.class::isInstance));
        List<Duration> waits = new ArrayList<>();
        retry.getEventPublisher().onRetry(event -> waits.add(event.getWaitInterval()));
        var calls = new AtomicInteger();

        // when / then
        assertThatThrownBy(() -> retry.executeSupplier(() -> {
            calls.incrementAndGet();
            throw TransientMarketplaceException.status("stores", 503);
        })).isInstanceOf(TransientMarketplaceException.class);
        assertThat(calls).hasValue(4);
        assertThat(waits).containsExactly(Duration.ofMillis(1), Duration.ofMillis(2), Duration.ofMillis(3));
    }

    @Test
    void toRetryConfig_fatalFailure_notRetried() {
        // given
        var retry = Retry.of("marketplace", QUICK_BACKOFF.toRetryConfig(TransientMarketplaceException.class::isInstance));
        var calls = new AtomicInteger();

        // when / then
        assertThatThrownBy(() -> retry.executeSupplier(() -> {
            calls.incrementAndGet();
            throw FatalMarketplaceException.status("stores", 401);
        })).isInstanceOf(FatalMarketplaceException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void toRetryConfig_recoversBeforeBudgetRunsOut() {
        // given
        var retry = Retry.of("emailEnqueue", QUICK_BACKOFF.toRetryConfig(e -> true));
        var calls = new AtomicInteger();

        // when
        var result = retry.executeSupplier(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("queue unavailable");
            }
            return "enqueued";
        });

        // then
        assertThat(result).isEqualTo("enqueued");
        assertThat(calls).hasValue(3);
        assertThat(retry.getRetryConfig().getMaxAttempts()).isEqualTo(4);
    }
}
