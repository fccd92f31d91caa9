package com.dealtracker.poller.application.config;

import com.dealtracker.common.json.JacksonConfig;
import com.dealtracker.poller.domain.cache.ReadThroughCache;
import com.dealtracker.poller.domain.cycle.UpstreamSettings;
import com.dealtracker.poller.domain.exceptions.TransientMarketplaceException;
import com.dealtracker.poller.domain.marketplace.CachingMarketplaceClient;
import com.dealtracker.poller.domain.marketplace.MarketplaceClient;
import com.dealtracker.poller.domain.notification.FanOutSettings;
import com.dealtracker.poller.infrastructure.marketplace.FlashfoodMarketplaceClient;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import java.net.http.HttpClient;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.http.converter.json.JacksonJsonHttpMessageConverter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.json.JsonMapper;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class PollerConfig {

    private final DealPollerProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JsonMapper jsonMapper() {
        return JacksonConfig.createObjectMapper();
    }

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean
    public UpstreamSettings upstreamSettings(RetryRegistry retryRegistry) {
        var retry = retryRegistry.retry(
                "marketplace", properties.retry().toRetryConfig(TransientMarketplaceException.class::isInstance));
        logRetries(retry);
        return new UpstreamSettings(retry, properties.health().fatalThreshold());
    }

    @Bean
    public FanOutSettings fanOutSettings(RetryRegistry retryRegistry) {
        var retry = retryRegistry.retry("emailEnqueue", properties.email().retry().toRetryConfig(e -> true));
        logRetries(retry);
        return new FanOutSettings(retry, properties.email().sampleSize());
    }

    @Bean
    public FlashfoodMarketplaceClient flashfoodMarketplaceClient(JsonMapper jsonMapper) {
        var upstream = properties.upstream();
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(upstream.connectTimeout())
                .build();
        var requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(upstream.readTimeout());

        var restClient = RestClient.builder()
                .baseUrl(upstream.baseUrl())
                .requestFactory(requestFactory)
                .messageConverters(converters -> converters.add(0, new JacksonJsonHttpMessageConverter(jsonMapper)))
                .defaultHeader("Accept", "application/json, text/plain, */*")
                .defaultHeader("Accept-Language", "en-CA")
                .defaultHeader("flashfood-app-info", "app/shopper,appversion/3.2.6,appbuild/35155,os/ios")
                .defaultHeader("User-Agent", "Flashfood/35155 CFNetwork/3826.600.41 Darwin/24.6.0")
                .defaultHeader("x-ff-api-key", upstream.apiKey() == null ? "" : upstream.apiKey())
                .build();
        return new FlashfoodMarketplaceClient(restClient);
    }

    @Bean
    @Primary
    public MarketplaceClient marketplaceClient(FlashfoodMarketplaceClient flashfoodMarketplaceClient, Clock clock) {
        return new CachingMarketplaceClient(
                flashfoodMarketplaceClient,
                new ReadThroughCache<>(clock),
                new ReadThroughCache<>(clock),
                properties.cache().ttl());
    }

    @Bean
    public ThreadPoolTaskScheduler pollScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("poll-timer-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor regionExecutor() {
        return boundedPool(properties.maxConcurrentRegions(), "poll-region-");
    }

    @Bean
    public ThreadPoolTaskExecutor storeExecutor() {
        return boundedPool(properties.maxConcurrentStores(), "poll-store-");
    }

    /** One draining thread per open live connection; idle threads retire after the keep-alive. */
    @Bean
    public ThreadPoolTaskExecutor liveSendExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(0);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(30);
        executor.setThreadNamePrefix("live-send-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    private static void logRetries(Retry retry) {
        var maxAttempts = retry.getRetryConfig().getMaxAttempts();
        retry.getEventPublisher().onRetry(event -> log.warn(
                "retry.scheduled: name={}, attempt={}, max_attempts={}, delay_ms={}, error={}",
                event.getName(), event.getNumberOfRetryAttempts(), maxAttempts, event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()));
    }

    // fixed size with an unbounded queue: the pool size is the concurrency bound
    private static ThreadPoolTaskExecutor boundedPool(int size, String prefix) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
