package com.dealtracker.poller.domain.cycle;

import com.dealtracker.poller.domain.exceptions.FatalMarketplaceException;
import com.dealtracker.poller.domain.exceptions.MarketplaceException;
import com.dealtracker.poller.domain.listing.Store;
import com.dealtracker.poller.domain.marketplace.MarketplaceClient;
import com.dealtracker.poller.domain.marketplace.MarketplaceStore;
import com.dealtracker.poller.domain.region.Region;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs one region of a cycle: lists its stores and processes them on the store pool. A store is
 * claimed in the cycle scope when its task starts, so a store listed by two regions runs once.
 *
 * <p>Every marketplace failure ends the region for this cycle and never escapes: stores already
 * running finish, stores not yet started are skipped.
 */
@Slf4j
@Service
public class RegionProcessor {

    private final MarketplaceClient marketplaceClient;
    private final StoreProcessor storeProcessor;
    private final RegionHealthTracker healthTracker;
    private final UpstreamSettings upstreamSettings;
    private final AsyncTaskExecutor storeExecutor;

    public RegionProcessor(
            MarketplaceClient marketplaceClient,
            StoreProcessor storeProcessor,
            RegionHealthTracker healthTracker,
            UpstreamSettings upstreamSettings,
            @Qualifier("storeExecutor") AsyncTaskExecutor storeExecutor) {
        this.marketplaceClient = marketplaceClient;
        this.storeProcessor = storeProcessor;
        this.healthTracker = healthTracker;
        this.upstreamSettings = upstreamSettings;
        this.storeExecutor = storeExecutor;
    }

    public RegionOutcome process(Region region, CycleScope scope) {
        List<Store> stores;
        try {
            stores = upstreamSettings.retry().executeSupplier(() -> marketplaceClient.listStores(region))
                    .stream()
                    .map(store -> toStore(store, region))
                    .toList();
        } catch (MarketplaceException e) {
            return skip(region, scope, e, List.of());
        }

        var aborted = new AtomicBoolean();
        List<CompletableFuture<StoreOutcome>> futures = new ArrayList<>();
        for (var store : stores) {
            futures.add(storeExecutor.submitCompletable(() -> {
                // a store is claimed only when it starts; an aborted region holds no claims
                if (aborted.get() || !scope.claim(store.storeId())) {
                    return StoreOutcome.skipped(store.storeId());
                }
                return storeProcessor.process(store, scope);
            }));
        }

        List<StoreOutcome> outcomes = new ArrayList<>();
        MarketplaceException upstreamFailure = null;
        for (var i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                aborted.set(true);
                log.warn("region.interrupted: cycle_id={}, region={}", scope.cycleId(), region.key());
                return RegionOutcome.skipped(region.key(), countProcessed(outcomes), countEvents(outcomes),
                        "interrupted");
            } catch (ExecutionException e) {
                if (e.getCause() instanceof MarketplaceException marketplaceFailure) {
                    aborted.set(true);
                    if (upstreamFailure == null) {
                        upstreamFailure = marketplaceFailure;
                    }
                } else {
                    log.error("store.failed: cycle_id={}, region={}, store_id={}, stage=unexpected, error={}",
                            scope.cycleId(), region.key(), stores.get(i).storeId(), e.getCause().getMessage(),
                            e.getCause());
                    outcomes.add(new StoreOutcome(stores.get(i).storeId(), 0, 0, true, false));
                }
            }
        }

        if (upstreamFailure != null) {
            return skip(region, scope, upstreamFailure, outcomes);
        }

        healthTracker.recordSuccess(region.key());
        var failedStores = (int) outcomes.stream().filter(StoreOutcome::failed).count();
        var outcome = new RegionOutcome(region.key(), RegionStatus.COMPLETED, countProcessed(outcomes), failedStores,
                countEvents(outcomes), null);
        log.info("region.completed: cycle_id={}, region={}, stores={}, failed_stores={}, events={}",
                scope.cycleId(), region.key(), outcome.storesProcessed(), failedStores, outcome.eventsDispatched());
        return outcome;
    }

    private RegionOutcome skip(Region region, CycleScope scope, MarketplaceException e, List<StoreOutcome> outcomes) {
        if (e instanceof FatalMarketplaceException) {
            var consecutive = healthTracker.recordFatal(region.key());
            log.error("region.skipped: cycle_id={}, region={}, reason=fatal, consecutive_fatal={}, error={}",
                    scope.cycleId(), region.key(), consecutive, e.getMessage());
        } else {
            log.warn("region.skipped: cycle_id={}, region={}, reason=retries_exhausted, attempts={}, error={}",
                    scope.cycleId(), region.key(), upstreamSettings.retry().getRetryConfig().getMaxAttempts(), e.getMessage());
        }
        return RegionOutcome.skipped(region.key(), countProcessed(outcomes), countEvents(outcomes), e.getMessage());
    }

    private static Store toStore(MarketplaceStore store, Region region) {
        return Store.builder()
                .storeId(store.storeId())
                .name(store.name())
                .address(store.address())
                .latitude(store.latitude())
                .longitude(store.longitude())
                .regionKey(region.key())
                .build();
    }

    private static int countProcessed(List<StoreOutcome> outcomes) {
        return (int) outcomes.stream().filter(outcome -> !outcome.skipped()).count();
    }

    private static int countEvents(List<StoreOutcome> outcomes) {
        return outcomes.stream().mapToInt(StoreOutcome::eventsDispatched).sum();
    }
}
