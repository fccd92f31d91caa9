package com.dealtracker.poller.domain.cycle;

import com.dealtracker.poller.domain.detection.ChangeDetector;
import com.dealtracker.poller.domain.listing.Listing;
import com.dealtracker.poller.domain.listing.Store;
import com.dealtracker.poller.domain.marketplace.MarketplaceClient;
import com.dealtracker.poller.domain.notification.NotificationEvent;
import com.dealtracker.poller.domain.persistence.ListingSnapshotPort;
import com.dealtracker.poller.domain.persistence.ListingWriter;
import com.dealtracker.poller.domain.persistence.StorePort;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fetch, detect, write, dispatch for a single store, strictly in that order.
 *
 * <p>Marketplace failures propagate so the region can give up. A persistence failure stops the
 * store's remaining writes; events of listings that were already committed are still dispatched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoreProcessor {

    private final MarketplaceClient marketplaceClient;
    private final StorePort storePort;
    private final ListingSnapshotPort snapshotPort;
    private final ChangeDetector changeDetector;
    private final ListingWriter listingWriter;
    private final UpstreamSettings upstreamSettings;
    private final Clock clock;

    public StoreOutcome process(Store store, CycleScope scope) {
        var fetched = upstreamSettings.retry().executeSupplier(() -> marketplaceClient.listListings(store));

        var now = clock.instant();
        List<Listing> snapshot;
        try {
            storePort.upsertStore(store, now);
            snapshot = snapshotPort.loadSnapshot(store.storeId());
        } catch (RuntimeException e) {
            log.error("store.failed: cycle_id={}, region={}, store_id={}, stage=load, error={}",
                    scope.cycleId(), store.regionKey(), store.storeId(), e.getMessage(), e);
            return new StoreOutcome(store.storeId(), 0, 0, true, false);
        }

        var result = changeDetector.detect(store, snapshot, fetched, now);

        List<NotificationEvent> committed = new ArrayList<>();
        var written = 0;
        var failed = false;
        for (var change : result.changes()) {
            try {
                listingWriter.apply(change);
            } catch (RuntimeException e) {
                log.error("store.failed: cycle_id={}, region={}, store_id={}, stage=write, listing_id={}, error={}",
                        scope.cycleId(), store.regionKey(), store.storeId(), change.current().listingId(),
                        e.getMessage(), e);
                failed = true;
                break;
            }
            written++;
            ChangeDetector.toEvent(store, change).ifPresent(committed::add);
        }

        if (!committed.isEmpty()) {
            scope.notifications().dispatch(committed, store.regionKey());
        }
        log.debug("store.processed: cycle_id={}, region={}, store_id={}, fetched={}, written={}, events={}",
                scope.cycleId(), store.regionKey(), store.storeId(), fetched.size(), written, committed.size());
        return new StoreOutcome(store.storeId(), written, committed.size(), failed, false);
    }
}
