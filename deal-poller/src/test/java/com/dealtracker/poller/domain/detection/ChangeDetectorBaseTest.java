package com.dealtracker.poller.domain.detection;

import com.dealtracker.poller.domain.listing.Listing;
import com.dealtracker.poller.domain.listing.Store;
import com.dealtracker.poller.domain.marketplace.MarketplaceListing;
import com.dealtracker.poller.test.fixtures.DealFixtures;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;

public abstract class ChangeDetectorBaseTest {

    ChangeDetector detector;
    Store store;

    @BeforeEach
    void setUp() {
        detector = new ChangeDetector();
        store = DealFixtures.someStore();
    }

    DetectionResult detect(List<Listing> previous, List<MarketplaceListing> fetched, Instant now) {
        return detector.detect(store, previous, fetched, now);
    }

    static ListingChange only(DetectionResult result, String listingId) {
        return result.changes().stream()
                .filter(change -> change.current().listingId().equals(listingId))
                .findFirst()
                .orElseThrow();
    }
}
