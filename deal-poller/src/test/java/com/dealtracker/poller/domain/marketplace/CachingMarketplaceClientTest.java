package com.dealtracker.poller.domain.marketplace;

import static com.dealtracker.poller.test.fixtures.DealFixtures.SOME_STORE_ID;
import static com.dealtracker.poller.test.fixtures.DealFixtures.T0;
import static com.dealtracker.poller.test.fixtures.DealFixtures.calgary;
import static com.dealtracker.poller.test.fixtures.DealFixtures.fetched;
import static com.dealtracker.poller.test.fixtures.DealFixtures.marketplaceStore;
import static com.dealtracker.poller.test.fixtures.DealFixtures.someStore;
import static org.assertj.core.api.Assertions.assertThat;

import com.dealtracker.poller.domain.cache.ReadThroughCache;
import com.dealtracker.poller.test.fixtures.FakeMarketplaceClient;
import com.dealtracker.poller.test.fixtures.MutableClock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CachingMarketplaceClientTest {

    private MutableClock clock;
    private FakeMarketplaceClient upstream;
    private CachingMarketplaceClient client;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        upstream = new FakeMarketplaceClient();
        client = new CachingMarketplaceClient(
                upstream, new ReadThroughCache<>(clock), new ReadThroughCache<>(clock), Duration.ofSeconds(60));
    }

    @Test
    void listStores_withinTtl_servedFromCache() {
        upstream.storesByRegion.put("calgary", List.of(marketplaceStore("a")));

        client.listStores(calgary());
        clock.advance(Duration.ofSeconds(59));
        var stores = client.listStores(calgary());

        assertThat(stores).hasSize(1);
        assertThat(upstream.storeCalls).hasValue(1);
    }

    @Test
    void listStores_differentRadius_separateEntry() {
        upstream.storesByRegion.put("calgary", List.of(marketplaceStore("a")));

        client.listStores(calgary());
        client.listStores(calgary().toBuilder().radiusMeters(10000).build());

        assertThat(upstream.storeCalls).hasValue(2);
    }

    @Test
    void listListings_afterTtl_refetched() {
        upstream.listingsByStore.put(SOME_STORE_ID, List.of(fetched("L", 899)));

        client.listListings(someStore());
        clock.advance(Duration.ofSeconds(60));
        client.listListings(someStore());

        assertThat(upstream.listingCalls).hasValue(2);
    }
}
