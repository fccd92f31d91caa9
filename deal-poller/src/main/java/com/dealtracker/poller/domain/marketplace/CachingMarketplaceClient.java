package com.dealtracker.poller.domain.marketplace;

import com.dealtracker.poller.domain.cache.ReadThroughCache;
import com.dealtracker.poller.domain.listing.Store;
import com.dealtracker.poller.domain.region.Region;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;

/**
 * Puts a {@link ReadThroughCache} in front of another client. Store lookups are keyed by the
 * whole region query, listing lookups by store id.
 */
@RequiredArgsConstructor
public class CachingMarketplaceClient implements MarketplaceClient {

    private final MarketplaceClient delegate;
    private final ReadThroughCache<String, List<MarketplaceStore>> storeCache;
    private final ReadThroughCache<String, List<MarketplaceListing>> listingCache;
    private final Duration ttl;

    @Override
    public List<MarketplaceStore> listStores(Region region) {
        return storeCache.getOrFetch(region.storeQueryKey(), ttl, () -> List.copyOf(delegate.listStores(region)));
    }

    @Override
    public List<MarketplaceListing> listListings(Store store) {
        return listingCache.getOrFetch(
                "items:" + store.storeId(), ttl, () -> List.copyOf(delegate.listListings(store)));
    }
}
