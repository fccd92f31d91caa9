package com.dealtracker.poller.domain.marketplace;

import com.dealtracker.poller.domain.listing.Store;
import com.dealtracker.poller.domain.region.Region;
import java.util.List;

/**
 * Upstream marketplace. Implementations throw
 * {@link com.dealtracker.poller.domain.exceptions.TransientMarketplaceException} for failures worth
 * retrying and {@link com.dealtracker.poller.domain.exceptions.FatalMarketplaceException} otherwise.
 */
public interface MarketplaceClient {

    List<MarketplaceStore> listStores(Region region);

    List<MarketplaceListing> listListings(Store store);
}
