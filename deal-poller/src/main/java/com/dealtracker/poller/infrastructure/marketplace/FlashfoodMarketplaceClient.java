package com.dealtracker.poller.infrastructure.marketplace;

import com.dealtracker.poller.domain.exceptions.FatalMarketplaceException;
import com.dealtracker.poller.domain.exceptions.TransientMarketplaceException;
import com.dealtracker.poller.domain.listing.Store;
import com.dealtracker.poller.domain.marketplace.MarketplaceClient;
import com.dealtracker.poller.domain.marketplace.MarketplaceListing;
import com.dealtracker.poller.domain.marketplace.MarketplaceStore;
import com.dealtracker.poller.domain.region.Region;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Flashfood shopper API. The {@link RestClient} carries the base URL, the app headers and the
 * per-call timeouts.
 */
@Slf4j
@RequiredArgsConstructor
public class FlashfoodMarketplaceClient implements MarketplaceClient {

    private final RestClient restClient;

    @Override
    public List<MarketplaceStore> listStores(Region region) {
        var operation = "GET /stores region=" + region.key();
        var response = call(operation, () -> restClient.get()
                .uri(uri -> uri.path("/stores")
                        .queryParam("storesWithItemsLimit", region.storeLimit())
                        .queryParam("includeItems", false)
                        .queryParam("searchLatitude", region.latitude())
                        .queryParam("searchLongitude", region.longitude())
                        .queryParam("userLocationLatitude", region.latitude())
                        .queryParam("userLocationLongitude", region.longitude())
                        .queryParam("maxDistance", region.radiusMeters())
                        .build())
                .retrieve()
                .body(FlashfoodStoresResponse.class));
        if (response == null || response.data() == null) {
            throw FatalMarketplaceException.malformed(operation, "missing data");
        }
        var stores = response.data().stream()
                .map(FlashfoodPayloadMapper::toStore)
                .flatMap(Optional::stream)
                .toList();
        log.info("flashfood.stores_fetched: region={}, stores={}", region.key(), stores.size());
        return stores;
    }

    @Override
    public List<MarketplaceListing> listListings(Store store) {
        var operation = "GET /items store_id=" + store.storeId();
        var response = call(operation, () -> restClient.get()
                .uri(uri -> uri.path("/items/").queryParam("storeIds", store.storeId()).build())
                .retrieve()
                .body(FlashfoodItemsResponse.class));
        if (response == null || response.data() == null) {
            throw FatalMarketplaceException.malformed(operation, "missing data");
        }
        var items = response.data().getOrDefault(store.storeId(), List.of());
        var listings = items.stream()
                .map(item -> FlashfoodPayloadMapper.toListing(store.storeId(), item))
                .flatMap(Optional::stream)
                .toList();
        log.debug("flashfood.items_fetched: store_id={}, items={}", store.storeId(), listings.size());
        return listings;
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            throw classify(operation, e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            throw TransientMarketplaceException.of(operation, e);
        } catch (RestClientException e) {
            throw FatalMarketplaceException.malformed(operation, e);
        }
    }

    static RuntimeException classify(String operation, int status) {
        if (status == 429 || status >= 500) {
            return TransientMarketplaceException.status(operation, status);
        }
        return FatalMarketplaceException.status(operation, status);
    }
}
