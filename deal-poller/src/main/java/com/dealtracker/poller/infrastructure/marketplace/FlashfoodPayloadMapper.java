package com.dealtracker.poller.infrastructure.marketplace;

import com.dealtracker.poller.domain.listing.CategoryDetector;
import com.dealtracker.poller.domain.listing.Prices;
import com.dealtracker.poller.domain.marketplace.MarketplaceListing;
import com.dealtracker.poller.domain.marketplace.MarketplaceStore;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts Flashfood payloads to marketplace records. Entries without an id or a price cannot be
 * tracked and are skipped; an unparseable expiry is left empty.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class FlashfoodPayloadMapper {

    static Optional<MarketplaceStore> toStore(FlashfoodStoresResponse.Store payload) {
        if (isBlank(payload.id())) {
            log.warn("flashfood.store_skipped: reason=missing_id, name={}", payload.name());
            return Optional.empty();
        }
        var location = payload.location();
        return Optional.of(MarketplaceStore.builder()
                .storeId(payload.id())
                .name(payload.name() == null ? "Unknown Store" : payload.name())
                .address(payload.address() == null ? null : payload.address().fullAddress())
                .latitude(location == null || location.latitude() == null ? 0.0 : location.latitude())
                .longitude(location == null || location.longitude() == null ? 0.0 : location.longitude())
                .build());
    }

    static Optional<MarketplaceListing> toListing(String storeId, FlashfoodItemsResponse.Item item) {
        if (isBlank(item.id()) || item.price() == null) {
            log.warn("flashfood.item_skipped: store_id={}, item_id={}, reason=missing_id_or_price",
                    storeId, item.id());
            return Optional.empty();
        }
        var name = item.name() == null ? "Unknown Item" : item.name();
        var original = item.originalPrice() == null ? null : Prices.toCents(item.originalPrice());
        return Optional.of(MarketplaceListing.builder()
                .listingId(item.id())
                .name(name)
                .description(item.description())
                .category(isBlank(item.category()) ? CategoryDetector.detect(name, item.description()) : item.category())
                .originalPriceCents(original)
                .priceCents(Prices.toCents(item.price()))
                .quantity(item.quantityAvailable() == null ? 0 : item.quantityAvailable())
                .expiresAt(parseExpiry(item.expiryDate()))
                .imageUrl(item.image() == null ? null : item.image().url())
                .build());
    }

    static Instant parseExpiry(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("flashfood.expiry_unparseable: value={}", value);
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
