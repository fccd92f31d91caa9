package com.dealtracker.poller.domain.listing;

import java.time.Instant;
import lombok.Builder;

/**
 * Persisted state of one deal at one store. {@code (storeId, listingId)} is unique.
 * A vanished listing was absent from the latest fetch for its store; it is kept so its
 * price history stays attached.
 */
@Builder(toBuilder = true)
public record Listing(
        String storeId,
        String listingId,
        String name,
        String description,
        String category,
        Long originalPriceCents,
        long priceCents,
        int quantity,
        Instant expiresAt,
        String imageUrl,
        Instant firstSeen,
        Instant lastSeen,
        boolean vanished) {

    public Integer discountPercent() {
        return Prices.discountPercent(originalPriceCents, priceCents);
    }
}
