package com.dealtracker.poller.domain.listing;

import com.dealtracker.common.id.UlidGenerator;
import java.time.Instant;

/**
 * Immutable point in a listing's price history.
 */
public record PriceObservation(
        String id,
        String storeId,
        String listingId,
        long priceCents,
        int quantity,
        Instant observedAt) {

    public static PriceObservation of(Listing listing, Instant observedAt) {
        return new PriceObservation(
                UlidGenerator.generate(observedAt),
                listing.storeId(),
                listing.listingId(),
                listing.priceCents(),
                listing.quantity(),
                observedAt);
    }
}
