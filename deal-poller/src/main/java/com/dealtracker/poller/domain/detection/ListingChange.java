package com.dealtracker.poller.domain.detection;

import com.dealtracker.poller.domain.listing.Listing;

/**
 * One listing's classification. {@code previous} is {@code null} for a first sighting;
 * {@code current} is the state to persist.
 */
public record ListingChange(ChangeKind kind, Listing previous, Listing current) {

    /** {@code old - new} in cents; positive for drops, negative for rises, zero otherwise. */
    public long deltaCents() {
        if (kind == ChangeKind.PRICE_DROP || kind == ChangeKind.PRICE_RISE) {
            return previous.priceCents() - current.priceCents();
        }
        return 0;
    }
}
