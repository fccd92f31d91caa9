package com.dealtracker.poller.domain.notification;

import com.dealtracker.common.event.DealSummary;
import com.dealtracker.poller.domain.detection.ListingChange;
import com.dealtracker.poller.domain.listing.Listing;
import com.dealtracker.poller.domain.listing.Store;

/**
 * A user-facing change to one listing, produced once per cycle per listing at most.
 */
public record NotificationEvent(EventKind kind, Store store, Listing listing, long deltaCents) {

    public static NotificationEvent of(Store store, ListingChange change) {
        var kind = switch (change.kind()) {
            case NEW -> EventKind.NEW;
            case PRICE_DROP -> EventKind.PRICE_DROP;
            case PRICE_RISE -> EventKind.PRICE_RISE;
            default -> throw new IllegalArgumentException("No event for change kind " + change.kind());
        };
        return new NotificationEvent(kind, store, change.current(), change.deltaCents());
    }

    public String regionKey() {
        return store.regionKey();
    }

    public DealSummary toSummary() {
        return DealSummary.builder()
                .listingId(listing.listingId())
                .storeId(store.storeId())
                .storeName(store.name())
                .name(listing.name())
                .category(listing.category())
                .priceCents(listing.priceCents())
                .originalPriceCents(listing.originalPriceCents())
                .discountPercent(listing.discountPercent())
                .quantity(listing.quantity())
                .expiresAt(listing.expiresAt())
                .deltaCents(deltaCents)
                .build();
    }
}
