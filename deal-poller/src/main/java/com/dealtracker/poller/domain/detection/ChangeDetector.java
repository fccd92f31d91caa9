package com.dealtracker.poller.domain.detection;

import com.dealtracker.poller.domain.listing.Listing;
import com.dealtracker.poller.domain.listing.Store;
import com.dealtracker.poller.domain.marketplace.MarketplaceListing;
import com.dealtracker.poller.domain.notification.NotificationEvent;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Compares a store's persisted listings with what the marketplace returned this cycle.
 *
 * <p>Pure: no I/O, no clock. Running it a second time with its own output as the previous snapshot
 * and the same fetch yields no events. Price movement takes precedence over quantity; a listing that
 * was vanished and shows up again is a new deal but keeps its original first-seen time.
 */
@Component
public class ChangeDetector {

    public DetectionResult detect(
            Store store, List<Listing> previousSnapshot, List<MarketplaceListing> fetched, Instant now) {
        Map<String, Listing> previousById = new LinkedHashMap<>();
        for (var listing : previousSnapshot) {
            previousById.put(listing.listingId(), listing);
        }
        // last occurrence wins on duplicate ids
        Map<String, MarketplaceListing> fetchedById = new LinkedHashMap<>();
        for (var item : fetched) {
            fetchedById.put(item.listingId(), item);
        }

        List<ListingChange> changes = new ArrayList<>();
        for (var item : fetchedById.values()) {
            var previous = previousById.get(item.listingId());
            changes.add(previous == null ? appeared(store, item, now) : compare(previous, item, now));
        }
        for (var previous : previousById.values()) {
            if (!fetchedById.containsKey(previous.listingId())) {
                changes.add(previous.vanished()
                        ? new ListingChange(ChangeKind.STILL_VANISHED, previous, previous)
                        : new ListingChange(ChangeKind.VANISHED, previous, previous.toBuilder().vanished(true).build()));
            }
        }

        var events = changes.stream()
                .map(change -> toEvent(store, change))
                .flatMap(Optional::stream)
                .toList();
        return new DetectionResult(List.copyOf(changes), events);
    }

    public static Optional<NotificationEvent> toEvent(Store store, ListingChange change) {
        return switch (change.kind()) {
            case NEW, PRICE_DROP, PRICE_RISE -> Optional.of(NotificationEvent.of(store, change));
            default -> Optional.empty();
        };
    }

    private ListingChange appeared(Store store, MarketplaceListing item, Instant now) {
        var listing = Listing.builder()
                .storeId(store.storeId())
                .listingId(item.listingId())
                .firstSeen(now)
                .build();
        return new ListingChange(ChangeKind.NEW, null, refresh(listing, item, now));
    }

    private ListingChange compare(Listing previous, MarketplaceListing item, Instant now) {
        var current = refresh(previous, item, now);
        if (previous.vanished()) {
            return new ListingChange(ChangeKind.NEW, previous, current);
        }
        if (item.priceCents() < previous.priceCents()) {
            return new ListingChange(ChangeKind.PRICE_DROP, previous, current);
        }
        if (item.priceCents() > previous.priceCents()) {
            return new ListingChange(ChangeKind.PRICE_RISE, previous, current);
        }
        if (item.quantity() != previous.quantity()) {
            return new ListingChange(ChangeKind.QUANTITY_CHANGED, previous, current);
        }
        return new ListingChange(ChangeKind.UNCHANGED, previous, current);
    }

    private Listing refresh(Listing base, MarketplaceListing item, Instant now) {
        return base.toBuilder()
                .name(item.name())
                .description(item.description())
                .category(item.category())
                .originalPriceCents(item.originalPriceCents())
                .priceCents(item.priceCents())
                .quantity(item.quantity())
                .expiresAt(item.expiresAt())
                .imageUrl(item.imageUrl())
                .lastSeen(now)
                .vanished(false)
                .build();
    }
}
