package com.dealtracker.poller.domain.marketplace;

import java.time.Instant;
import lombok.Builder;

/**
 * A listing as the marketplace reports it right now, already converted to cents.
 */
@Builder(toBuilder = true)
public record MarketplaceListing(
        String listingId,
        String name,
        String description,
        String category,
        Long originalPriceCents,
        long priceCents,
        int quantity,
        Instant expiresAt,
        String imageUrl) {}
