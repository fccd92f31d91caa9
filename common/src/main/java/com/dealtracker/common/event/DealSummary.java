package com.dealtracker.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.Builder;

/**
 * Listing snapshot carried by live messages and email digests. Prices are in cents;
 * {@code deltaCents} is {@code old - new}, so drops are positive.
 */
@Builder(toBuilder = true)
public record DealSummary(
        @JsonProperty("listing_id") String listingId,
        @JsonProperty("store_id") String storeId,
        @JsonProperty("store_name") String storeName,
        String name,
        String category,
        @JsonProperty("price_cents") long priceCents,
        @JsonProperty("original_price_cents") Long originalPriceCents,
        @JsonProperty("discount_percent") Integer discountPercent,
        int quantity,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("delta_cents") long deltaCents) {}
