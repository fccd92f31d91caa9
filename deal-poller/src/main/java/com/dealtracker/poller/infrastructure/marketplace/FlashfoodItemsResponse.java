package com.dealtracker.poller.infrastructure.marketplace;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * {@code data} maps each requested store id to that store's items.
 */
public record FlashfoodItemsResponse(Map<String, List<Item>> data) {

    public record Item(
            String id,
            String name,
            String description,
            String category,
            BigDecimal originalPrice,
            BigDecimal price,
            Integer quantityAvailable,
            String expiryDate,
            Image image) {}

    public record Image(String url) {}
}
