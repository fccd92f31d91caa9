package com.dealtracker.poller.domain.region;

import lombok.Builder;

/**
 * A configured polling target: a search centre, a radius and a cap on returned stores.
 */
@Builder(toBuilder = true)
public record Region(
        String key,
        String label,
        double latitude,
        double longitude,
        int radiusMeters,
        int storeLimit) {

    /**
     * Cache key covering every parameter of the upstream store query, so two regions that
     * differ in any of them never share an entry.
     */
    public String storeQueryKey() {
        return "stores:" + latitude + ":" + longitude + ":" + radiusMeters + ":" + storeLimit;
    }
}
