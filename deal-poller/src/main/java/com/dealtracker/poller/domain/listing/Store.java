package com.dealtracker.poller.domain.listing;

import lombok.Builder;

@Builder(toBuilder = true)
public record Store(
        String storeId,
        String name,
        String address,
        double latitude,
        double longitude,
        String regionKey) {}
