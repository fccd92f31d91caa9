package com.dealtracker.poller.domain.marketplace;

import lombok.Builder;

@Builder
public record MarketplaceStore(String storeId, String name, String address, double latitude, double longitude) {}
