package com.dealtracker.poller.infrastructure.marketplace;

import java.util.List;

public record FlashfoodStoresResponse(List<Store> data) {

    public record Store(String id, String name, Address address, Location location) {}

    public record Address(String fullAddress) {}

    public record Location(Double latitude, Double longitude) {}
}
