package com.dealtracker.common.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LiveMessageType {
    NEW_DEALS("new_deals"),
    PRICE_DROP("price_drop");

    private final String wireName;

    LiveMessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
