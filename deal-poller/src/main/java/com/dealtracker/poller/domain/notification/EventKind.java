package com.dealtracker.poller.domain.notification;

import com.dealtracker.common.event.LiveMessageType;
import java.util.Optional;

public enum EventKind {
    NEW(LiveMessageType.NEW_DEALS),
    PRICE_DROP(LiveMessageType.PRICE_DROP),
    /** Recorded in history only; neither broadcast nor emailed. */
    PRICE_RISE(null);

    private final LiveMessageType liveType;

    EventKind(LiveMessageType liveType) {
        this.liveType = liveType;
    }

    public Optional<LiveMessageType> liveType() {
        return Optional.ofNullable(liveType);
    }
}
