package com.dealtracker.common.event;

import java.time.Instant;
import java.util.List;

/**
 * Payload pushed to live viewers of a region.
 */
public record LiveDealMessage(
        LiveMessageType type, int count, String message, Instant timestamp, List<DealSummary> data) {

    public static LiveDealMessage of(LiveMessageType type, List<DealSummary> deals, Instant timestamp) {
        return new LiveDealMessage(
                type, deals.size(), describe(type, deals.size()), timestamp, List.copyOf(deals));
    }

    private static String describe(LiveMessageType type, int count) {
        return switch (type) {
            case NEW_DEALS -> count == 1 ? "1 new deal available!" : count + " new deals available!";
            case PRICE_DROP -> count == 1 ? "1 price drop!" : count + " price drops!";
        };
    }
}
