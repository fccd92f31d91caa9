package com.dealtracker.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * One coalesced email per subscriber per polling cycle. {@code sample} is bounded;
 * {@code totalCount} is the number of matching events before sampling.
 */
@Builder(toBuilder = true)
public record EmailDigest(
        @JsonProperty("user_id") String userId,
        String email,
        @JsonProperty("display_name") String displayName,
        String region,
        @JsonProperty("cycle_id") String cycleId,
        @JsonProperty("total_count") int totalCount,
        @JsonProperty("new_deal_count") int newDealCount,
        @JsonProperty("price_drop_count") int priceDropCount,
        List<DealSummary> sample,
        @JsonProperty("created_at") Instant createdAt) {

    public String subject() {
        if (priceDropCount == 0) {
            return totalCount + " New Deals Available!";
        }
        if (newDealCount == 0) {
            return totalCount + " Price Drops on Deals You Follow";
        }
        return totalCount + " Deal Updates: " + newDealCount + " new, " + priceDropCount + " price drops";
    }
}
