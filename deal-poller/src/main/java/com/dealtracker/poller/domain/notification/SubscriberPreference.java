package com.dealtracker.poller.domain.notification;

import java.util.Set;
import lombok.Builder;

/**
 * A user's email filter for one region. Empty category and store sets mean no restriction.
 */
@Builder(toBuilder = true)
public record SubscriberPreference(
        String userId,
        String email,
        String displayName,
        String regionKey,
        int minDiscountPercent,
        Set<String> favoriteCategories,
        Set<String> selectedStoreIds,
        NotificationWindow window,
        boolean emailNotifications,
        boolean notifyNewDeals,
        boolean notifyPriceDrops) {

    public SubscriberPreference {
        favoriteCategories = favoriteCategories == null ? Set.of() : Set.copyOf(favoriteCategories);
        selectedStoreIds = selectedStoreIds == null ? Set.of() : Set.copyOf(selectedStoreIds);
        window = window == null ? NotificationWindow.ALL_DAY : window;
    }
}
