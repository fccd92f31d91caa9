package com.dealtracker.poller.domain.notification;

import java.time.Instant;
import java.time.ZoneOffset;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class PreferenceFilter {

    /**
     * Whether {@code event} should go into the subscriber's email at {@code now}. The minimum
     * discount only applies to listings whose discount is known.
     */
    public static boolean matches(SubscriberPreference preference, NotificationEvent event, Instant now) {
        if (!preference.emailNotifications() || !wantsKind(preference, event.kind())) {
            return false;
        }
        if (!preference.regionKey().equals(event.regionKey())) {
            return false;
        }
        if (!preference.selectedStoreIds().isEmpty()
                && !preference.selectedStoreIds().contains(event.store().storeId())) {
            return false;
        }
        var discount = event.listing().discountPercent();
        if (discount != null && discount < preference.minDiscountPercent()) {
            return false;
        }
        if (!preference.favoriteCategories().isEmpty()
                && !preference.favoriteCategories().contains(event.listing().category())) {
            return false;
        }
        return preference.window().contains(now.atOffset(ZoneOffset.UTC).toLocalTime());
    }

    private static boolean wantsKind(SubscriberPreference preference, EventKind kind) {
        return switch (kind) {
            case NEW -> preference.notifyNewDeals();
            case PRICE_DROP -> preference.notifyPriceDrops();
            case PRICE_RISE -> false;
        };
    }
}
