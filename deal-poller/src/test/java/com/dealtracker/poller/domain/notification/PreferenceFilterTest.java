package com.dealtracker.poller.domain.notification;

import static com.dealtracker.poller.test.fixtures.DealFixtures.SOME_STORE_ID;
import static com.dealtracker.poller.test.fixtures.DealFixtures.persistedBuilder;
import static com.dealtracker.poller.test.fixtures.DealFixtures.someStore;
import static com.dealtracker.poller.test.fixtures.DealFixtures.subscriberBuilder;
import static org.assertj.core.api.Assertions.assertThat;

import com.dealtracker.poller.domain.listing.Listing;
import java.time.Instant;
import java.time.LocalTime;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PreferenceFilterTest {

    private static final Instant NOON_UTC = Instant.parse("2026-03-01T12:00:00Z");

    private static NotificationEvent event(EventKind kind, Listing listing) {
        return new NotificationEvent(kind, someStore(), listing, kind == EventKind.PRICE_DROP ? 200 : 0);
    }

    // 1099 -> 899 with original 1499: 40% off, Produce
    private static NotificationEvent produceDrop() {
        return event(EventKind.PRICE_DROP, persistedBuilder("L", 899).build());
    }

    @Test
    void shouldMatchWhenEveryCriterionHolds() {
        var preference = subscriberBuilder()
                .minDiscountPercent(40)
                .favoriteCategories(Set.of("Produce", "Dairy"))
                .selectedStoreIds(Set.of(SOME_STORE_ID))
                .window(new NotificationWindow(LocalTime.of(9, 0), LocalTime.of(17, 0)))
                .build();

        assertThat(PreferenceFilter.matches(preference, produceDrop(), NOON_UTC)).isTrue();
    }

    @Test
    void shouldRejectDiscountBelowMinimum() {
        var preference = subscriberBuilder().minDiscountPercent(41).build();

        assertThat(PreferenceFilter.matches(preference, produceDrop(), NOON_UTC)).isFalse();
    }

    @Test
    void shouldSkipMinimumDiscountWhenDiscountUnknown() {
        var noOriginal = event(EventKind.NEW, persistedBuilder("N", 500).originalPriceCents(null).build());

        assertThat(PreferenceFilter.matches(subscriberBuilder().minDiscountPercent(0).build(), noOriginal, NOON_UTC))
                .isTrue();
        assertThat(PreferenceFilter.matches(subscriberBuilder().minDiscountPercent(20).build(), noOriginal, NOON_UTC))
                .isTrue();
    }

    @Test
    void shouldStillApplyMinimumDiscountWhenListingIsAtFullPrice() {
        var fullPrice = event(EventKind.NEW, persistedBuilder("N", 1499).originalPriceCents(1499L).build());

        assertThat(PreferenceFilter.matches(subscriberBuilder().minDiscountPercent(1).build(), fullPrice, NOON_UTC))
                .isFalse();
    }

    @Test
    void shouldRejectCategoryOutsideFavorites() {
        var preference = subscriberBuilder().favoriteCategories(Set.of("Bakery")).build();

        assertThat(PreferenceFilter.matches(preference, produceDrop(), NOON_UTC)).isFalse();
    }

    @Test
    void shouldRejectStoreOutsideSelection() {
        var preference = subscriberBuilder().selectedStoreIds(Set.of("store_other")).build();

        assertThat(PreferenceFilter.matches(preference, produceDrop(), NOON_UTC)).isFalse();
    }

    @Test
    void shouldRejectOutsideWindowEvaluatedInUtc() {
        var preference = subscriberBuilder()
                .window(new NotificationWindow(LocalTime.of(22, 0), LocalTime.of(6, 0)))
                .build();

        assertThat(PreferenceFilter.matches(preference, produceDrop(), NOON_UTC)).isFalse();
        assertThat(PreferenceFilter.matches(preference, produceDrop(), Instant.parse("2026-03-01T23:15:00Z")))
                .isTrue();
    }

    @Test
    void shouldHonourChannelToggles() {
        var newDeal = event(EventKind.NEW, persistedBuilder("M", 350).build());

        assertThat(PreferenceFilter.matches(
                subscriberBuilder().emailNotifications(false).build(), newDeal, NOON_UTC)).isFalse();
        assertThat(PreferenceFilter.matches(
                subscriberBuilder().notifyNewDeals(false).build(), newDeal, NOON_UTC)).isFalse();
        assertThat(PreferenceFilter.matches(
                subscriberBuilder().notifyPriceDrops(false).build(), newDeal, NOON_UTC)).isTrue();
        assertThat(PreferenceFilter.matches(
                subscriberBuilder().notifyPriceDrops(false).build(), produceDrop(), NOON_UTC)).isFalse();
    }

    @Test
    void shouldNeverEmailPriceRises() {
        var rise = event(EventKind.PRICE_RISE, persistedBuilder("L", 999).build());

        assertThat(PreferenceFilter.matches(subscriberBuilder().build(), rise, NOON_UTC)).isFalse();
    }

    @Test
    void shouldRejectOtherRegion() {
        var preference = subscriberBuilder().regionKey("vancouver").build();

        assertThat(PreferenceFilter.matches(preference, produceDrop(), NOON_UTC)).isFalse();
    }
}
