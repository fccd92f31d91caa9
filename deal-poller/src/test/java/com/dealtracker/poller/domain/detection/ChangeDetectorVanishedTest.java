package com.dealtracker.poller.domain.detection;

import static com.dealtracker.poller.test.fixtures.DealFixtures.T0;
import static com.dealtracker.poller.test.fixtures.DealFixtures.T1;
import static com.dealtracker.poller.test.fixtures.DealFixtures.T2;
import static com.dealtracker.poller.test.fixtures.DealFixtures.fetched;
import static com.dealtracker.poller.test.fixtures.DealFixtures.persisted;
import static com.dealtracker.poller.test.fixtures.DealFixtures.persistedBuilder;
import static org.assertj.core.api.Assertions.assertThat;

import com.dealtracker.poller.domain.notification.EventKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChangeDetectorVanishedTest extends ChangeDetectorBaseTest {

    @Test
    void detect_missingFromFetch_markedVanishedWithoutEvent() {
        var result = detect(List.of(persisted("L", 899), persisted("M", 350)), List.of(fetched("M", 350)), T1);

        var change = only(result, "L");
        assertThat(change.kind()).isEqualTo(ChangeKind.VANISHED);
        assertThat(change.current().vanished()).isTrue();
        assertThat(change.current().lastSeen()).isEqualTo(T0);
        assertThat(change.current().priceCents()).isEqualTo(899);
        assertThat(result.events()).isEmpty();
    }

    @Test
    void detect_alreadyVanished_needsNoWrite() {
        var result = detect(List.of(persistedBuilder("L", 899).vanished(true).build()), List.of(), T1);

        var change = only(result, "L");
        assertThat(change.kind()).isEqualTo(ChangeKind.STILL_VANISHED);
        assertThat(change.kind().requiresWrite()).isFalse();
    }

    @Test
    void detect_vanishedListingReturns_newAgainKeepingFirstSeen() {
        var vanished = persistedBuilder("L", 899).vanished(true).lastSeen(T1).build();

        var result = detect(List.of(vanished), List.of(fetched("L", 799)), T2);

        var change = only(result, "L");
        assertThat(change.kind()).isEqualTo(ChangeKind.NEW);
        assertThat(change.deltaCents()).isZero();
        assertThat(change.current().vanished()).isFalse();
        assertThat(change.current().firstSeen()).isEqualTo(T0);
        assertThat(change.current().lastSeen()).isEqualTo(T2);
        assertThat(result.events()).singleElement().extracting(event -> event.kind()).isEqualTo(EventKind.NEW);
    }

    @Test
    void detect_emptyFetch_vanishesEverythingActive() {
        var result = detect(List.of(persisted("L", 899), persisted("M", 350)), List.of(), T1);

        assertThat(result.changes()).extracting(ListingChange::kind).containsOnly(ChangeKind.VANISHED);
        assertThat(result.updatedSnapshot()).allMatch(listing -> listing.vanished());
    }
}
