package com.dealtracker.poller.domain.detection;

import static com.dealtracker.poller.test.fixtures.DealFixtures.T0;
import static com.dealtracker.poller.test.fixtures.DealFixtures.T1;
import static com.dealtracker.poller.test.fixtures.DealFixtures.T2;
import static com.dealtracker.poller.test.fixtures.DealFixtures.fetched;
import static com.dealtracker.poller.test.fixtures.DealFixtures.persisted;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class ChangeDetectorIdempotenceTest extends ChangeDetectorBaseTest {

    @Test
    void detect_sameFetchTwice_secondRunEmitsNothing() {
        var fetch = List.of(fetched("A", 499), fetched("B", 799), fetched("C", 1250));
        var first = detect(List.of(persisted("A", 599)), fetch, T1);

        var second = detect(first.updatedSnapshot(), fetch, T2);

        assertThat(first.events()).hasSize(3);
        assertThat(second.events()).isEmpty();
        assertThat(second.changes()).extracting(ListingChange::kind).containsOnly(ChangeKind.UNCHANGED);
    }

    @Test
    void detect_afterVanishing_repeatedEmptyFetchesAreQuiet() {
        var first = detect(List.of(persisted("A", 499)), List.of(), T1);

        var second = detect(first.updatedSnapshot(), List.of(), T2);

        assertThat(second.events()).isEmpty();
        assertThat(second.changes()).extracting(ListingChange::kind).containsOnly(ChangeKind.STILL_VANISHED);
    }

    @Test
    void detect_calgaryExample_oneDropOneNew() {
        var result = detect(List.of(persisted("L", 1099)), List.of(fetched("L", 899), fetched("M", 350)), T0.plusSeconds(300));

        assertThat(result.changesOf(ChangeKind.PRICE_DROP)).singleElement()
                .extracting(ListingChange::deltaCents)
                .isEqualTo(200L);
        assertThat(result.changesOf(ChangeKind.NEW)).singleElement()
                .extracting(change -> change.current().listingId())
                .isEqualTo("M");
        assertThat(result.events()).hasSize(2);
    }
}
