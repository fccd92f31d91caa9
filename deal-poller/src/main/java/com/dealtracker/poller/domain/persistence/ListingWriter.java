package com.dealtracker.poller.domain.persistence;

import com.dealtracker.poller.domain.detection.ListingChange;
import com.dealtracker.poller.domain.exceptions.ListingPersistenceException;
import com.dealtracker.poller.domain.history.PriceHistoryRecorder;
import com.dealtracker.poller.domain.listing.PriceObservation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes one detected change: the listing row and, for new and repriced listings, its observation,
 * in a single transaction.
 */
@Service
@RequiredArgsConstructor
public class ListingWriter {

    private final ListingSnapshotPort snapshotPort;
    private final PriceHistoryRecorder historyRecorder;

    @Transactional
    public void apply(ListingChange change) {
        if (!change.kind().requiresWrite()) {
            return;
        }
        var listing = change.current();
        try {
            snapshotPort.upsertListing(listing);
            if (change.kind().recordsObservation()) {
                historyRecorder.record(listing, PriceObservation.of(listing, listing.lastSeen()));
            }
        } catch (RuntimeException e) {
            throw ListingPersistenceException.of(listing.storeId(), listing.listingId(), e);
        }
    }
}
