package com.dealtracker.poller.domain.persistence;

import com.dealtracker.poller.domain.listing.Listing;
import java.util.List;

public interface ListingSnapshotPort {

    /** Every listing ever seen at the store, vanished ones included. */
    List<Listing> loadSnapshot(String storeId);

    void upsertListing(Listing listing);
}
