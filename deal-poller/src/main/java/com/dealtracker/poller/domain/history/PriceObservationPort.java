package com.dealtracker.poller.domain.history;

import com.dealtracker.poller.domain.listing.PriceObservation;
import java.util.List;

public interface PriceObservationPort {

    void append(PriceObservation observation);

    /** Oldest first. */
    List<PriceObservation> findHistory(String storeId, String listingId);
}
