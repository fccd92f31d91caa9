package com.dealtracker.poller.domain.history;

import com.dealtracker.poller.domain.listing.Listing;
import com.dealtracker.poller.domain.listing.PriceObservation;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Only writer of price observations. Callers decide whether a change deserves one; the recorder
 * checks the observation belongs to the listing it is filed under.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceHistoryRecorder {

    private final PriceObservationPort observationPort;

    public void record(Listing listing, PriceObservation observation) {
        if (!listing.storeId().equals(observation.storeId())
                || !listing.listingId().equals(observation.listingId())) {
            throw new IllegalArgumentException("Observation " + observation.id() + " does not belong to listing "
                    + listing.storeId() + "/" + listing.listingId());
        }
        if (listing.priceCents() != observation.priceCents()) {
            throw new IllegalArgumentException("Observation price " + observation.priceCents()
                    + " does not match listing price " + listing.priceCents());
        }
        observationPort.append(observation);
        log.debug("price.recorded: store_id={}, listing_id={}, price_cents={}, quantity={}",
                listing.storeId(), listing.listingId(), observation.priceCents(), observation.quantity());
    }

    public List<PriceObservation> history(String storeId, String listingId) {
        return observationPort.findHistory(storeId, listingId);
    }
}
