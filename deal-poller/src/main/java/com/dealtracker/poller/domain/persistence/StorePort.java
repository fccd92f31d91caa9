package com.dealtracker.poller.domain.persistence;

import com.dealtracker.poller.domain.listing.Store;
import java.time.Instant;

public interface StorePort {

    void upsertStore(Store store, Instant seenAt);
}
