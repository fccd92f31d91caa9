package com.dealtracker.poller.infrastructure.db;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface PriceObservationJpaRepository extends JpaRepository<PriceObservationRow, String> {

    @Modifying
    @Query(value = "INSERT INTO price_observations (id, store_id, listing_external_id, price_cents, quantity, observed_at) " +
            "VALUES (:#{#row.id}, :#{#row.storeId}, :#{#row.listingExternalId}, :#{#row.priceCents}, :#{#row.quantity}, :#{#row.observedAt})",
            nativeQuery = true)
    void append(PriceObservationRow row);

    List<PriceObservationRow> findByStoreIdAndListingExternalIdOrderByObservedAtAscIdAsc(
            String storeId, String listingExternalId);
}
