package com.dealtracker.poller.infrastructure.db;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface ListingJpaRepository extends JpaRepository<ListingRow, String> {

    List<ListingRow> findByStoreId(String storeId);

    /** Keeps the row id and first_seen_at of an existing listing. */
    @Modifying
    @Query(value = "INSERT INTO listings (id, store_id, external_id, name, description, category, original_price_cents, price_cents, quantity, expires_at, image_url, first_seen_at, last_seen_at, vanished) " +
            "VALUES (:#{#row.id}, :#{#row.storeId}, :#{#row.externalId}, :#{#row.name}, :#{#row.description}, :#{#row.category}, :#{#row.originalPriceCents}, :#{#row.priceCents}, :#{#row.quantity}, :#{#row.expiresAt}, :#{#row.imageUrl}, :#{#row.firstSeenAt}, :#{#row.lastSeenAt}, :#{#row.vanished}) " +
            "ON CONFLICT (store_id, external_id) DO UPDATE SET name = EXCLUDED.name, description = EXCLUDED.description, " +
            "category = EXCLUDED.category, original_price_cents = EXCLUDED.original_price_cents, price_cents = EXCLUDED.price_cents, " +
            "quantity = EXCLUDED.quantity, expires_at = EXCLUDED.expires_at, image_url = EXCLUDED.image_url, " +
            "last_seen_at = EXCLUDED.last_seen_at, vanished = EXCLUDED.vanished",
            nativeQuery = true)
    void upsert(ListingRow row);
}
