package com.dealtracker.poller.infrastructure.db;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface StoreJpaRepository extends JpaRepository<StoreRow, String> {

    @Modifying
    @Query(value = "INSERT INTO stores (id, name, address, latitude, longitude, region_key, first_seen_at, last_seen_at) " +
            "VALUES (:#{#row.id}, :#{#row.name}, :#{#row.address}, :#{#row.latitude}, :#{#row.longitude}, :#{#row.regionKey}, :#{#row.firstSeenAt}, :#{#row.lastSeenAt}) " +
            "ON CONFLICT (id) DO UPDATE SET name = EXCLUDED.name, address = EXCLUDED.address, " +
            "latitude = EXCLUDED.latitude, longitude = EXCLUDED.longitude, last_seen_at = EXCLUDED.last_seen_at",
            nativeQuery = true)
    void upsert(StoreRow row);
}
