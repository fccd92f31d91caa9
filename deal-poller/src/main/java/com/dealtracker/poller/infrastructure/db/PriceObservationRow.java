package com.dealtracker.poller.infrastructure.db;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "price_observations")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PriceObservationRow {

    @Id
    @Column(length = 26)
    private String id;

    @Column(name = "store_id", nullable = false, length = 64)
    private String storeId;

    @Column(name = "listing_external_id", nullable = false, length = 64)
    private String listingExternalId;

    @Column(name = "price_cents", nullable = false)
    private long priceCents;

    @Column(nullable = false)
    private int quantity;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;
}
