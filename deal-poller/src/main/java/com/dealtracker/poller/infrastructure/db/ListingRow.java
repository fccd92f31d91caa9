package com.dealtracker.poller.infrastructure.db;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "listings", uniqueConstraints = @UniqueConstraint(columnNames = {"store_id", "external_id"}))
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ListingRow {

    @Id
    @Column(length = 26)
    private String id;

    @Column(name = "store_id", nullable = false, length = 64)
    private String storeId;

    @Column(name = "external_id", nullable = false, length = 64)
    private String externalId;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "text")
    private String description;

    @Column(length = 64)
    private String category;

    @Column(name = "original_price_cents")
    private Long originalPriceCents;

    @Column(name = "price_cents", nullable = false)
    private long priceCents;

    @Column(nullable = false)
    private int quantity;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "image_url", length = 1024)
    private String imageUrl;

    @Column(name = "first_seen_at", nullable = false, updatable = false)
    private Instant firstSeenAt;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;

    @Column(nullable = false)
    private boolean vanished;
}
