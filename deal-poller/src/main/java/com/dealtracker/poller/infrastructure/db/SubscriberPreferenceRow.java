package com.dealtracker.poller.infrastructure.db;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalTime;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

/**
 * Owned by the account service; the poller only reads it.
 */
@Entity
@Immutable
@Table(name = "subscriber_preferences")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SubscriberPreferenceRow {

    @Id
    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(nullable = false)
    private String email;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "region_key", nullable = false, length = 64)
    private String regionKey;

    @Column(name = "min_discount_percent", nullable = false)
    private int minDiscountPercent;

    @Convert(converter = StringSetConverter.class)
    @Column(name = "favorite_categories", columnDefinition = "text")
    private Set<String> favoriteCategories;

    @Convert(converter = StringSetConverter.class)
    @Column(name = "selected_store_ids", columnDefinition = "text")
    private Set<String> selectedStoreIds;

    @Column(name = "window_start")
    private LocalTime windowStart;

    @Column(name = "window_end")
    private LocalTime windowEnd;

    @Column(name = "email_notifications", nullable = false)
    private boolean emailNotifications;

    @Column(name = "notify_new_deals", nullable = false)
    private boolean notifyNewDeals;

    @Column(name = "notify_price_drops", nullable = false)
    private boolean notifyPriceDrops;
}
