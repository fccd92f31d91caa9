package com.dealtracker.poller.domain.listing;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Price arithmetic in integer cents. Upstream amounts are decimal dollars; everything after
 * parsing compares and subtracts whole cents only.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Prices {

    public static long toCents(BigDecimal dollars) {
        return dollars.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    /**
     * Whole-percent discount, truncated toward zero. {@code null} when there is no usable
     * original price.
     */
    public static Integer discountPercent(Long originalPriceCents, long priceCents) {
        if (originalPriceCents == null || originalPriceCents <= 0) {
            return null;
        }
        return (int) ((originalPriceCents - priceCents) * 100 / originalPriceCents);
    }
}
