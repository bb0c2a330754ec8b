package com.listinghub.backend.modules.listing.domain;

import java.math.BigDecimal;

/**
 * Inclusive range of price buckets, rendered as {@code "200k-500k"}.
 */
public record PriceRange(PriceBucket lower, PriceBucket upper) {

    public PriceRange {
        if (lower == null || upper == null) {
            throw new IllegalArgumentException("price range bounds must not be null");
        }
        if (lower.compareTo(upper) > 0) {
            throw new IllegalArgumentException("price range lower bound exceeds upper bound: " + lower + "-" + upper);
        }
    }

    public static PriceRange of(BigDecimal minPrice, BigDecimal maxPrice) {
        return new PriceRange(PriceBucket.of(minPrice), PriceBucket.of(maxPrice));
    }

    public static PriceRange parse(String label) {
        if (label == null) {
            throw new IllegalArgumentException("price range label must not be null");
        }
        int separator = label.indexOf('-');
        if (separator < 0) {
            PriceBucket single = PriceBucket.parse(label);
            return new PriceRange(single, single);
        }
        return new PriceRange(
                PriceBucket.parse(label.substring(0, separator)),
                PriceBucket.parse(label.substring(separator + 1))
        );
    }

    public boolean contains(PriceBucket bucket) {
        return lower.compareTo(bucket) <= 0 && upper.compareTo(bucket) >= 0;
    }

    public String label() {
        return lower.label() + "-" + upper.label();
    }
}
