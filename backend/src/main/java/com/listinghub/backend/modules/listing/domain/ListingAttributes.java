package com.listinghub.backend.modules.listing.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Facet attributes of a listing plus the free-form payload that is stored but never indexed.
 */
public record ListingAttributes(
        String location,
        BigDecimal price,
        String propertyType,
        String description,
        List<String> amenities
) {

    public ListingAttributes {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location must not be blank");
        }
        if (propertyType == null || propertyType.isBlank()) {
            throw new IllegalArgumentException("propertyType must not be blank");
        }
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("price must be non-negative");
        }
        amenities = amenities != null ? List.copyOf(amenities) : List.of();
    }

    public static ListingAttributes of(String location, BigDecimal price, String propertyType) {
        return new ListingAttributes(location, price, propertyType, null, List.of());
    }

    public PriceBucket priceBucket() {
        return PriceBucket.of(price);
    }
}
