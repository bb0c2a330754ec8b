package com.listinghub.backend.modules.listing.domain;

/**
 * Facet criteria for a catalog search. Null fields are not part of the query; matches
 * across the supplied criteria are unioned.
 */
public record SearchCriteria(String location, String propertyType, PriceRange priceRange) {

    public static SearchCriteria none() {
        return new SearchCriteria(null, null, null);
    }

    public static SearchCriteria byLocation(String location) {
        return new SearchCriteria(location, null, null);
    }

    public static SearchCriteria byPropertyType(String propertyType) {
        return new SearchCriteria(null, propertyType, null);
    }

    public static SearchCriteria byPriceRange(PriceRange priceRange) {
        return new SearchCriteria(null, null, priceRange);
    }

    public boolean isEmpty() {
        return location == null && propertyType == null && priceRange == null;
    }
}
