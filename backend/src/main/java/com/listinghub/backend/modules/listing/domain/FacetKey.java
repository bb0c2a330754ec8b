package com.listinghub.backend.modules.listing.domain;

/**
 * Secondary index key. Values are compared per facet, so a location named like a
 * property type never collides with it.
 */
public record FacetKey(Facet facet, String value) {

    public static final String AVAILABLE_MARKER = "available";
    public static final FacetKey AVAILABLE = new FacetKey(Facet.AVAILABILITY, AVAILABLE_MARKER);

    public FacetKey {
        if (facet == null) {
            throw new IllegalArgumentException("facet must not be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("facet value must not be null");
        }
    }

    public static FacetKey location(String location) {
        return new FacetKey(Facet.LOCATION, location);
    }

    public static FacetKey propertyType(String propertyType) {
        return new FacetKey(Facet.PROPERTY_TYPE, propertyType);
    }

    public static FacetKey priceBucket(PriceBucket bucket) {
        return new FacetKey(Facet.PRICE_BUCKET, bucket.label());
    }
}
