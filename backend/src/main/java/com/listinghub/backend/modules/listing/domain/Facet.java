package com.listinghub.backend.modules.listing.domain;

public enum Facet {
    LOCATION("location"),
    PROPERTY_TYPE("propertyType"),
    PRICE_BUCKET("priceBucket"),
    AVAILABILITY("availability");

    private final String fieldName;

    Facet(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }

    public static Facet fromFieldName(String value) {
        for (Facet facet : values()) {
            if (facet.fieldName.equalsIgnoreCase(value)) {
                return facet;
            }
        }
        throw new IllegalArgumentException("Unknown facet: " + value);
    }
}
