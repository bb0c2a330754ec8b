package com.listinghub.backend.modules.listing.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ListingStatus {
    AVAILABLE("available"),
    SOLD("sold");

    private final String code;

    ListingStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isAvailable() {
        return this == AVAILABLE;
    }

    @JsonCreator
    public static ListingStatus from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        String normalized = value.trim();
        for (ListingStatus status : values()) {
            if (status.code.equalsIgnoreCase(normalized) || status.name().equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown listing status: " + value);
    }
}
