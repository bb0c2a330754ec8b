package com.listinghub.backend.modules.listing.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ListingResponse(
        UUID propertyId,
        String ownerId,
        String location,
        BigDecimal price,
        String priceBucket,
        String propertyType,
        String description,
        List<String> amenities,
        String status,
        OffsetDateTime createdAt
) {
}
