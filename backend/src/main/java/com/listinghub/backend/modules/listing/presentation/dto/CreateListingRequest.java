package com.listinghub.backend.modules.listing.presentation.dto;

import java.math.BigDecimal;
import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreateListingRequest(
        @NotBlank @Size(max = 200) String location,
        @NotNull @PositiveOrZero BigDecimal price,
        @NotBlank @Size(max = 100) String propertyType,
        @Size(max = 4000) String description,
        List<@NotBlank String> amenities
) {
}
