package com.listinghub.backend.modules.listing.presentation.dto;

import jakarta.validation.constraints.NotNull;

import com.listinghub.backend.modules.listing.domain.ListingStatus;

public record UpdateListingStatusRequest(@NotNull ListingStatus status) {
}
