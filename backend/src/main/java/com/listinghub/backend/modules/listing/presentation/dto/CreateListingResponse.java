package com.listinghub.backend.modules.listing.presentation.dto;

import java.util.UUID;

public record CreateListingResponse(UUID propertyId) {
}
