package com.listinghub.backend.modules.listing.presentation.dto;

import java.util.List;

import com.listinghub.backend.modules.listing.domain.Listing;
import com.listinghub.backend.modules.listing.domain.ListingAttributes;

public final class ListingDtoMapper {

    private ListingDtoMapper() {
    }

    public static ListingAttributes toAttributes(CreateListingRequest request) {
        return new ListingAttributes(
                request.location().trim(),
                request.price(),
                request.propertyType().trim(),
                request.description(),
                request.amenities()
        );
    }

    public static ListingResponse toResponse(Listing listing) {
        ListingAttributes attributes = listing.getAttributes();
        return new ListingResponse(
                listing.getId(),
                listing.getOwnerId(),
                attributes.location(),
                attributes.price(),
                attributes.priceBucket().label(),
                attributes.propertyType(),
                attributes.description(),
                attributes.amenities(),
                listing.getStatus().code(),
                listing.getCreatedAt()
        );
    }

    public static List<ListingResponse> toResponses(List<Listing> listings) {
        return listings.stream()
                .map(ListingDtoMapper::toResponse)
                .toList();
    }
}
