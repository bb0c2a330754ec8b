package com.listinghub.backend.modules.listing.presentation.dto;

import java.util.List;

public record ListingListResponse(
        List<ListingResponse> items,
        long totalCount,
        int page,
        int limit
) {
}
