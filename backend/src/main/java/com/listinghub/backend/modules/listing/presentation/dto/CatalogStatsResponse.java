package com.listinghub.backend.modules.listing.presentation.dto;

import java.util.Map;

public record CatalogStatsResponse(
        int totalListings,
        int availableListings,
        Map<String, Integer> facetKeyCounts
) {
}
