package com.listinghub.backend.modules.listing.application;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.listinghub.backend.modules.listing.domain.Facet;
import com.listinghub.backend.modules.listing.domain.FacetKey;
import com.listinghub.backend.modules.listing.domain.Listing;
import com.listinghub.backend.modules.listing.domain.PriceBucket;
import com.listinghub.backend.modules.listing.domain.PriceRange;
import com.listinghub.backend.modules.listing.domain.SearchCriteria;
import com.listinghub.backend.modules.listing.infrastructure.memory.FacetIndex;
import com.listinghub.backend.modules.listing.infrastructure.memory.ListingStore;

/**
 * Answers faceted queries from the index. Candidates from each criterion are unioned, then
 * re-checked against the store because the availability facet is a cache of listing status.
 */
@Component
public class ListingSearchEngine {

    private final FacetIndex facetIndex;
    private final ListingStore listingStore;

    public ListingSearchEngine(FacetIndex facetIndex, ListingStore listingStore) {
        this.facetIndex = facetIndex;
        this.listingStore = listingStore;
    }

    public List<Listing> search(SearchCriteria criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return List.of();
        }

        Set<UUID> candidates = new HashSet<>();
        if (criteria.location() != null) {
            candidates.addAll(facetIndex.lookup(FacetKey.location(criteria.location())));
        }
        if (criteria.propertyType() != null) {
            candidates.addAll(facetIndex.lookup(FacetKey.propertyType(criteria.propertyType())));
        }
        if (criteria.priceRange() != null) {
            candidates.addAll(lookupPriceRange(criteria.priceRange()));
        }

        return candidates.stream()
                .map(listingStore::findById)
                .flatMap(Optional::stream)
                .filter(Listing::isAvailable)
                .sorted(Listing.NEWEST_FIRST)
                .toList();
    }

    private Set<UUID> lookupPriceRange(PriceRange range) {
        Set<UUID> matches = new HashSet<>();
        for (FacetKey key : facetIndex.keys(Facet.PRICE_BUCKET)) {
            if (range.contains(PriceBucket.parse(key.value()))) {
                matches.addAll(facetIndex.lookup(key));
            }
        }
        return matches;
    }
}
