package com.listinghub.backend.modules.listing.infrastructure.memory;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.listinghub.backend.modules.listing.domain.Facet;
import com.listinghub.backend.modules.listing.domain.FacetKey;
import com.listinghub.backend.modules.listing.domain.ListingAttributes;
import com.listinghub.backend.modules.listing.domain.ListingException;

/**
 * Denormalized facet index over the listing store. Every mutation site goes through this class,
 * which keeps two invariants: an id appears at most once per key, and it sits under
 * {@link FacetKey#AVAILABLE} exactly while its listing is available.
 * <p>
 * Not thread-safe on its own; callers hold the catalog lock.
 */
@Component
public class FacetIndex {

    private final Map<FacetKey, Set<UUID>> entries = new HashMap<>();

    public void indexOnCreate(UUID listingId, ListingAttributes attributes) {
        insert(FacetKey.priceBucket(attributes.priceBucket()), listingId);
        insert(FacetKey.location(attributes.location()), listingId);
        insert(FacetKey.propertyType(attributes.propertyType()), listingId);
        insert(FacetKey.AVAILABLE, listingId);
    }

    public void markSold(UUID listingId) {
        Set<UUID> available = entries.get(FacetKey.AVAILABLE);
        if (available == null || !available.remove(listingId)) {
            throw ListingException.invalidTransition("AVAILABILITY_INDEX_MISMATCH",
                    "Listing " + listingId + " is not indexed as available");
        }
        if (available.isEmpty()) {
            entries.remove(FacetKey.AVAILABLE);
        }
    }

    /**
     * @return {@code true} if the id was inserted, {@code false} if it was already present
     */
    public boolean markAvailable(UUID listingId) {
        return insert(FacetKey.AVAILABLE, listingId);
    }

    public Set<UUID> lookup(FacetKey key) {
        Set<UUID> ids = entries.get(key);
        return ids != null ? Set.copyOf(ids) : Set.of();
    }

    public List<FacetKey> keys(Facet facet) {
        return entries.keySet().stream()
                .filter(key -> key.facet() == facet)
                .toList();
    }

    public boolean contains(FacetKey key, UUID listingId) {
        Set<UUID> ids = entries.get(key);
        return ids != null && ids.contains(listingId);
    }

    public int countFor(FacetKey key) {
        Set<UUID> ids = entries.get(key);
        return ids != null ? ids.size() : 0;
    }

    public Map<Facet, Integer> keyCounts() {
        Map<Facet, Integer> counts = new EnumMap<>(Facet.class);
        for (Facet facet : Facet.values()) {
            counts.put(facet, 0);
        }
        for (FacetKey key : entries.keySet()) {
            counts.merge(key.facet(), 1, Integer::sum);
        }
        return counts;
    }

    private boolean insert(FacetKey key, UUID listingId) {
        return entries.computeIfAbsent(key, ignored -> new LinkedHashSet<>()).add(listingId);
    }
}
