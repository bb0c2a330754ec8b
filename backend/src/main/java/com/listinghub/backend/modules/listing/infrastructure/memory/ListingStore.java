package com.listinghub.backend.modules.listing.infrastructure.memory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.listinghub.backend.modules.listing.domain.Listing;
import com.listinghub.backend.modules.listing.domain.ListingAttributes;

/**
 * Source of truth for listing records. Not thread-safe on its own: callers hold the
 * catalog lock owned by {@code ListingService}.
 */
@Component
public class ListingStore {

    private static final long MIN_TICK_NANOS = 1_000L;

    private final Map<UUID, Listing> listings = new LinkedHashMap<>();
    private final Clock clock;
    private OffsetDateTime lastCreatedAt;

    public ListingStore(Clock clock) {
        this.clock = clock;
    }

    public Listing create(String ownerId, ListingAttributes attributes) {
        UUID id = UUID.randomUUID();
        while (listings.containsKey(id)) {
            id = UUID.randomUUID();
        }
        Listing listing = new Listing(id, ownerId, attributes, nextCreatedAt());
        listings.put(id, listing);
        return listing;
    }

    public Optional<Listing> findById(UUID id) {
        return Optional.ofNullable(listings.get(id));
    }

    public List<Listing> findAll() {
        return new ArrayList<>(listings.values());
    }

    public int size() {
        return listings.size();
    }

    // strictly increasing so recency ordering never depends on the id tie-break
    private OffsetDateTime nextCreatedAt() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (lastCreatedAt != null && !now.isAfter(lastCreatedAt)) {
            now = lastCreatedAt.plusNanos(MIN_TICK_NANOS);
        }
        lastCreatedAt = now;
        return now;
    }
}
