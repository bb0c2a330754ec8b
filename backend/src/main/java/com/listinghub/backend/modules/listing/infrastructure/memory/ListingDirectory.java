package com.listinghub.backend.modules.listing.infrastructure.memory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Component;

/**
 * Per-user listing relations. Ownership and shortlisting are kept apart; {@link #portfolio(String)}
 * is the combined view older clients read as "the user's listings". Both relations only grow.
 */
@Component
public class ListingDirectory {

    private final Map<String, Set<UUID>> owned = new HashMap<>();
    private final Map<String, Set<UUID>> shortlisted = new HashMap<>();

    public void recordOwnership(String userId, UUID listingId) {
        owned.computeIfAbsent(userId, key -> new LinkedHashSet<>()).add(listingId);
    }

    /**
     * @return {@code false} when the listing is already in the user's portfolio, owned or shortlisted
     */
    public boolean recordShortlist(String userId, UUID listingId) {
        if (owned.getOrDefault(userId, Set.of()).contains(listingId)) {
            return false;
        }
        return shortlisted.computeIfAbsent(userId, key -> new LinkedHashSet<>()).add(listingId);
    }

    public List<UUID> owned(String userId) {
        return List.copyOf(owned.getOrDefault(userId, Set.of()));
    }

    public List<UUID> shortlisted(String userId) {
        return List.copyOf(shortlisted.getOrDefault(userId, Set.of()));
    }

    public List<UUID> portfolio(String userId) {
        List<UUID> combined = new ArrayList<>(owned.getOrDefault(userId, Set.of()));
        combined.addAll(shortlisted.getOrDefault(userId, Set.of()));
        return combined;
    }
}
