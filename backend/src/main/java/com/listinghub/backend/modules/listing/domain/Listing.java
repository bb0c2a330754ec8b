package com.listinghub.backend.modules.listing.domain;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;

/**
 * Canonical listing record. Only the status changes after creation, and only through
 * the status transition logic.
 */
public class Listing {

    public static final Comparator<Listing> NEWEST_FIRST = Comparator
            .comparing(Listing::getCreatedAt, Comparator.reverseOrder())
            .thenComparing(Listing::getId);

    private final UUID id;
    private final String ownerId;
    private final ListingAttributes attributes;
    private final OffsetDateTime createdAt;
    private ListingStatus status;

    public Listing(UUID id, String ownerId, ListingAttributes attributes, OffsetDateTime createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.attributes = Objects.requireNonNull(attributes, "attributes");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.status = ListingStatus.AVAILABLE;
    }

    public UUID getId() {
        return id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public ListingAttributes getAttributes() {
        return attributes;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public ListingStatus getStatus() {
        return status;
    }

    public void setStatus(ListingStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public boolean isOwnedBy(String userId) {
        return ownerId.equals(userId);
    }

    public boolean isAvailable() {
        return status.isAvailable();
    }
}
