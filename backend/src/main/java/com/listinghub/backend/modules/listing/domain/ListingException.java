package com.listinghub.backend.modules.listing.domain;

import java.util.UUID;

/**
 * Recoverable catalog failure. The transport layer decides how each {@link ListingErrorKind}
 * is surfaced to callers.
 */
public class ListingException extends RuntimeException {

    private final ListingErrorKind kind;
    private final String code;

    public ListingException(ListingErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public static ListingException notFound(UUID listingId) {
        return new ListingException(ListingErrorKind.NOT_FOUND, "LISTING_NOT_FOUND",
                "Listing " + listingId + " does not exist");
    }

    public static ListingException notOwner(UUID listingId, String userId) {
        return new ListingException(ListingErrorKind.UNAUTHORIZED, "NOT_LISTING_OWNER",
                "User " + userId + " does not own listing " + listingId);
    }

    public static ListingException invalidTransition(String code, String message) {
        return new ListingException(ListingErrorKind.INVALID_TRANSITION, code, message);
    }

    public static ListingException conflict(String code, String message) {
        return new ListingException(ListingErrorKind.CONFLICT, code, message);
    }

    public ListingErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }
}
