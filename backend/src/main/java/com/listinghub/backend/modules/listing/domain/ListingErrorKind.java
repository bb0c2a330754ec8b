package com.listinghub.backend.modules.listing.domain;

public enum ListingErrorKind {
    NOT_FOUND,
    UNAUTHORIZED,
    INVALID_TRANSITION,
    CONFLICT
}
