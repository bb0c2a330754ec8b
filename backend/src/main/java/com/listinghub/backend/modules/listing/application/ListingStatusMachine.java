package com.listinghub.backend.modules.listing.application;

import org.springframework.stereotype.Component;

import com.listinghub.backend.modules.listing.domain.Listing;
import com.listinghub.backend.modules.listing.domain.ListingException;
import com.listinghub.backend.modules.listing.domain.ListingStatus;
import com.listinghub.backend.modules.listing.infrastructure.memory.FacetIndex;

/**
 * AVAILABLE -> SOLD and SOLD -> AVAILABLE are the only legal moves. The availability index
 * is adjusted before the listing itself, so a failed index precondition leaves the listing untouched.
 * Ownership is checked by the caller.
 */
@Component
public class ListingStatusMachine {

    private final FacetIndex facetIndex;

    public ListingStatusMachine(FacetIndex facetIndex) {
        this.facetIndex = facetIndex;
    }

    public void transition(Listing listing, ListingStatus target) {
        ListingStatus current = listing.getStatus();
        if (current == target) {
            throw target == ListingStatus.SOLD
                    ? ListingException.invalidTransition("LISTING_ALREADY_SOLD",
                            "Listing " + listing.getId() + " is already sold")
                    : ListingException.invalidTransition("LISTING_ALREADY_AVAILABLE",
                            "Listing " + listing.getId() + " is already available");
        }

        switch (target) {
            case SOLD -> facetIndex.markSold(listing.getId());
            case AVAILABLE -> facetIndex.markAvailable(listing.getId());
        }
        listing.setStatus(target);
    }
}
