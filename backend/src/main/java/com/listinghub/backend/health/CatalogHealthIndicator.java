package com.listinghub.backend.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.listinghub.backend.modules.listing.application.ListingService;

/**
 * Reports the in-memory catalog as the {@code catalog} health component.
 */
@Component("catalog")
public class CatalogHealthIndicator implements HealthIndicator {

    private final ListingService listingService;

    public CatalogHealthIndicator(ListingService listingService) {
        this.listingService = listingService;
    }

    @Override
    public Health health() {
        return Health.up()
                .withDetail("listings", listingService.countListings())
                .build();
    }
}
