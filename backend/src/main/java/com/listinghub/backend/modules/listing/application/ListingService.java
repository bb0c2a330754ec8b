package com.listinghub.backend.modules.listing.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.listinghub.backend.modules.listing.domain.Facet;
import com.listinghub.backend.modules.listing.domain.FacetKey;
import com.listinghub.backend.modules.listing.domain.Listing;
import com.listinghub.backend.modules.listing.domain.ListingAttributes;
import com.listinghub.backend.modules.listing.domain.ListingException;
import com.listinghub.backend.modules.listing.domain.ListingStatus;
import com.listinghub.backend.modules.listing.domain.PriceBucket;
import com.listinghub.backend.modules.listing.domain.SearchCriteria;
import com.listinghub.backend.modules.listing.infrastructure.memory.FacetIndex;
import com.listinghub.backend.modules.listing.infrastructure.memory.ListingDirectory;
import com.listinghub.backend.modules.listing.infrastructure.memory.ListingStore;
import com.listinghub.backend.modules.listing.presentation.dto.CatalogStatsResponse;
import com.listinghub.backend.modules.listing.presentation.dto.CreateListingResponse;
import com.listinghub.backend.modules.listing.presentation.dto.ListingDtoMapper;
import com.listinghub.backend.modules.listing.presentation.dto.ListingListResponse;
import com.listinghub.backend.modules.listing.presentation.dto.ListingResponse;

/**
 * Transaction boundary of the catalog. Every operation spans the store, the directory and the
 * facet index, so mutations run under the write lock and reads under the read lock. Results are
 * mapped to response records before the lock is released.
 */
@Service
public class ListingService {

    private static final Logger log = LoggerFactory.getLogger(ListingService.class);

    private final ListingStore listingStore;
    private final ListingDirectory listingDirectory;
    private final FacetIndex facetIndex;
    private final ListingStatusMachine statusMachine;
    private final ListingSearchEngine searchEngine;
    private final int defaultPageSize;
    private final int maxPageSize;
    private final ReadWriteLock catalogLock = new ReentrantReadWriteLock();

    public ListingService(
            ListingStore listingStore,
            ListingDirectory listingDirectory,
            FacetIndex facetIndex,
            ListingStatusMachine statusMachine,
            ListingSearchEngine searchEngine,
            @Value("${app.catalog.default-page-size:10}") int defaultPageSize,
            @Value("${app.catalog.max-page-size:100}") int maxPageSize
    ) {
        if (defaultPageSize < 1 || maxPageSize < defaultPageSize) {
            throw new IllegalArgumentException("app.catalog page sizes must satisfy 1 <= default-page-size <= max-page-size");
        }
        this.listingStore = listingStore;
        this.listingDirectory = listingDirectory;
        this.facetIndex = facetIndex;
        this.statusMachine = statusMachine;
        this.searchEngine = searchEngine;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    public CreateListingResponse createListing(String ownerId, ListingAttributes attributes) {
        // facet keys are derived before any mutation
        PriceBucket bucket = attributes.priceBucket();
        Listing listing = write(() -> {
            Listing created = listingStore.create(ownerId, attributes);
            listingDirectory.recordOwnership(ownerId, created.getId());
            facetIndex.indexOnCreate(created.getId(), attributes);
            return created;
        });
        log.info("Listing created: id={}, owner={}, location={}, bucket={}",
                listing.getId(), ownerId, attributes.location(), bucket.label());
        return new CreateListingResponse(listing.getId());
    }

    public ListingResponse getListing(UUID listingId) {
        return read(() -> ListingDtoMapper.toResponse(loadListing(listingId)));
    }

    public ListingResponse changeStatus(UUID listingId, ListingStatus target, String actingUserId) {
        ListingResponse response = write(() -> {
            Listing listing = loadListing(listingId);
            if (!listing.isOwnedBy(actingUserId)) {
                throw ListingException.notOwner(listingId, actingUserId);
            }
            statusMachine.transition(listing, target);
            return ListingDtoMapper.toResponse(listing);
        });
        log.info("Listing status changed: id={}, status={}, by={}", listingId, target.code(), actingUserId);
        return response;
    }

    public List<ListingResponse> search(SearchCriteria criteria) {
        return read(() -> ListingDtoMapper.toResponses(searchEngine.search(criteria)));
    }

    /**
     * Runs the search and slices {@code [(page-1)*limit, page*limit)} out of the ordered result.
     * Pages past the end are empty.
     */
    public ListingListResponse search(SearchCriteria criteria, Integer pageParam, Integer limitParam) {
        return paginate(search(criteria), pageParam, limitParam);
    }

    /**
     * Every listing in the catalog regardless of status, newest first. Search deliberately has no
     * match-all query, so this is the enumeration path.
     */
    public ListingListResponse getAllListings(Integer pageParam, Integer limitParam) {
        List<ListingResponse> all = read(() -> ListingDtoMapper.toResponses(
                listingStore.findAll().stream().sorted(Listing.NEWEST_FIRST).toList()));
        return paginate(all, pageParam, limitParam);
    }

    public void shortlist(String userId, UUID listingId) {
        write(() -> {
            Listing listing = loadListing(listingId);
            if (!listing.isAvailable()) {
                throw ListingException.conflict("LISTING_SOLD", "Listing " + listingId + " is sold");
            }
            if (!listingDirectory.recordShortlist(userId, listingId)) {
                throw ListingException.conflict("ALREADY_SHORTLISTED",
                        "Listing " + listingId + " is already in the portfolio of " + userId);
            }
            return null;
        });
        log.info("Listing shortlisted: id={}, user={}", listingId, userId);
    }

    public List<ListingResponse> getOwnedListings(String userId) {
        return read(() -> ListingDtoMapper.toResponses(resolve(listingDirectory.owned(userId), false)));
    }

    public List<ListingResponse> getShortlistedListings(String userId) {
        return read(() -> ListingDtoMapper.toResponses(resolve(listingDirectory.shortlisted(userId), true)));
    }

    /**
     * Owned and shortlisted listings together, any status. Kept for clients built against the
     * single "user's listings" relation.
     */
    public List<ListingResponse> getPortfolio(String userId) {
        return read(() -> ListingDtoMapper.toResponses(resolve(listingDirectory.portfolio(userId), false)));
    }

    public CatalogStatsResponse getStats() {
        return read(() -> {
            Map<String, Integer> facetCounts = new LinkedHashMap<>();
            facetIndex.keyCounts().forEach((facet, count) -> facetCounts.put(facet.fieldName(), count));
            return new CatalogStatsResponse(
                    listingStore.size(),
                    facetIndex.countFor(FacetKey.AVAILABLE),
                    facetCounts
            );
        });
    }

    public int countListings() {
        return read(listingStore::size);
    }

    /**
     * Keys currently present for one facet, e.g. every indexed location.
     */
    public List<String> getFacetValues(Facet facet) {
        return read(() -> facetIndex.keys(facet).stream()
                .map(FacetKey::value)
                .sorted()
                .toList());
    }

    private ListingListResponse paginate(List<ListingResponse> results, Integer pageParam, Integer limitParam) {
        int safePage = pageParam != null && pageParam >= 1 ? pageParam : 1;
        int safeLimit = limitParam != null && limitParam > 0 ? Math.min(limitParam, maxPageSize) : defaultPageSize;

        int total = results.size();
        long start = (long) (safePage - 1) * safeLimit;
        int fromIndex = (int) Math.min(start, total);
        int toIndex = Math.min(fromIndex + safeLimit, total);
        return new ListingListResponse(List.copyOf(results.subList(fromIndex, toIndex)), total, safePage, safeLimit);
    }

    private Listing loadListing(UUID listingId) {
        return listingStore.findById(listingId)
                .orElseThrow(() -> ListingException.notFound(listingId));
    }

    private List<Listing> resolve(List<UUID> listingIds, boolean availableOnly) {
        return listingIds.stream()
                .map(listingStore::findById)
                .flatMap(Optional::stream)
                .filter(listing -> !availableOnly || listing.isAvailable())
                .sorted(Listing.NEWEST_FIRST)
                .toList();
    }

    private <T> T read(Supplier<T> action) {
        catalogLock.readLock().lock();
        try {
            return action.get();
        } finally {
            catalogLock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        catalogLock.writeLock().lock();
        try {
            return action.get();
        } finally {
            catalogLock.writeLock().unlock();
        }
    }
}
