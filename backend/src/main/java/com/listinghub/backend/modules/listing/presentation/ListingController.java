package com.listinghub.backend.modules.listing.presentation;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.listinghub.backend.global.error.ProblemException;
import com.listinghub.backend.global.web.UserHeaders;
import com.listinghub.backend.modules.listing.application.ListingService;
import com.listinghub.backend.modules.listing.domain.Facet;
import com.listinghub.backend.modules.listing.domain.PriceRange;
import com.listinghub.backend.modules.listing.domain.SearchCriteria;
import com.listinghub.backend.modules.listing.presentation.dto.CatalogStatsResponse;
import com.listinghub.backend.modules.listing.presentation.dto.CreateListingRequest;
import com.listinghub.backend.modules.listing.presentation.dto.CreateListingResponse;
import com.listinghub.backend.modules.listing.presentation.dto.ListingDtoMapper;
import com.listinghub.backend.modules.listing.presentation.dto.ListingListResponse;
import com.listinghub.backend.modules.listing.presentation.dto.ListingResponse;
import com.listinghub.backend.modules.listing.presentation.dto.UpdateListingStatusRequest;

@RestController
@RequestMapping("/api/v1/properties")
public class ListingController {

    private final ListingService listingService;

    public ListingController(ListingService listingService) {
        this.listingService = listingService;
    }

    @Operation(summary = "매물 등록", description = "요청한 사용자를 소유자로 하는 매물을 판매 가능 상태로 등록한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "매물 등록 성공"),
            @ApiResponse(responseCode = "422", description = "입력값 검증 실패 – code 값이 `validation_error`")
    })
    @PostMapping
    public ResponseEntity<CreateListingResponse> createListing(
            @RequestHeader(name = UserHeaders.USER_ID_HEADER, required = false) String userId,
            @Valid @RequestBody CreateListingRequest request
    ) {
        String ownerId = UserHeaders.requireUserId(userId);
        return ResponseEntity.status(201)
                .body(listingService.createListing(ownerId, ListingDtoMapper.toAttributes(request)));
    }

    @GetMapping
    public ResponseEntity<ListingListResponse> getAllListings(
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(listingService.getAllListings(page, limit));
    }

    @Operation(
            summary = "매물 검색",
            description = """
                    지역, 매물 유형, 가격대 조건 중 하나라도 일치하는 판매 가능 매물을 최신 등록순으로 반환한다. \
                    가격대 조건은 `minPrice`와 `maxPrice`가 모두 있을 때만 적용되며, 조건이 없으면 빈 결과가 반환된다.
                    """
    )
    @GetMapping("/search")
    public ResponseEntity<ListingListResponse> search(
            @RequestParam(name = "location", required = false) String location,
            @RequestParam(name = "propertyType", required = false) String propertyType,
            @RequestParam(name = "minPrice", required = false) BigDecimal minPrice,
            @RequestParam(name = "maxPrice", required = false) BigDecimal maxPrice,
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        SearchCriteria criteria = new SearchCriteria(
                trimToNull(location),
                trimToNull(propertyType),
                toPriceRange(minPrice, maxPrice)
        );
        return ResponseEntity.ok(listingService.search(criteria, page, limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<CatalogStatsResponse> getStats() {
        return ResponseEntity.ok(listingService.getStats());
    }

    @GetMapping("/facets/{facet}")
    public ResponseEntity<List<String>> getFacetValues(@PathVariable("facet") String facet) {
        try {
            return ResponseEntity.ok(listingService.getFacetValues(Facet.fromFieldName(facet)));
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "FACET_NOT_FOUND", ex.getMessage());
        }
    }

    @GetMapping("/{propertyId}")
    public ResponseEntity<ListingResponse> getListing(@PathVariable("propertyId") UUID propertyId) {
        return ResponseEntity.ok(listingService.getListing(propertyId));
    }

    @Operation(summary = "매물 상태 변경", description = "소유자만 `available`과 `sold` 사이로 상태를 바꿀 수 있다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "상태 변경 성공"),
            @ApiResponse(responseCode = "403", description = "소유자가 아님 – code 값이 `NOT_LISTING_OWNER`"),
            @ApiResponse(responseCode = "404", description = "매물 없음 – code 값이 `LISTING_NOT_FOUND`"),
            @ApiResponse(responseCode = "409", description = "허용되지 않는 상태 전이 – 예: `LISTING_ALREADY_SOLD`")
    })
    @PatchMapping("/{propertyId}/status")
    public ResponseEntity<ListingResponse> changeStatus(
            @RequestHeader(name = UserHeaders.USER_ID_HEADER, required = false) String userId,
            @PathVariable("propertyId") UUID propertyId,
            @Valid @RequestBody UpdateListingStatusRequest request
    ) {
        String actingUserId = UserHeaders.requireUserId(userId);
        return ResponseEntity.ok(listingService.changeStatus(propertyId, request.status(), actingUserId));
    }

    @Operation(summary = "관심 매물 추가")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "관심 매물 추가 성공"),
            @ApiResponse(responseCode = "409", description = "이미 추가했거나 판매 완료된 매물")
    })
    @PostMapping("/{propertyId}/shortlist")
    public ResponseEntity<Void> shortlist(
            @RequestHeader(name = UserHeaders.USER_ID_HEADER, required = false) String userId,
            @PathVariable("propertyId") UUID propertyId
    ) {
        listingService.shortlist(UserHeaders.requireUserId(userId), propertyId);
        return ResponseEntity.noContent().build();
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private static PriceRange toPriceRange(BigDecimal minPrice, BigDecimal maxPrice) {
        if (minPrice == null || maxPrice == null) {
            return null;
        }
        try {
            return PriceRange.of(minPrice, maxPrice);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_PRICE_RANGE", ex.getMessage());
        }
    }
}
