package com.listinghub.backend.modules.listing.presentation;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;

import com.listinghub.backend.modules.listing.application.ListingService;
import com.listinghub.backend.modules.listing.presentation.dto.ListingResponse;

@RestController
@RequestMapping("/api/v1/users/{userId}")
public class UserListingController {

    private final ListingService listingService;

    public UserListingController(ListingService listingService) {
        this.listingService = listingService;
    }

    @Operation(summary = "소유 매물 목록", description = "사용자가 등록한 매물을 상태와 무관하게 최신 등록순으로 반환한다.")
    @GetMapping("/properties")
    public ResponseEntity<List<ListingResponse>> getOwnedListings(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(listingService.getOwnedListings(userId));
    }

    @Operation(summary = "관심 매물 목록", description = "사용자가 관심 등록한 매물 중 판매 가능한 것만 최신 등록순으로 반환한다.")
    @GetMapping("/shortlist")
    public ResponseEntity<List<ListingResponse>> getShortlistedListings(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(listingService.getShortlistedListings(userId));
    }

    @Operation(summary = "포트폴리오", description = "소유 매물과 관심 매물을 합쳐 상태와 무관하게 최신 등록순으로 반환한다.")
    @GetMapping("/portfolio")
    public ResponseEntity<List<ListingResponse>> getPortfolio(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(listingService.getPortfolio(userId));
    }
}
