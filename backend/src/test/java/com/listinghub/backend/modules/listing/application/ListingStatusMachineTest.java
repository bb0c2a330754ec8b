package com.listinghub.backend.modules.listing.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.listinghub.backend.modules.listing.domain.Listing;
import com.listinghub.backend.modules.listing.domain.ListingAttributes;
import com.listinghub.backend.modules.listing.domain.ListingErrorKind;
import com.listinghub.backend.modules.listing.domain.ListingException;
import com.listinghub.backend.modules.listing.domain.ListingStatus;
import com.listinghub.backend.modules.listing.infrastructure.memory.FacetIndex;

@ExtendWith(MockitoExtension.class)
class ListingStatusMachineTest {

    @Mock
    private FacetIndex facetIndex;

    private ListingStatusMachine statusMachine;
    private Listing listing;

    @BeforeEach
    void setUp() {
        statusMachine = new ListingStatusMachine(facetIndex);
        listing = new Listing(
                UUID.fromString("00000000-0000-0000-0000-000000000101"),
                "u1",
                ListingAttributes.of("Austin", new BigDecimal("250000"), "condo"),
                OffsetDateTime.parse("2025-01-01T00:00:00Z")
        );
    }

    @Test
    @DisplayName("판매 가능 매물을 판매 완료로 바꾸면 판매 가능 색인에서 제거한다")
    void availableToSoldDrivesMarkSold() {
        statusMachine.transition(listing, ListingStatus.SOLD);

        verify(facetIndex).markSold(listing.getId());
        assertThat(listing.getStatus()).isEqualTo(ListingStatus.SOLD);
    }

    @Test
    @DisplayName("판매 완료 매물을 다시 판매 가능으로 바꾸면 색인에 다시 넣는다")
    void soldToAvailableDrivesMarkAvailable() {
        listing.setStatus(ListingStatus.SOLD);

        statusMachine.transition(listing, ListingStatus.AVAILABLE);

        verify(facetIndex).markAvailable(listing.getId());
        assertThat(listing.getStatus()).isEqualTo(ListingStatus.AVAILABLE);
    }

    @Test
    @DisplayName("이미 판매된 매물을 다시 판매하면 INVALID_TRANSITION이고 색인은 건드리지 않는다")
    void soldToSoldIsRejected() {
        listing.setStatus(ListingStatus.SOLD);

        assertThatThrownBy(() -> statusMachine.transition(listing, ListingStatus.SOLD))
                .isInstanceOf(ListingException.class)
                .extracting("code")
                .isEqualTo("LISTING_ALREADY_SOLD");
        verify(facetIndex, never()).markSold(listing.getId());
    }

    @Test
    void availableToAvailableIsRejected() {
        assertThatThrownBy(() -> statusMachine.transition(listing, ListingStatus.AVAILABLE))
                .isInstanceOf(ListingException.class)
                .extracting("kind")
                .isEqualTo(ListingErrorKind.INVALID_TRANSITION);
        verify(facetIndex, never()).markAvailable(listing.getId());
    }

    @Test
    @DisplayName("색인 불일치로 실패하면 매물 상태는 그대로 남는다")
    void indexMismatchLeavesStatusUnchanged() {
        doThrow(ListingException.invalidTransition("AVAILABILITY_INDEX_MISMATCH", "missing"))
                .when(facetIndex).markSold(listing.getId());

        assertThatThrownBy(() -> statusMachine.transition(listing, ListingStatus.SOLD))
                .isInstanceOf(ListingException.class);
        assertThat(listing.getStatus()).isEqualTo(ListingStatus.AVAILABLE);
    }
}
