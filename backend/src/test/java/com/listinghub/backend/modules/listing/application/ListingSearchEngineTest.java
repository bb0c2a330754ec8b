package com.listinghub.backend.modules.listing.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.listinghub.backend.modules.listing.domain.Listing;
import com.listinghub.backend.modules.listing.domain.ListingAttributes;
import com.listinghub.backend.modules.listing.domain.ListingStatus;
import com.listinghub.backend.modules.listing.domain.PriceRange;
import com.listinghub.backend.modules.listing.domain.SearchCriteria;
import com.listinghub.backend.modules.listing.infrastructure.memory.FacetIndex;
import com.listinghub.backend.modules.listing.infrastructure.memory.ListingStore;

class ListingSearchEngineTest {

    private ListingStore store;
    private FacetIndex facetIndex;
    private ListingSearchEngine searchEngine;

    private Listing austinCondo;
    private Listing austinHouse;
    private Listing dallasCondo;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        store = new ListingStore(clock);
        facetIndex = new FacetIndex();
        searchEngine = new ListingSearchEngine(facetIndex, store);

        austinCondo = create("Austin", "250000", "condo");
        austinHouse = create("Austin", "550000", "house");
        dallasCondo = create("Dallas", "150000", "condo");
    }

    @Test
    @DisplayName("지역 조건은 최신 등록순으로 반환된다")
    void searchByLocationReturnsNewestFirst() {
        assertThat(searchEngine.search(SearchCriteria.byLocation("Austin")))
                .containsExactly(austinHouse, austinCondo);
    }

    @Test
    @DisplayName("여러 조건은 합집합으로 평가된다")
    void criteriaAreUnioned() {
        SearchCriteria criteria = new SearchCriteria("Dallas", "house", null);

        assertThat(searchEngine.search(criteria)).containsExactly(dallasCondo, austinHouse);
    }

    @Test
    @DisplayName("가격대 조건은 범위 안의 모든 버킷을 찾는다")
    void priceRangeMatchesEveryBucketInRange() {
        SearchCriteria criteria = SearchCriteria.byPriceRange(PriceRange.parse("100k-200k"));

        assertThat(searchEngine.search(criteria)).containsExactly(dallasCondo, austinCondo);
    }

    @Test
    @DisplayName("조건이 없으면 빈 결과를 반환한다")
    void emptyCriteriaMatchNothing() {
        assertThat(searchEngine.search(SearchCriteria.none())).isEmpty();
        assertThat(searchEngine.search(null)).isEmpty();
    }

    @Test
    void unknownFacetValueContributesNothing() {
        assertThat(searchEngine.search(SearchCriteria.byLocation("Boston"))).isEmpty();
        assertThat(searchEngine.search(new SearchCriteria("Boston", "condo", null)))
                .containsExactly(dallasCondo, austinCondo);
    }

    @Test
    @DisplayName("값은 facet별로 비교되므로 유형 이름을 지역으로 검색하면 찾지 못한다")
    void lookupIsFacetAware() {
        assertThat(searchEngine.search(SearchCriteria.byLocation("condo"))).isEmpty();
    }

    @Test
    @DisplayName("색인이 늦더라도 판매된 매물은 저장소 재확인으로 제외된다")
    void soldListingsAreFilteredEvenWhenIndexLags() {
        austinCondo.setStatus(ListingStatus.SOLD);

        assertThat(searchEngine.search(SearchCriteria.byLocation("Austin")))
                .containsExactly(austinHouse);
    }

    private Listing create(String location, String price, String propertyType) {
        ListingAttributes attributes = ListingAttributes.of(location, new BigDecimal(price), propertyType);
        Listing listing = store.create("owner", attributes);
        facetIndex.indexOnCreate(listing.getId(), attributes);
        return listing;
    }
}
