package com.listinghub.backend.modules.listing.infrastructure.memory;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ListingDirectoryTest {

    private static final UUID FIRST = UUID.fromString("00000000-0000-0000-0000-000000000011");
    private static final UUID SECOND = UUID.fromString("00000000-0000-0000-0000-000000000012");

    private final ListingDirectory directory = new ListingDirectory();

    @Test
    @DisplayName("같은 매물을 두 번 관심 등록하면 두 번째는 거절된다")
    void recordShortlistRejectsDuplicates() {
        assertThat(directory.recordShortlist("u2", FIRST)).isTrue();
        assertThat(directory.recordShortlist("u2", FIRST)).isFalse();

        assertThat(directory.shortlisted("u2")).containsExactly(FIRST);
    }

    @Test
    @DisplayName("소유한 매물은 관심 등록할 수 없다")
    void recordShortlistRejectsOwnedListing() {
        directory.recordOwnership("u1", FIRST);

        assertThat(directory.recordShortlist("u1", FIRST)).isFalse();
        assertThat(directory.shortlisted("u1")).isEmpty();
    }

    @Test
    @DisplayName("소유와 관심 관계는 분리되고 포트폴리오는 둘을 합친다")
    void ownershipAndShortlistAreSeparateRelations() {
        directory.recordOwnership("u1", FIRST);
        directory.recordShortlist("u1", SECOND);

        assertThat(directory.owned("u1")).containsExactly(FIRST);
        assertThat(directory.shortlisted("u1")).containsExactly(SECOND);
        assertThat(directory.portfolio("u1")).containsExactly(FIRST, SECOND);
        assertThat(directory.portfolio("unknown")).isEmpty();
    }
}
