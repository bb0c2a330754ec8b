package com.listinghub.backend.modules.listing.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PriceBucketTest {

    @Test
    @DisplayName("가격을 10만 단위로 내림해 버킷 라벨을 만든다")
    void labelFloorsPriceIntoHundredThousandBuckets() {
        assertThat(PriceBucket.of(new BigDecimal("0")).label()).isEqualTo("000k");
        assertThat(PriceBucket.of(new BigDecimal("99999.99")).label()).isEqualTo("000k");
        assertThat(PriceBucket.of(new BigDecimal("100000")).label()).isEqualTo("100k");
        assertThat(PriceBucket.of(new BigDecimal("250000")).label()).isEqualTo("200k");
        assertThat(PriceBucket.of(new BigDecimal("550000")).label()).isEqualTo("500k");
        assertThat(PriceBucket.of(new BigDecimal("1250000")).label()).isEqualTo("1200k");
    }

    @Test
    @DisplayName("long 범위를 넘는 가격도 버킷으로 변환된다")
    void priceBeyondLongRangeHasBucket() {
        PriceBucket huge = PriceBucket.of(new BigDecimal("1E+30"));

        assertThat(huge.number()).isEqualTo(BigInteger.TEN.pow(25));
        assertThat(PriceBucket.parse(huge.label())).isEqualTo(huge);
        assertThat(huge).isGreaterThan(new PriceBucket(Long.MAX_VALUE));
    }

    @Test
    @DisplayName("음수 가격은 예외를 발생시킨다")
    void negativePriceIsRejected() {
        assertThatThrownBy(() -> PriceBucket.of(new BigDecimal("-1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("라벨을 다시 버킷으로 해석한다")
    void parseReadsLabel() {
        assertThat(PriceBucket.parse("200k")).isEqualTo(new PriceBucket(2));
        assertThat(PriceBucket.parse("000k")).isEqualTo(new PriceBucket(0));
        assertThat(PriceBucket.parse("1200k")).isEqualTo(new PriceBucket(12));
        assertThatThrownBy(() -> PriceBucket.parse("2k"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("가격대는 양 끝 버킷을 포함한다")
    void priceRangeIsInclusive() {
        PriceRange range = PriceRange.of(new BigDecimal("200000"), new BigDecimal("599999"));

        assertThat(range.label()).isEqualTo("200k-500k");
        assertThat(range.contains(new PriceBucket(1))).isFalse();
        assertThat(range.contains(new PriceBucket(2))).isTrue();
        assertThat(range.contains(new PriceBucket(5))).isTrue();
        assertThat(range.contains(new PriceBucket(6))).isFalse();
        assertThat(PriceRange.parse("200k-500k")).isEqualTo(range);
        assertThat(PriceRange.parse("300k")).isEqualTo(new PriceRange(new PriceBucket(3), new PriceBucket(3)));
    }

    @Test
    @DisplayName("하한이 상한보다 크면 예외를 발생시킨다")
    void invertedRangeIsRejected() {
        assertThatThrownBy(() -> PriceRange.of(new BigDecimal("500000"), new BigDecimal("100000")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
