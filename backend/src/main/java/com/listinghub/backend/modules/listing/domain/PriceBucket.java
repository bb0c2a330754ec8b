package com.listinghub.backend.modules.listing.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coarse price band of {@value #BUCKET_SIZE} units. Bucket {@code n} is labelled {@code "<n>00k"},
 * so 250000 falls in {@code "200k"} and 99999 in {@code "000k"}. The number is unbounded so every
 * non-negative price has a bucket.
 */
public record PriceBucket(BigInteger number) implements Comparable<PriceBucket> {

    public static final long BUCKET_SIZE = 100_000L;

    private static final BigDecimal BUCKET_DIVISOR = BigDecimal.valueOf(BUCKET_SIZE);
    private static final Pattern LABEL_PATTERN = Pattern.compile("([0-9]+)00k");

    public PriceBucket {
        if (number == null || number.signum() < 0) {
            throw new IllegalArgumentException("bucket number must be non-negative");
        }
    }

    public PriceBucket(long number) {
        this(BigInteger.valueOf(number));
    }

    public static PriceBucket of(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("price must be non-negative");
        }
        return new PriceBucket(price.divide(BUCKET_DIVISOR, 0, RoundingMode.FLOOR).toBigIntegerExact());
    }

    public static PriceBucket parse(String label) {
        if (label == null) {
            throw new IllegalArgumentException("price bucket label must not be null");
        }
        Matcher matcher = LABEL_PATTERN.matcher(label.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid price bucket label: " + label);
        }
        return new PriceBucket(new BigInteger(matcher.group(1)));
    }

    public String label() {
        return number + "00k";
    }

    @Override
    public int compareTo(PriceBucket other) {
        return number.compareTo(other.number);
    }

    @Override
    public String toString() {
        return label();
    }
}
