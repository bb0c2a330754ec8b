package com.listinghub.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;

/**
 * Problem body returned for every failed request. {@code type} is derived from the error code
 * in kebab case, e.g. {@code LISTING_ALREADY_SOLD} becomes {@code .../errors/listing-already-sold}.
 * Server errors never echo the underlying exception message.
 */
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    private static final String ERROR_TYPE_PREFIX = "https://listinghub.app/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String safeDetail = httpStatus.is5xxServerError() || detail == null || detail.isBlank()
                ? httpStatus.getReasonPhrase()
                : detail;
        return new ProblemResponse(
                ERROR_TYPE_PREFIX + toTypeSlug(safeCode),
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                safeDetail,
                instance,
                safeCode
        );
    }

    static String toTypeSlug(String code) {
        String slug = code.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
        return slug.isEmpty() ? "about-blank" : slug;
    }
}
