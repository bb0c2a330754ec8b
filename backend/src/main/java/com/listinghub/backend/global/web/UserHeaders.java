package com.listinghub.backend.global.web;

import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;

import com.listinghub.backend.global.error.ProblemException;

/**
 * The acting user travels in a plain header; there is no session layer.
 */
public final class UserHeaders {

    public static final String USER_ID_HEADER = "X-User-Id";

    private UserHeaders() {
    }

    public static String requireUserId(String headerValue) {
        if (!StringUtils.hasText(headerValue)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "USER_ID_REQUIRED",
                    USER_ID_HEADER + " header must not be blank");
        }
        return headerValue.trim();
    }
}
