/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.api;

import com.vitrine.application.ratelimit.RateLimitDecision;
import com.vitrine.application.ratelimit.RateLimitExceededException;
import com.vitrine.application.ratelimit.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

@Component
public class RateLimitGuard {
    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String WINDOW_HEADER = "X-RateLimit-Window";

    private final ClientKeyResolver clientKeyResolver;

    public RateLimitGuard(ClientKeyResolver clientKeyResolver) {
        this.clientKeyResolver = clientKeyResolver;
    }

    /**
     * Admits the request or throws {@link RateLimitExceededException}. Admitted responses carry the informational headers.
     */
    public RateLimitDecision check(RateLimiter limiter, HttpServletRequest request, HttpServletResponse response) {
        RateLimitDecision decision = limiter.admit(clientKeyResolver.resolve(request));
        if (!decision.allowed()) {
            throw new RateLimitExceededException("Too many requests", decision);
        }
        writeHeaders(decision, response);
        return decision;
    }

    static void writeHeaders(RateLimitDecision decision, HttpServletResponse response) {
        response.setHeader(LIMIT_HEADER, String.valueOf(decision.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        response.setHeader(WINDOW_HEADER, String.valueOf(decision.windowSeconds()));
    }

    public static HttpHeaders headersFor(RateLimitDecision decision) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(LIMIT_HEADER, String.valueOf(decision.limit()));
        headers.set(REMAINING_HEADER, String.valueOf(decision.remaining()));
        headers.set(WINDOW_HEADER, String.valueOf(decision.windowSeconds()));
        if (decision.retryAfterSeconds() != null) {
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        }
        return headers;
    }
}
