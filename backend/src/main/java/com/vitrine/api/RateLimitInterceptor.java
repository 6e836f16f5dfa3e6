/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.api;

import com.vitrine.application.ratelimit.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Counts a submission against its limiter before the body is bound or validated,
 * so rejected payloads use up the quota as well.
 */
public class RateLimitInterceptor implements HandlerInterceptor {
    private final RateLimitGuard rateLimitGuard;
    private final RateLimiter rateLimiter;

    public RateLimitInterceptor(RateLimitGuard rateLimitGuard, RateLimiter rateLimiter) {
        this.rateLimitGuard = rateLimitGuard;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (HttpMethod.POST.matches(request.getMethod())) {
            rateLimitGuard.check(rateLimiter, request, response);
        }
        return true;
    }
}
