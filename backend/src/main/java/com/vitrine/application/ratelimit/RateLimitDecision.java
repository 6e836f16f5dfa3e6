/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.ratelimit;

public record RateLimitDecision(
        boolean allowed,
        Long retryAfterSeconds,
        int limit,
        int remaining,
        long windowSeconds
) {
    public static RateLimitDecision allow(int limit, int remaining, long windowSeconds) {
        return new RateLimitDecision(true, null, limit, remaining, windowSeconds);
    }

    public static RateLimitDecision deny(int limit, long retryAfterSeconds, long windowSeconds) {
        return new RateLimitDecision(false, retryAfterSeconds, limit, 0, windowSeconds);
    }
}
