/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.ratelimit;

import java.time.Duration;
import java.time.Instant;

public record RateLimitRecord(
        int count,
        Instant firstRequestAt,
        Instant lastRequestAt
) {
    static RateLimitRecord first(Instant now) {
        return new RateLimitRecord(1, now, now);
    }

    RateLimitRecord increment(Instant now) {
        return new RateLimitRecord(count + 1, firstRequestAt, now);
    }

    boolean isExpired(Instant now, Duration window) {
        return Duration.between(firstRequestAt, now).compareTo(window) > 0;
    }
}
