/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.ratelimit;

import java.time.Duration;

public record RateLimitPolicy(
        String keyPrefix,
        Duration window,
        int maxRequests,
        int storeCap
) {
    public RateLimitPolicy {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("rate limit window must be positive");
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1");
        }
        if (storeCap < 1) {
            throw new IllegalArgumentException("storeCap must be >= 1");
        }
        keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }
}
