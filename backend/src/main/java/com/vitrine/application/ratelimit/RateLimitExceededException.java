/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.ratelimit;

public class RateLimitExceededException extends RuntimeException {
    private final RateLimitDecision decision;

    public RateLimitExceededException(String message, RateLimitDecision decision) {
        super(message);
        this.decision = decision;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }
}
