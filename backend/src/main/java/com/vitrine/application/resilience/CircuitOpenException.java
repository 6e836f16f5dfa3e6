/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.resilience;

import java.time.Instant;

/**
 * Thrown without calling the upstream while its breaker is OPEN.
 */
public class CircuitOpenException extends RuntimeException {
    private final String breakerName;
    private final Instant retryAt;

    public CircuitOpenException(String breakerName, Instant retryAt) {
        super("Circuit breaker is OPEN for " + breakerName);
        this.breakerName = breakerName;
        this.retryAt = retryAt;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public Instant getRetryAt() {
        return retryAt;
    }
}
