/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.resilience;

import com.vitrine.domain.model.CircuitState;

import java.time.Instant;

public record CircuitBreakerSnapshot(
        String name,
        CircuitState state,
        int failureCount,
        long successCount,
        long totalCalls,
        Instant lastFailureTime,
        int failureThreshold,
        long resetTimeoutMs
) {}
