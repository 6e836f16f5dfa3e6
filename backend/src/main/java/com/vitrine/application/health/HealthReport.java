/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.health;

import com.vitrine.application.cache.CacheStats;
import com.vitrine.application.resilience.CircuitBreakerSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record HealthReport(
        HealthStatus status,
        Instant timestamp,
        List<CircuitBreakerSnapshot> circuitBreakers,
        List<CacheStats> caches,
        Map<String, Integer> rateLimiterKeys
) {
    public enum HealthStatus {
        HEALTHY,
        DEGRADED,
        UNHEALTHY
    }
}
