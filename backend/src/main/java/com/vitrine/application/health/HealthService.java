/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.health;

import com.vitrine.application.cache.CustomerCache;
import com.vitrine.application.conversion.DuplicateTransactionSuppressor;
import com.vitrine.application.ratelimit.RateLimiter;
import com.vitrine.application.resilience.CircuitBreakerRegistry;
import com.vitrine.application.resilience.CircuitBreakerSnapshot;
import com.vitrine.domain.model.CircuitState;
import com.vitrine.domain.model.Upstream;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds breaker states into one status: an open breaker on a critical upstream is UNHEALTHY,
 * any other open or half-open breaker is DEGRADED.
 */
@Service
public class HealthService {
    static final Set<String> CRITICAL = Set.of(Upstream.STRIPE.breakerName(), Upstream.TAG_SERVER.breakerName());

    private final CircuitBreakerRegistry breakers;
    private final CustomerCache customerCache;
    private final DuplicateTransactionSuppressor suppressor;
    private final List<RateLimiter> rateLimiters;
    private final Clock clock;

    public HealthService(
            CircuitBreakerRegistry breakers,
            CustomerCache customerCache,
            DuplicateTransactionSuppressor suppressor,
            List<RateLimiter> rateLimiters,
            Clock clock
    ) {
        this.breakers = breakers;
        this.customerCache = customerCache;
        this.suppressor = suppressor;
        this.rateLimiters = rateLimiters;
        this.clock = clock;
    }

    public HealthReport report() {
        List<CircuitBreakerSnapshot> snapshots = breakers.snapshots();

        Map<String, Integer> limiterKeys = new LinkedHashMap<>();
        for (RateLimiter limiter : rateLimiters) {
            limiterKeys.put(limiter.name(), limiter.size());
        }

        return new HealthReport(
                status(snapshots),
                clock.instant(),
                snapshots,
                List.of(customerCache.stats(), suppressor.stats()),
                limiterKeys
        );
    }

    static HealthReport.HealthStatus status(List<CircuitBreakerSnapshot> snapshots) {
        HealthReport.HealthStatus status = HealthReport.HealthStatus.HEALTHY;
        for (CircuitBreakerSnapshot s : snapshots) {
            if (s.state() == CircuitState.OPEN && CRITICAL.contains(s.name())) {
                return HealthReport.HealthStatus.UNHEALTHY;
            }
            if (s.state() != CircuitState.CLOSED) {
                status = HealthReport.HealthStatus.DEGRADED;
            }
        }
        return status;
    }
}
