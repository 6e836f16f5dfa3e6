/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.resilience;

import com.vitrine.domain.model.Upstream;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;

/**
 * One breaker per upstream, built once by the composition root.
 */
public class CircuitBreakerRegistry {

    private final EnumMap<Upstream, CircuitBreaker> breakersByUpstream;

    public CircuitBreakerRegistry(int failureThreshold, Duration resetTimeout, Clock clock) {
        EnumMap<Upstream, CircuitBreaker> registry = new EnumMap<>(Upstream.class);
        for (Upstream upstream : Upstream.values()) {
            registry.put(upstream, new CircuitBreaker(upstream.breakerName(), failureThreshold, resetTimeout, clock));
        }
        this.breakersByUpstream = registry;
    }

    public CircuitBreaker get(Upstream upstream) {
        CircuitBreaker breaker = breakersByUpstream.get(upstream);
        if (breaker == null) {
            throw new IllegalArgumentException("No circuit breaker registered for upstream=" + upstream);
        }
        return breaker;
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakersByUpstream.values().stream().map(CircuitBreaker::snapshot).toList();
    }
}
