/*
 * Copyright (C) 2025 Vitrine Edge
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.vitrine.application.resilience;

import com.vitrine.domain.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Failure isolator for a single upstream dependency.
 *
 * <p>Bookkeeping is synchronized but the guarded operation always runs outside the lock,
 * so a slow upstream never blocks callers that only need to be rejected.
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private long successCount;
    private long totalCalls;
    private Instant lastFailureTime;

    public CircuitBreaker(String name, int failureThreshold, Duration resetTimeout, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("circuit breaker name is required");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (resetTimeout == null || resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be >= 0");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
    }

    public <T> T execute(Supplier<T> operation) {
        acquirePermission();
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            onFailure();
            throw e;
        }
        onSuccess();
        return result;
    }

    public void execute(Runnable operation) {
        execute(() -> {
            operation.run();
            return null;
        });
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(
                name,
                state,
                failureCount,
                successCount,
                totalCalls,
                lastFailureTime,
                failureThreshold,
                resetTimeout.toMillis()
        );
    }

    public synchronized void reset() {
        CircuitState previous = state;
        state = CircuitState.CLOSED;
        failureCount = 0;
        lastFailureTime = null;
        log.info("Circuit breaker reset name={} previousState={}", name, previous);
    }

    public String name() {
        return name;
    }

    public synchronized CircuitState state() {
        return state;
    }

    private synchronized void acquirePermission() {
        totalCalls++;
        if (state != CircuitState.OPEN) return;

        Instant now = clock.instant();
        if (lastFailureTime != null && Duration.between(lastFailureTime, now).compareTo(resetTimeout) < 0) {
            throw new CircuitOpenException(name, lastFailureTime.plus(resetTimeout));
        }
        state = CircuitState.HALF_OPEN;
        log.info("Circuit breaker transitioning to HALF_OPEN name={}", name);
    }

    private synchronized void onSuccess() {
        successCount++;
        failureCount = 0;
        if (state == CircuitState.HALF_OPEN) {
            state = CircuitState.CLOSED;
            log.info("Circuit breaker CLOSED name={}", name);
        }
    }

    private synchronized void onFailure() {
        failureCount++;
        lastFailureTime = clock.instant();
        if (failureCount >= failureThreshold && state != CircuitState.OPEN) {
            CircuitState previous = state;
            state = CircuitState.OPEN;
            log.warn("Circuit breaker OPENED name={} failures={} previousState={}", name, failureCount, previous);
        }
    }
}
